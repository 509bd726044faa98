package com.vidyarthi.node.store;

import com.vidyarthi.node.store.KeyValueStore.StoreException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileKeyValueStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void values_surviveReopen() {
        // Given
        Path file = tempDir.resolve("nested/prefs.json");
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);
        store.setString(StoreKeys.CONSENT_VERSION, "1.0.0");
        store.setBoolean(StoreKeys.CONSENT, true);
        store.setLong("lessons_completed", 7);
        store.setDouble("quiz_average", 81.5);
        store.setStringList(StoreKeys.DATA_ACCESS_LOG, List.of("{\"a\":1}", "{\"b\":2}"));

        // When
        JsonFileKeyValueStore reopened = new JsonFileKeyValueStore(file);

        // Then
        assertThat(Files.exists(file)).isTrue();
        assertThat(reopened.getString(StoreKeys.CONSENT_VERSION)).contains("1.0.0");
        assertThat(reopened.getBoolean(StoreKeys.CONSENT)).contains(true);
        assertThat(reopened.getLong("lessons_completed")).contains(7L);
        assertThat(reopened.getDouble("quiz_average")).contains(81.5);
        assertThat(reopened.getStringList(StoreKeys.DATA_ACCESS_LOG)).contains(List.of("{\"a\":1}", "{\"b\":2}"));
    }

    @Test
    void removeAndClear_arePersisted() {
        Path file = tempDir.resolve("prefs.json");
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);
        store.setString("a", "1");
        store.setString("b", "2");

        store.remove("a");
        assertThat(new JsonFileKeyValueStore(file).keys()).containsExactly("b");

        store.clear();
        assertThat(new JsonFileKeyValueStore(file).keys()).isEmpty();
    }

    @Test
    void noTemporaryFileLeftBehind() {
        Path file = tempDir.resolve("prefs.json");
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);

        store.setString("a", "1");

        assertThat(Files.exists(tempDir.resolve("prefs.json.tmp"))).isFalse();
    }

    @Test
    void corruptDocument_failsToOpen() throws Exception {
        Path file = tempDir.resolve("prefs.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new JsonFileKeyValueStore(file))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("Failed to read");
    }

    @Test
    void failedWrite_leavesMemoryUnchanged() throws Exception {
        // Given a path whose parent is a regular file, so writes cannot succeed
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(blocker.resolve("prefs.json"));

        // When/Then
        assertThatThrownBy(() -> store.setString("a", "1")).isInstanceOf(StoreException.class);
        assertThat(store.contains("a")).isFalse();
    }

    @Test
    void failedClear_leavesMemoryUnchanged() throws Exception {
        // Given a store whose document path turns into a non-empty directory
        Path file = tempDir.resolve("prefs.json");
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file);
        store.setString("student_name", "Asha");
        store.setBoolean(StoreKeys.ERASURE_PENDING, true);
        Files.delete(file);
        Files.createDirectories(file);
        Files.writeString(file.resolve("occupied"), "x");

        // When/Then
        assertThatThrownBy(store::clear).isInstanceOf(StoreException.class);
        assertThat(store.keys()).containsExactlyInAnyOrder("student_name", StoreKeys.ERASURE_PENDING);
        assertThat(store.getBoolean(StoreKeys.ERASURE_PENDING)).contains(true);
    }
}
