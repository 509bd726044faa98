package com.vidyarthi.node.consent;

import com.vidyarthi.node.common.Outcome;
import com.vidyarthi.node.key.KeyVault;
import com.vidyarthi.node.store.FlakyKeyValueStore;
import com.vidyarthi.node.store.StoreKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DataErasureServiceTest {

    private FlakyKeyValueStore store;
    private KeyVault vault;
    private ConsentLedger ledger;
    private DataErasureService erasure;

    @BeforeEach
    void setUp() {
        store = new FlakyKeyValueStore();
        vault = new KeyVault(store);
        ledger = new ConsentLedger(store);
        erasure = new DataErasureService(store, ledger, vault);

        vault.ensureKey();
        ledger.recordConsent(ConsentGrants.of(true, true), false, false);
        ledger.logAccess("profile", "dashboard");
        store.setString("student_name", "Asha");
    }

    @Test
    void eraseEverything_removesKeyAndAllData() {
        Outcome<Void> outcome = erasure.eraseEverything();

        assertThat(outcome.isOk()).isTrue();
        assertThat(store.keys()).isEmpty();
        assertThat(erasure.isErasurePending()).isFalse();
        assertThat(erasure.resumePendingErasure()).isEqualTo(Outcome.ok(false));
    }

    @Test
    void interruptedErasure_isResumed() {
        // Given the key wipe fails after the marker is written
        store.failWritesTo(StoreKeys.ENCRYPTION_KEY);

        // When
        Outcome<Void> first = erasure.eraseEverything();

        // Then the marker survives
        assertThat(first).isInstanceOf(Outcome.Failed.class);
        assertThat(erasure.isErasurePending()).isTrue();
        assertThat(store.contains("student_name")).isTrue();

        // When the store recovers
        store.failWritesTo(null);
        Outcome<Boolean> resumed = erasure.resumePendingErasure();

        // Then
        assertThat(resumed).isEqualTo(Outcome.ok(true));
        assertThat(store.keys()).isEmpty();
    }

    @Test
    void failedStoreClear_keepsMarkerForResume() {
        // Given
        DataErasureService failingClear = new DataErasureService(store, new ConsentLedger(store) {
            @Override
            public Outcome<Void> eraseAll() {
                return Outcome.failed("Data erasure failed");
            }
        }, vault);

        // When
        Outcome<Void> outcome = failingClear.eraseEverything();

        // Then the key is already gone but the marker remains
        assertThat(outcome).isInstanceOf(Outcome.Failed.class);
        assertThat(store.contains(StoreKeys.ENCRYPTION_KEY)).isFalse();
        assertThat(store.getBoolean(StoreKeys.ERASURE_PENDING)).contains(true);

        assertThat(erasure.resumePendingErasure()).isEqualTo(Outcome.ok(true));
        assertThat(store.keys()).isEmpty();
    }

    @Test
    void markerCannotBeWritten_nothingIsErased() {
        store.failWritesTo(StoreKeys.ERASURE_PENDING);

        Outcome<Void> outcome = erasure.eraseEverything();

        assertThat(outcome.reason()).contains("Erasure could not be started");
        assertThat(store.contains(StoreKeys.ENCRYPTION_KEY)).isTrue();
        assertThat(store.contains("student_name")).isTrue();
    }
}
