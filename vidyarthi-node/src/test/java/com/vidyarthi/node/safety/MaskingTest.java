package com.vidyarthi.node.safety;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MaskingTest {

    @Test
    void maskEmail_keepsFirstAndLastCharacterOfName() {
        assertThat(Masking.maskEmail("john.doe@example.com")).isEqualTo("j******e@example.com");
        assertThat(Masking.maskEmail("ab@example.com")).isEqualTo("a***@example.com");
        assertThat(Masking.maskEmail("@example.com")).isEqualTo("***@example.com");
        assertThat(Masking.maskEmail("not-an-email")).isEqualTo("not-an-email");
    }

    @Test
    void maskPhone_keepsLastFourDigits() {
        assertThat(Masking.maskPhone("9876543210")).isEqualTo("******3210");
        assertThat(Masking.maskPhone("123")).isEqualTo("123");
    }

    @Test
    void maskToken_keepsPrefix() {
        assertThat(Masking.maskToken("sk-abcdef")).isEqualTo("sk-a*****");
        assertThat(Masking.maskToken("abc")).isEqualTo("***");
        assertThat(Masking.maskToken("https://openrouter.ai/api/v1/chat", 20))
                .startsWith("https://openrouter.a")
                .hasSize("https://openrouter.ai/api/v1/chat".length());
    }

    @Test
    void maskUrl_showsTwentyCharacters() {
        String masked = Masking.maskUrl("https://evil.example.com/steal?token=secret");

        assertThat(masked).startsWith("https://evil.example");
        assertThat(masked).doesNotContain("secret");
    }

    @Test
    void fingerprint_isStableEightHex() {
        String first = Masking.fingerprint("student@example.com");

        assertThat(first).matches("[0-9a-f]{8}");
        assertThat(Masking.fingerprint("student@example.com")).isEqualTo(first);
        assertThat(Masking.fingerprint("mentor@example.com")).isNotEqualTo(first);
        assertThat(Masking.fingerprint("")).isEmpty();
    }
}
