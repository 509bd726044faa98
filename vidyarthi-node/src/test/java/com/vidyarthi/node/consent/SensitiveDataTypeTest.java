package com.vidyarthi.node.consent;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SensitiveDataTypeTest {

    @Test
    void retentionPeriods() {
        assertThat(SensitiveDataType.PERSONAL_IDENTIFIABLE.retention()).isEqualTo(Duration.ofDays(1095));
        assertThat(SensitiveDataType.FINANCIAL.retention()).isEqualTo(Duration.ofDays(2555));
        assertThat(SensitiveDataType.HEALTH.retention()).isEqualTo(Duration.ofDays(1825));
        assertThat(SensitiveDataType.LOCATION.retention()).isEqualTo(Duration.ofDays(90));
        assertThat(SensitiveDataType.BIOMETRIC.retention()).isEqualTo(Duration.ofDays(365));
        assertThat(SensitiveDataType.EDUCATIONAL.retention()).isEqualTo(Duration.ofDays(3650));
    }

    @Test
    void healthAndBiometricData_areNeverShared() {
        for (SensitiveDataType type : SensitiveDataType.values()) {
            boolean restricted = type == SensitiveDataType.HEALTH || type == SensitiveDataType.BIOMETRIC;
            assertThat(type.shareableWithThirdParty()).isEqualTo(!restricted);
            assertThat(type.requiresEncryption()).isTrue();
        }
    }

    @Test
    void isPastRetention() {
        Instant collected = Instant.parse("2025-01-01T00:00:00Z");

        assertThat(SensitiveDataType.LOCATION.isPastRetention(collected, collected.plus(Duration.ofDays(89)))).isFalse();
        assertThat(SensitiveDataType.LOCATION.isPastRetention(collected, collected.plus(Duration.ofDays(90)))).isTrue();
    }
}
