package com.acme.pgprecheck.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PrecheckConfig")
class PrecheckConfigTest {

    @Test
    @DisplayName("defaults")
    void defaults() {
        PrecheckConfig c = PrecheckConfig.DEFAULTS;

        assertThat(c.probeTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(c.connectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(c.workers()).isEqualTo(4);
        assertThat(c.sslMode()).isEqualTo("require");
        assertThat(c.reportDir()).isEqualTo(".");
        assertThat(c.jsonReportEnabled()).isTrue();
    }

    @Test
    @DisplayName("rejects non-positive timeouts and worker counts")
    void rejectsInvalid() {
        assertThatThrownBy(() -> PrecheckConfig.builder().probeTimeoutSeconds(0)).isInstanceOf(PrecheckConfigException.class);
        assertThatThrownBy(() -> PrecheckConfig.builder().connectTimeout(Duration.ofSeconds(-1))).isInstanceOf(PrecheckConfigException.class);
        assertThatThrownBy(() -> PrecheckConfig.builder().workers(0)).isInstanceOf(PrecheckConfigException.class);
    }

    @Test
    @DisplayName("toString never needs credentials")
    void toStringShape() {
        assertThat(PrecheckConfig.DEFAULTS.toString()).contains("workers=4").doesNotContain("password");
    }
}
