package com.acme.pgprecheck;

import com.acme.pgprecheck.exceptions.InputValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PrecheckContext")
class PrecheckContextTest {

    @Test
    @DisplayName("accepts a well-formed argument set")
    void valid() throws Exception {
        PrecheckContext ctx = PrecheckContext.fromArgs("mycluster.cluster-abc.us-east-1.rds.amazonaws.com", "5432", "postgres", "16");

        assertThat(ctx.host).isEqualTo("mycluster.cluster-abc.us-east-1.rds.amazonaws.com");
        assertThat(ctx.port).isEqualTo(5432);
        assertThat(ctx.user).isEqualTo("postgres");
        assertThat(ctx.targetVersion).isEqualTo(16);
    }

    @Test
    @DisplayName("missing arguments print usage")
    void missing() {
        assertThatThrownBy(() -> PrecheckContext.fromArgs("h", null, "u", "16"))
                .isInstanceOf(InputValidationException.class)
                .hasMessageStartingWith("Usage:");
    }

    @ParameterizedTest
    @ValueSource(strings = {"host name", "host;rm", "h/x"})
    @DisplayName("rejects malformed hosts")
    void badHost(String host) {
        assertThatThrownBy(() -> PrecheckContext.fromArgs(host, "5432", "u", "16"))
                .hasMessage("Invalid hostname format");
    }

    @Test
    @DisplayName("rejects a host longer than 253 characters")
    void longHost() {
        assertThatThrownBy(() -> PrecheckContext.fromArgs("a".repeat(254), "5432", "u", "16"))
                .hasMessage("Invalid hostname format");
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "65536", "123456", "54a2", "-1"})
    @DisplayName("rejects ports outside 1-65535")
    void badPort(String port) {
        assertThatThrownBy(() -> PrecheckContext.fromArgs("h", port, "u", "16"))
                .hasMessageContaining("Invalid port number");
    }

    @ParameterizedTest
    @ValueSource(strings = {"bad.user", "us er", "u$"})
    @DisplayName("rejects malformed users")
    void badUser(String user) {
        assertThatThrownBy(() -> PrecheckContext.fromArgs("h", "5432", user, "16"))
                .hasMessage("Invalid username format");
    }

    @ParameterizedTest
    @ValueSource(strings = {"10", "18", "9", "016", "sixteen"})
    @DisplayName("rejects unsupported target versions")
    void badTarget(String target) {
        assertThatThrownBy(() -> PrecheckContext.fromArgs("h", "5432", "u", target))
                .hasMessageContaining("Invalid target version")
                .hasMessageContaining("11, 12, 13, 14, 15, 16, 17");
    }
}
