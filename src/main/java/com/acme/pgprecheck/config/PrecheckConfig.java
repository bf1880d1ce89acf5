package com.acme.pgprecheck.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for a precheck run. Credentials and the upgrade target are never configured
 * here; they come from the command line and the password prompt.
 *
 * @see PrecheckConfigLoader
 */
public final class PrecheckConfig {

    public static final PrecheckConfig DEFAULTS = builder().build();

    private final Duration probeTimeout;
    private final Duration connectTimeout;
    private final int workers;
    private final String sslMode;
    private final String adminDatabase;
    private final String reportDir;
    private final boolean jsonReportEnabled;

    private PrecheckConfig(Builder b) {
        this.probeTimeout = b.probeTimeout;
        this.connectTimeout = b.connectTimeout;
        this.workers = b.workers;
        this.sslMode = b.sslMode;
        this.adminDatabase = b.adminDatabase;
        this.reportDir = b.reportDir;
        this.jsonReportEnabled = b.jsonReportEnabled;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Upper bound for a single probe call, connection included. */
    public Duration probeTimeout() { return probeTimeout; }

    public Duration connectTimeout() { return connectTimeout; }

    /** Size of the probe worker pool. */
    public int workers() { return workers; }

    public String sslMode() { return sslMode; }

    /** Database used for cluster-wide probes, version detection and enumeration. */
    public String adminDatabase() { return adminDatabase; }

    public String reportDir() { return reportDir; }

    public boolean jsonReportEnabled() { return jsonReportEnabled; }

    @Override
    public String toString() {
        return "PrecheckConfig{" +
                "probeTimeout=" + probeTimeout.toSeconds() + "s" +
                ", connectTimeout=" + connectTimeout.toSeconds() + "s" +
                ", workers=" + workers +
                ", sslMode=" + sslMode +
                ", adminDatabase=" + adminDatabase +
                ", reportDir=" + reportDir +
                ", jsonReportEnabled=" + jsonReportEnabled +
                '}';
    }

    public static final class Builder {
        private Duration probeTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int workers = 4;
        private String sslMode = "require";
        private String adminDatabase = "postgres";
        private String reportDir = ".";
        private boolean jsonReportEnabled = true;

        private Builder() {}

        public Builder probeTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new PrecheckConfigException("Probe timeout must be positive: " + timeout);
            }
            this.probeTimeout = timeout;
            return this;
        }

        public Builder probeTimeoutSeconds(long seconds) {
            return probeTimeout(Duration.ofSeconds(seconds));
        }

        public Builder connectTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) {
                throw new PrecheckConfigException("Connect timeout must be positive: " + timeout);
            }
            this.connectTimeout = timeout;
            return this;
        }

        public Builder connectTimeoutSeconds(long seconds) {
            return connectTimeout(Duration.ofSeconds(seconds));
        }

        public Builder workers(int workers) {
            if (workers < 1) throw new PrecheckConfigException("Worker count must be at least 1: " + workers);
            this.workers = workers;
            return this;
        }

        public Builder sslMode(String sslMode) {
            this.sslMode = Objects.requireNonNull(sslMode, "sslMode");
            return this;
        }

        public Builder adminDatabase(String adminDatabase) {
            this.adminDatabase = Objects.requireNonNull(adminDatabase, "adminDatabase");
            return this;
        }

        public Builder reportDir(String reportDir) {
            this.reportDir = Objects.requireNonNull(reportDir, "reportDir");
            return this;
        }

        public Builder jsonReportEnabled(boolean enabled) {
            this.jsonReportEnabled = enabled;
            return this;
        }

        public PrecheckConfig build() {
            return new PrecheckConfig(this);
        }
    }
}
