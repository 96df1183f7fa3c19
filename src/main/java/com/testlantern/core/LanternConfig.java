package com.testlantern.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration for TestLantern.
 *
 * Load from environment variables or construct programmatically.
 *
 * Recognised environment variables:
 *   TESTLANTERN_SCREEN_TIMEOUT_MS          - How long a delayed screen may take to appear (default: 3000)
 *   TESTLANTERN_TRANSIENT_SOFT_TIMEOUT_MS  - Wait after a transient indicator was last seen (default: 3000)
 *   TESTLANTERN_TRANSIENT_HARD_TIMEOUT_MS  - Overall bound for a screen with a transient (default: 30000)
 *   TESTLANTERN_POLL_INTERVAL_MS           - Pause between polls of a screen or element (default: 100)
 *   TESTLANTERN_MESSAGE_SEPARATOR          - Joins scenario messages in failure reports (default: "; ")
 *   TESTLANTERN_APP_NAME                   - Expression for the application in locator paths (default: app)
 *   TESTLANTERN_ACCESSOR_REPORT_PATH       - Where AccessorDumper writes its JSON report
 *                                            (default: target/accessor-report.json; "none" disables)
 */
public class LanternConfig {

    public static final Duration DEFAULT_SCREEN_TIMEOUT         = Duration.ofSeconds(3);
    public static final Duration DEFAULT_TRANSIENT_SOFT_TIMEOUT = Duration.ofSeconds(3);
    public static final Duration DEFAULT_TRANSIENT_HARD_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_POLL_INTERVAL          = Duration.ofMillis(100);
    public static final String   DEFAULT_MESSAGE_SEPARATOR      = "; ";
    public static final String   DEFAULT_APP_NAME               = "app";
    public static final Path     DEFAULT_ACCESSOR_REPORT_PATH   = Paths.get("target/accessor-report.json");

    private final Duration screenTimeout;
    private final Duration transientSoftTimeout;
    private final Duration transientHardTimeout;
    private final Duration pollInterval;
    private final String   messageSeparator;
    private final String   appName;
    private final Path     accessorReportPath;   // null = report disabled

    private LanternConfig(Builder b) {
        this.screenTimeout        = b.screenTimeout;
        this.transientSoftTimeout = b.transientSoftTimeout;
        this.transientHardTimeout = b.transientHardTimeout;
        this.pollInterval         = b.pollInterval;
        this.messageSeparator     = b.messageSeparator;
        this.appName              = b.appName;
        this.accessorReportPath   = b.accessorReportPath;
    }

    // ── Static factory: load from environment variables ───────────────────────

    public static LanternConfig fromEnvironment() {
        String reportPath = System.getenv("TESTLANTERN_ACCESSOR_REPORT_PATH");

        return builder()
            .screenTimeout(durationEnvOrDefault("TESTLANTERN_SCREEN_TIMEOUT_MS", DEFAULT_SCREEN_TIMEOUT))
            .transientSoftTimeout(durationEnvOrDefault("TESTLANTERN_TRANSIENT_SOFT_TIMEOUT_MS", DEFAULT_TRANSIENT_SOFT_TIMEOUT))
            .transientHardTimeout(durationEnvOrDefault("TESTLANTERN_TRANSIENT_HARD_TIMEOUT_MS", DEFAULT_TRANSIENT_HARD_TIMEOUT))
            .pollInterval(durationEnvOrDefault("TESTLANTERN_POLL_INTERVAL_MS", DEFAULT_POLL_INTERVAL))
            .messageSeparator(rawEnvOrDefault("TESTLANTERN_MESSAGE_SEPARATOR", DEFAULT_MESSAGE_SEPARATOR))
            .appName(envOrDefault("TESTLANTERN_APP_NAME", DEFAULT_APP_NAME))
            .accessorReportPath(reportPath == null || reportPath.isBlank()
                ? DEFAULT_ACCESSOR_REPORT_PATH
                : "none".equalsIgnoreCase(reportPath.trim()) ? null : Paths.get(reportPath.trim()))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Duration getScreenTimeout()            { return screenTimeout; }
    public Duration getTransientSoftTimeout()     { return transientSoftTimeout; }
    public Duration getTransientHardTimeout()     { return transientHardTimeout; }
    public Duration getPollInterval()             { return pollInterval; }
    public String   getMessageSeparator()         { return messageSeparator; }
    public String   getAppName()                  { return appName; }
    public Path     getAccessorReportPath()       { return accessorReportPath; }
    public boolean  isAccessorReportEnabled()     { return accessorReportPath != null; }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private Duration screenTimeout        = DEFAULT_SCREEN_TIMEOUT;
        private Duration transientSoftTimeout = DEFAULT_TRANSIENT_SOFT_TIMEOUT;
        private Duration transientHardTimeout = DEFAULT_TRANSIENT_HARD_TIMEOUT;
        private Duration pollInterval         = DEFAULT_POLL_INTERVAL;
        private String   messageSeparator     = DEFAULT_MESSAGE_SEPARATOR;
        private String   appName              = DEFAULT_APP_NAME;
        private Path     accessorReportPath   = DEFAULT_ACCESSOR_REPORT_PATH;

        public Builder screenTimeout(Duration d)          { this.screenTimeout = d; return this; }
        public Builder transientSoftTimeout(Duration d)   { this.transientSoftTimeout = d; return this; }
        public Builder transientHardTimeout(Duration d)   { this.transientHardTimeout = d; return this; }
        public Builder pollInterval(Duration d)           { this.pollInterval = d; return this; }
        public Builder messageSeparator(String s)         { this.messageSeparator = s; return this; }
        public Builder appName(String s)                  { this.appName = s; return this; }
        public Builder accessorReportPath(Path p)         { this.accessorReportPath = p; return this; }
        public Builder accessorReportPath(String path) {
            this.accessorReportPath = (path != null && !path.isBlank()) ? Paths.get(path) : null;
            return this;
        }

        public LanternConfig build() {
            if (messageSeparator == null) messageSeparator = DEFAULT_MESSAGE_SEPARATOR;
            if (appName == null || appName.isBlank()) appName = DEFAULT_APP_NAME;
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                pollInterval = DEFAULT_POLL_INTERVAL;
            }
            return new LanternConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static String envOrDefault(String key, String defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? val.trim() : defaultValue;
    }

    // separators are whitespace-sensitive, so no trimming
    private static String rawEnvOrDefault(String key, String defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isEmpty()) ? val : defaultValue;
    }

    private static Duration durationEnvOrDefault(String key, Duration defaultValue) {
        try {
            String val = System.getenv(key);
            return (val != null && !val.isBlank()) ? Duration.ofMillis(Long.parseLong(val.trim())) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
