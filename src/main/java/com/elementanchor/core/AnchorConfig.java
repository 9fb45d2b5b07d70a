package com.elementanchor.core;

import java.time.Duration;

/**
 * Session-level configuration for ElementAnchor.
 *
 * Load from environment variables or construct programmatically.
 *
 * Recognised environment variables:
 *   ELEMENTANCHOR_DEFAULT_WAIT_MS      - How long operations retry transient failures (default: 2000)
 *   ELEMENTANCHOR_RETRY_INTERVAL_MS    - Pause between attempts (default: 10)
 *   ELEMENTANCHOR_AUTOMATIC_RELOAD     - Reload stale handles between attempts (default: true)
 *   ELEMENTANCHOR_IGNORE_HIDDEN        - text() returns visible text by default (default: true)
 *   ELEMENTANCHOR_VISIBLE_TEXT_ONLY    - text() returns visible text by default (default: false)
 */
public class AnchorConfig {

    public static final Duration DEFAULT_WAIT_TIME      = Duration.ofSeconds(2);
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofMillis(10);

    private final Duration defaultWaitTime;
    private final Duration retryInterval;
    private final boolean automaticReload;
    private final boolean ignoreHiddenElements;
    private final boolean visibleTextOnly;

    private AnchorConfig(Builder b) {
        this.defaultWaitTime      = b.defaultWaitTime;
        this.retryInterval        = b.retryInterval;
        this.automaticReload      = b.automaticReload;
        this.ignoreHiddenElements = b.ignoreHiddenElements;
        this.visibleTextOnly      = b.visibleTextOnly;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static AnchorConfig defaults() {
        return builder().build();
    }

    public static AnchorConfig fromEnvironment() {
        return builder()
            .defaultWaitTime(Duration.ofMillis(longEnvOrDefault("ELEMENTANCHOR_DEFAULT_WAIT_MS",
                DEFAULT_WAIT_TIME.toMillis())))
            .retryInterval(Duration.ofMillis(longEnvOrDefault("ELEMENTANCHOR_RETRY_INTERVAL_MS",
                DEFAULT_RETRY_INTERVAL.toMillis())))
            .automaticReload(boolEnvOrDefault("ELEMENTANCHOR_AUTOMATIC_RELOAD", true))
            .ignoreHiddenElements(boolEnvOrDefault("ELEMENTANCHOR_IGNORE_HIDDEN", true))
            .visibleTextOnly(boolEnvOrDefault("ELEMENTANCHOR_VISIBLE_TEXT_ONLY", false))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Duration getDefaultWaitTime()    { return defaultWaitTime; }
    public Duration getRetryInterval()      { return retryInterval; }
    public boolean isAutomaticReload()      { return automaticReload; }
    public boolean isIgnoreHiddenElements() { return ignoreHiddenElements; }
    public boolean isVisibleTextOnly()      { return visibleTextOnly; }

    /** True when a text read without an explicit type should return only visible text. */
    public boolean isVisibleTextByDefault() {
        return ignoreHiddenElements || visibleTextOnly;
    }

    @Override
    public String toString() {
        return String.format(
            "AnchorConfig{wait=%dms, interval=%dms, automaticReload=%s, ignoreHidden=%s, visibleTextOnly=%s}",
            defaultWaitTime.toMillis(), retryInterval.toMillis(),
            automaticReload, ignoreHiddenElements, visibleTextOnly);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private Duration defaultWaitTime = DEFAULT_WAIT_TIME;
        private Duration retryInterval = DEFAULT_RETRY_INTERVAL;
        private boolean automaticReload = true;
        private boolean ignoreHiddenElements = true;
        private boolean visibleTextOnly = false;

        public Builder defaultWaitTime(Duration d)          { this.defaultWaitTime = d; return this; }
        public Builder retryInterval(Duration d)            { this.retryInterval = d; return this; }
        public Builder automaticReload(boolean b)           { this.automaticReload = b; return this; }
        public Builder ignoreHiddenElements(boolean b)      { this.ignoreHiddenElements = b; return this; }
        public Builder visibleTextOnly(boolean b)           { this.visibleTextOnly = b; return this; }

        public AnchorConfig build() {
            if (defaultWaitTime == null || defaultWaitTime.isNegative()) {
                throw new IllegalStateException("defaultWaitTime must be zero or positive");
            }
            if (retryInterval == null || retryInterval.isNegative()) {
                throw new IllegalStateException("retryInterval must be zero or positive");
            }
            return new AnchorConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static long longEnvOrDefault(String key, long defaultValue) {
        try {
            String val = System.getenv(key);
            if (val == null || val.isBlank()) return defaultValue;
            long parsed = Long.parseLong(val.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }
}
