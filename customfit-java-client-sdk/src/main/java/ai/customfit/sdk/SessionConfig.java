package ai.customfit.sdk;

import java.util.concurrent.TimeUnit;

/**
 * Rules for when the SDK starts a new analytics session.
 * <p>
 * Instances are immutable; use {@link Builder} to create one, and pass it to
 * {@link CFConfig.Builder#sessionConfig(SessionConfig)}.
 */
public final class SessionConfig {
    public static final long DEFAULT_MAX_SESSION_DURATION_MS = TimeUnit.MINUTES.toMillis(60);
    public static final long DEFAULT_MIN_SESSION_DURATION_MS = TimeUnit.MINUTES.toMillis(5);
    public static final long DEFAULT_BACKGROUND_THRESHOLD_MS = TimeUnit.MINUTES.toMillis(15);
    public static final String DEFAULT_SESSION_ID_PREFIX = "cf_session";

    final long maxSessionDurationMs;
    final long minSessionDurationMs;
    final long backgroundThresholdMs;
    final boolean rotateOnAppRestart;
    final boolean rotateOnAuthChange;
    final String sessionIdPrefix;
    final boolean enableTimeBasedRotation;

    private SessionConfig(Builder builder) {
        this.maxSessionDurationMs = builder.maxSessionDurationMs;
        this.minSessionDurationMs = builder.minSessionDurationMs;
        this.backgroundThresholdMs = builder.backgroundThresholdMs;
        this.rotateOnAppRestart = builder.rotateOnAppRestart;
        this.rotateOnAuthChange = builder.rotateOnAuthChange;
        this.sessionIdPrefix = builder.sessionIdPrefix;
        this.enableTimeBasedRotation = builder.enableTimeBasedRotation;
    }

    public long getMaxSessionDurationMs() {
        return maxSessionDurationMs;
    }

    public long getMinSessionDurationMs() {
        return minSessionDurationMs;
    }

    public long getBackgroundThresholdMs() {
        return backgroundThresholdMs;
    }

    public boolean isRotateOnAppRestart() {
        return rotateOnAppRestart;
    }

    public boolean isRotateOnAuthChange() {
        return rotateOnAuthChange;
    }

    public String getSessionIdPrefix() {
        return sessionIdPrefix;
    }

    public boolean isEnableTimeBasedRotation() {
        return enableTimeBasedRotation;
    }

    @Override
    public String toString() {
        return "SessionConfig(maxSessionDurationMs=" + maxSessionDurationMs
                + ", minSessionDurationMs=" + minSessionDurationMs
                + ", backgroundThresholdMs=" + backgroundThresholdMs
                + ", rotateOnAppRestart=" + rotateOnAppRestart
                + ", rotateOnAuthChange=" + rotateOnAuthChange
                + ", sessionIdPrefix=" + sessionIdPrefix
                + ", enableTimeBasedRotation=" + enableTimeBasedRotation + ")";
    }

    /**
     * Builder for {@link SessionConfig}. All properties start at their default values.
     */
    public static final class Builder {
        private long maxSessionDurationMs = DEFAULT_MAX_SESSION_DURATION_MS;
        private long minSessionDurationMs = DEFAULT_MIN_SESSION_DURATION_MS;
        private long backgroundThresholdMs = DEFAULT_BACKGROUND_THRESHOLD_MS;
        private boolean rotateOnAppRestart = true;
        private boolean rotateOnAuthChange = true;
        private String sessionIdPrefix = DEFAULT_SESSION_ID_PREFIX;
        private boolean enableTimeBasedRotation = true;

        /**
         * Sets how long a session may last before the next activity starts a new one.
         *
         * @param maxSessionDurationMs the maximum duration; must be positive
         * @return the builder
         */
        public Builder maxSessionDurationMs(long maxSessionDurationMs) {
            this.maxSessionDurationMs = requirePositive(maxSessionDurationMs, "maxSessionDurationMs");
            return this;
        }

        /**
         * Sets how long after the previous application start a new start counts as a restart.
         *
         * @param minSessionDurationMs the minimum duration; must not be negative
         * @return the builder
         */
        public Builder minSessionDurationMs(long minSessionDurationMs) {
            if (minSessionDurationMs < 0) {
                throw new IllegalArgumentException("minSessionDurationMs must not be negative");
            }
            this.minSessionDurationMs = minSessionDurationMs;
            return this;
        }

        /**
         * Sets how long the application may stay in the background before returning to the
         * foreground starts a new session.
         *
         * @param backgroundThresholdMs the threshold; must be positive
         * @return the builder
         */
        public Builder backgroundThresholdMs(long backgroundThresholdMs) {
            this.backgroundThresholdMs = requirePositive(backgroundThresholdMs, "backgroundThresholdMs");
            return this;
        }

        public Builder rotateOnAppRestart(boolean rotateOnAppRestart) {
            this.rotateOnAppRestart = rotateOnAppRestart;
            return this;
        }

        public Builder rotateOnAuthChange(boolean rotateOnAuthChange) {
            this.rotateOnAuthChange = rotateOnAuthChange;
            return this;
        }

        public Builder sessionIdPrefix(String sessionIdPrefix) {
            this.sessionIdPrefix = CFUtil.isNullOrBlank(sessionIdPrefix) ? DEFAULT_SESSION_ID_PREFIX : sessionIdPrefix;
            return this;
        }

        public Builder enableTimeBasedRotation(boolean enableTimeBasedRotation) {
            this.enableTimeBasedRotation = enableTimeBasedRotation;
            return this;
        }

        public SessionConfig build() {
            return new SessionConfig(this);
        }

        private static long requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
