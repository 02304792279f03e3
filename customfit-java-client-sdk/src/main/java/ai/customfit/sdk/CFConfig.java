package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.BlobStore;
import ai.customfit.sdk.subsystems.PersistentDataStore;
import ai.customfit.sdk.subsystems.Transport;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.logging.Logs;

import java.io.File;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * This class exposes configuration options for {@link CFClient}. Instances of this class must be
 * constructed with {@link CFConfig.Builder}.
 */
public final class CFConfig {
    public static final int DEFAULT_EVENTS_QUEUE_SIZE = 100;
    public static final int DEFAULT_EVENTS_FLUSH_TIME_SECONDS = 60;
    public static final long DEFAULT_EVENTS_FLUSH_INTERVAL_MS = 1_000;
    public static final int DEFAULT_MAX_STORED_EVENTS = 100;
    public static final int DEFAULT_SUMMARIES_QUEUE_SIZE = 100;
    public static final long DEFAULT_SUMMARIES_FLUSH_INTERVAL_MS = 60_000;
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    public static final long DEFAULT_RETRY_INITIAL_DELAY_MS = RetryPolicy.DEFAULT_INITIAL_DELAY_MILLIS;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = RetryPolicy.DEFAULT_MAX_DELAY_MILLIS;
    public static final double DEFAULT_RETRY_BACKOFF_MULTIPLIER = RetryPolicy.DEFAULT_MULTIPLIER;
    public static final double DEFAULT_RETRY_JITTER_FACTOR = RetryPolicy.DEFAULT_JITTER_FACTOR;
    public static final long DEFAULT_SDK_SETTINGS_CHECK_INTERVAL_MS = 300_000;
    public static final long DEFAULT_SDK_SETTINGS_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_NETWORK_CONNECTION_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_NETWORK_READ_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_BACKGROUND_POLLING_INTERVAL_MS = 3_600_000;
    public static final long DEFAULT_REDUCED_POLLING_INTERVAL_MS = 7_200_000;
    public static final URI DEFAULT_API_BASE_URI = URI.create("https://api.customfit.ai");
    public static final URI DEFAULT_SETTINGS_BASE_URI = URI.create("https://sdk.customfit.ai");

    static final String DEFAULT_LOGGER_NAME = "CustomFitSdk";
    static final LDLogLevel DEFAULT_LOG_LEVEL = LDLogLevel.INFO;

    private final String clientKey;
    private final String dimensionId;
    private final int eventsQueueSize;
    private final int eventsFlushTimeSeconds;
    private final long eventsFlushIntervalMs;
    private final int maxStoredEvents;
    private final int summariesQueueSize;
    private final long summariesFlushIntervalMs;
    private final int maxRetryAttempts;
    private final long retryInitialDelayMs;
    private final long retryMaxDelayMs;
    private final double retryBackoffMultiplier;
    private final double retryJitterFactor;
    private final long sdkSettingsCheckIntervalMs;
    private final long sdkSettingsTimeoutMs;
    private final int networkConnectionTimeoutMs;
    private final int networkReadTimeoutMs;
    private final boolean offline;
    private final boolean disableBackgroundPolling;
    private final long backgroundPollingIntervalMs;
    private final boolean useReducedPollingWhenBatteryLow;
    private final long reducedPollingIntervalMs;
    private final SessionConfig sessionConfig;
    private final URI apiBaseUri;
    private final URI settingsBaseUri;
    private final File cacheDir;
    private final LDLogAdapter logAdapter;
    private final String loggerName;

    // configurable for testing only
    final PersistentDataStore persistentDataStore;
    final BlobStore blobStore;
    final Transport transport;
    final Clock clock;
    final Supplier<UUID> idSource;

    private CFConfig(Builder builder, LDLogAdapter logAdapter) {
        this.clientKey = builder.clientKey;
        this.dimensionId = extractDimensionId(builder.clientKey);
        this.eventsQueueSize = builder.eventsQueueSize;
        this.eventsFlushTimeSeconds = builder.eventsFlushTimeSeconds;
        this.eventsFlushIntervalMs = builder.eventsFlushIntervalMs;
        this.maxStoredEvents = builder.maxStoredEvents;
        this.summariesQueueSize = builder.summariesQueueSize;
        this.summariesFlushIntervalMs = builder.summariesFlushIntervalMs;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.retryInitialDelayMs = builder.retryInitialDelayMs;
        this.retryMaxDelayMs = builder.retryMaxDelayMs;
        this.retryBackoffMultiplier = builder.retryBackoffMultiplier;
        this.retryJitterFactor = builder.retryJitterFactor;
        this.sdkSettingsCheckIntervalMs = builder.sdkSettingsCheckIntervalMs;
        this.sdkSettingsTimeoutMs = builder.sdkSettingsTimeoutMs;
        this.networkConnectionTimeoutMs = builder.networkConnectionTimeoutMs;
        this.networkReadTimeoutMs = builder.networkReadTimeoutMs;
        this.offline = builder.offline;
        this.disableBackgroundPolling = builder.disableBackgroundPolling;
        this.backgroundPollingIntervalMs = builder.backgroundPollingIntervalMs;
        this.useReducedPollingWhenBatteryLow = builder.useReducedPollingWhenBatteryLow;
        this.reducedPollingIntervalMs = builder.reducedPollingIntervalMs;
        this.sessionConfig = builder.sessionConfig == null ? new SessionConfig.Builder().build() : builder.sessionConfig;
        this.apiBaseUri = builder.apiBaseUri;
        this.settingsBaseUri = builder.settingsBaseUri;
        this.cacheDir = builder.cacheDir == null
                ? new File(System.getProperty("user.home"), ".customfit") : builder.cacheDir;
        this.logAdapter = logAdapter;
        this.loggerName = builder.loggerName;
        this.persistentDataStore = builder.persistentDataStore;
        this.blobStore = builder.blobStore;
        this.transport = builder.transport;
        this.clock = builder.clock == null ? Clock.SYSTEM : builder.clock;
        this.idSource = builder.idSource == null ? UUID::randomUUID : builder.idSource;
    }

    public String getClientKey() {
        return clientKey;
    }

    /**
     * Returns the dimension id embedded in the client key, which selects the settings document.
     *
     * @return the dimension id, or null if the client key is not a JWT carrying one
     */
    public String getDimensionId() {
        return dimensionId;
    }

    public int getEventsQueueSize() {
        return eventsQueueSize;
    }

    public int getEventsFlushTimeSeconds() {
        return eventsFlushTimeSeconds;
    }

    public long getEventsFlushIntervalMs() {
        return eventsFlushIntervalMs;
    }

    public int getMaxStoredEvents() {
        return maxStoredEvents;
    }

    public int getSummariesQueueSize() {
        return summariesQueueSize;
    }

    public long getSummariesFlushIntervalMs() {
        return summariesFlushIntervalMs;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public long getRetryInitialDelayMs() {
        return retryInitialDelayMs;
    }

    public long getRetryMaxDelayMs() {
        return retryMaxDelayMs;
    }

    public double getRetryBackoffMultiplier() {
        return retryBackoffMultiplier;
    }

    public double getRetryJitterFactor() {
        return retryJitterFactor;
    }

    public long getSdkSettingsCheckIntervalMs() {
        return sdkSettingsCheckIntervalMs;
    }

    public long getSdkSettingsTimeoutMs() {
        return sdkSettingsTimeoutMs;
    }

    public int getNetworkConnectionTimeoutMs() {
        return networkConnectionTimeoutMs;
    }

    public int getNetworkReadTimeoutMs() {
        return networkReadTimeoutMs;
    }

    public boolean isOffline() {
        return offline;
    }

    public boolean isDisableBackgroundPolling() {
        return disableBackgroundPolling;
    }

    public long getBackgroundPollingIntervalMs() {
        return backgroundPollingIntervalMs;
    }

    public boolean isUseReducedPollingWhenBatteryLow() {
        return useReducedPollingWhenBatteryLow;
    }

    public long getReducedPollingIntervalMs() {
        return reducedPollingIntervalMs;
    }

    public SessionConfig getSessionConfig() {
        return sessionConfig;
    }

    public URI getApiBaseUri() {
        return apiBaseUri;
    }

    public URI getSettingsBaseUri() {
        return settingsBaseUri;
    }

    public File getCacheDir() {
        return cacheDir;
    }

    public LDLogAdapter getLogAdapter() {
        return logAdapter;
    }

    public String getLoggerName() {
        return loggerName;
    }

    String getEventsUrl() {
        return apiUrl("/v1/cfe");
    }

    String getSummariesUrl() {
        return apiUrl("/v1/config/request/summary");
    }

    String getUserConfigsUrl() {
        return apiUrl("/v1/users/configs");
    }

    /**
     * @return the settings document URL, or null if there is no dimension id
     */
    String getSettingsUrl() {
        if (dimensionId == null) {
            return null;
        }
        return trimTrailingSlash(settingsBaseUri.toString()) + "/" + dimensionId + "/cf-sdk-settings.json";
    }

    private String apiUrl(String path) {
        return trimTrailingSlash(apiBaseUri.toString()) + path + "?cfenc=" + clientKey;
    }

    private static String trimTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    static String extractDimensionId(String clientKey) {
        String[] parts = clientKey.split("\\.");
        if (parts.length < 2) {
            return null;
        }
        try {
            String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
            JsonElement e = JsonParser.parseString(payload);
            if (!e.isJsonObject()) {
                return null;
            }
            JsonObject o = e.getAsJsonObject();
            JsonElement id = o.get("dimension_id");
            return id != null && id.isJsonPrimitive() ? id.getAsString() : null;
        } catch (IllegalArgumentException | JsonParseException e) {
            return null;
        }
    }

    /**
     * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> that helps construct
     * {@link CFConfig} objects. Builder calls can be chained, enabling the following pattern:
     * <pre><code>
     *     CFConfig config = new CFConfig.Builder(clientKey)
     *         .eventsQueueSize(200)
     *         .offline(false)
     *         .build();
     * </code></pre>
     */
    public static final class Builder {
        private final String clientKey;
        private int eventsQueueSize = DEFAULT_EVENTS_QUEUE_SIZE;
        private int eventsFlushTimeSeconds = DEFAULT_EVENTS_FLUSH_TIME_SECONDS;
        private long eventsFlushIntervalMs = DEFAULT_EVENTS_FLUSH_INTERVAL_MS;
        private int maxStoredEvents = DEFAULT_MAX_STORED_EVENTS;
        private int summariesQueueSize = DEFAULT_SUMMARIES_QUEUE_SIZE;
        private long summariesFlushIntervalMs = DEFAULT_SUMMARIES_FLUSH_INTERVAL_MS;
        private int maxRetryAttempts = DEFAULT_MAX_RETRY_ATTEMPTS;
        private long retryInitialDelayMs = DEFAULT_RETRY_INITIAL_DELAY_MS;
        private long retryMaxDelayMs = DEFAULT_RETRY_MAX_DELAY_MS;
        private double retryBackoffMultiplier = DEFAULT_RETRY_BACKOFF_MULTIPLIER;
        private double retryJitterFactor = DEFAULT_RETRY_JITTER_FACTOR;
        private long sdkSettingsCheckIntervalMs = DEFAULT_SDK_SETTINGS_CHECK_INTERVAL_MS;
        private long sdkSettingsTimeoutMs = DEFAULT_SDK_SETTINGS_TIMEOUT_MS;
        private int networkConnectionTimeoutMs = DEFAULT_NETWORK_CONNECTION_TIMEOUT_MS;
        private int networkReadTimeoutMs = DEFAULT_NETWORK_READ_TIMEOUT_MS;
        private boolean offline = false;
        private boolean disableBackgroundPolling = false;
        private long backgroundPollingIntervalMs = DEFAULT_BACKGROUND_POLLING_INTERVAL_MS;
        private boolean useReducedPollingWhenBatteryLow = true;
        private long reducedPollingIntervalMs = DEFAULT_REDUCED_POLLING_INTERVAL_MS;
        private SessionConfig sessionConfig;
        private URI apiBaseUri = DEFAULT_API_BASE_URI;
        private URI settingsBaseUri = DEFAULT_SETTINGS_BASE_URI;
        private File cacheDir;
        private LDLogAdapter logAdapter = Logs.basic();
        private LDLogLevel logLevel = null;
        private String loggerName = DEFAULT_LOGGER_NAME;

        private PersistentDataStore persistentDataStore;
        private BlobStore blobStore;
        private Transport transport;
        private Clock clock;
        private Supplier<UUID> idSource;

        /**
         * @param clientKey the client key from the CustomFit dashboard
         */
        public Builder(String clientKey) {
            if (CFUtil.isNullOrBlank(clientKey)) {
                throw new IllegalArgumentException("clientKey is required");
            }
            this.clientKey = clientKey.trim();
        }

        /**
         * Sets how many events are buffered before a flush is forced. The default is
         * {@link #DEFAULT_EVENTS_QUEUE_SIZE}.
         *
         * @param eventsQueueSize the queue capacity
         * @return the builder
         */
        public Builder eventsQueueSize(int eventsQueueSize) {
            this.eventsQueueSize = requirePositive(eventsQueueSize, "eventsQueueSize");
            return this;
        }

        /**
         * Sets how long an event may wait in the queue before the periodic timer delivers it.
         *
         * @param eventsFlushTimeSeconds the maximum wait, in seconds
         * @return the builder
         */
        public Builder eventsFlushTimeSeconds(int eventsFlushTimeSeconds) {
            this.eventsFlushTimeSeconds = requirePositive(eventsFlushTimeSeconds, "eventsFlushTimeSeconds");
            return this;
        }

        /**
         * Sets how often the events queue checks whether it has anything due for delivery.
         *
         * @param eventsFlushIntervalMs the timer interval
         * @return the builder
         */
        public Builder eventsFlushIntervalMs(long eventsFlushIntervalMs) {
            this.eventsFlushIntervalMs = requirePositive(eventsFlushIntervalMs, "eventsFlushIntervalMs");
            return this;
        }

        /**
         * Sets how many undelivered events are kept while offline, in memory and in storage.
         *
         * @param maxStoredEvents the cap
         * @return the builder
         */
        public Builder maxStoredEvents(int maxStoredEvents) {
            this.maxStoredEvents = requirePositive(maxStoredEvents, "maxStoredEvents");
            return this;
        }

        public Builder summariesQueueSize(int summariesQueueSize) {
            this.summariesQueueSize = requirePositive(summariesQueueSize, "summariesQueueSize");
            return this;
        }

        public Builder summariesFlushIntervalMs(long summariesFlushIntervalMs) {
            this.summariesFlushIntervalMs = requirePositive(summariesFlushIntervalMs, "summariesFlushIntervalMs");
            return this;
        }

        public Builder maxRetryAttempts(int maxRetryAttempts) {
            this.maxRetryAttempts = requirePositive(maxRetryAttempts, "maxRetryAttempts");
            return this;
        }

        public Builder retryInitialDelayMs(long retryInitialDelayMs) {
            this.retryInitialDelayMs = requireNonNegative(retryInitialDelayMs, "retryInitialDelayMs");
            return this;
        }

        public Builder retryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = requireNonNegative(retryMaxDelayMs, "retryMaxDelayMs");
            return this;
        }

        /**
         * Sets the factor by which each retry delay grows. Must be greater than 1.
         *
         * @param retryBackoffMultiplier the multiplier
         * @return the builder
         */
        public Builder retryBackoffMultiplier(double retryBackoffMultiplier) {
            if (!(retryBackoffMultiplier > 1)) {
                throw new IllegalArgumentException("retryBackoffMultiplier must be greater than 1");
            }
            this.retryBackoffMultiplier = retryBackoffMultiplier;
            return this;
        }

        /**
         * Sets how much each retry delay is randomly varied, as a fraction of the delay. Must be
         * between 0 and 1.
         *
         * @param retryJitterFactor the jitter factor
         * @return the builder
         */
        public Builder retryJitterFactor(double retryJitterFactor) {
            if (retryJitterFactor < 0 || retryJitterFactor > 1) {
                throw new IllegalArgumentException("retryJitterFactor must be between 0 and 1");
            }
            this.retryJitterFactor = retryJitterFactor;
            return this;
        }

        /**
         * Sets how often the client checks whether the settings document has changed while in
         * the foreground.
         *
         * @param sdkSettingsCheckIntervalMs the polling interval
         * @return the builder
         */
        public Builder sdkSettingsCheckIntervalMs(long sdkSettingsCheckIntervalMs) {
            this.sdkSettingsCheckIntervalMs = requirePositive(sdkSettingsCheckIntervalMs, "sdkSettingsCheckIntervalMs");
            return this;
        }

        /**
         * Sets the time limit for the network phase of one settings check, including retries.
         *
         * @param sdkSettingsTimeoutMs the time limit
         * @return the builder
         */
        public Builder sdkSettingsTimeoutMs(long sdkSettingsTimeoutMs) {
            this.sdkSettingsTimeoutMs = requirePositive(sdkSettingsTimeoutMs, "sdkSettingsTimeoutMs");
            return this;
        }

        public Builder networkConnectionTimeoutMs(int networkConnectionTimeoutMs) {
            this.networkConnectionTimeoutMs = requirePositive(networkConnectionTimeoutMs, "networkConnectionTimeoutMs");
            return this;
        }

        public Builder networkReadTimeoutMs(int networkReadTimeoutMs) {
            this.networkReadTimeoutMs = requirePositive(networkReadTimeoutMs, "networkReadTimeoutMs");
            return this;
        }

        /**
         * Starts the client in offline mode. It serves cached configs and keeps analytics in
         * storage, and makes no network requests until {@link CFClient#setOnline()} is called.
         *
         * @param offline true to start offline
         * @return the builder
         */
        public Builder offline(boolean offline) {
            this.offline = offline;
            return this;
        }

        /**
         * Stops settings polling entirely while the application is in the background.
         *
         * @param disableBackgroundPolling true to disable background polling
         * @return the builder
         */
        public Builder disableBackgroundPolling(boolean disableBackgroundPolling) {
            this.disableBackgroundPolling = disableBackgroundPolling;
            return this;
        }

        public Builder backgroundPollingIntervalMs(long backgroundPollingIntervalMs) {
            this.backgroundPollingIntervalMs = requirePositive(backgroundPollingIntervalMs, "backgroundPollingIntervalMs");
            return this;
        }

        public Builder useReducedPollingWhenBatteryLow(boolean useReducedPollingWhenBatteryLow) {
            this.useReducedPollingWhenBatteryLow = useReducedPollingWhenBatteryLow;
            return this;
        }

        public Builder reducedPollingIntervalMs(long reducedPollingIntervalMs) {
            this.reducedPollingIntervalMs = requirePositive(reducedPollingIntervalMs, "reducedPollingIntervalMs");
            return this;
        }

        public Builder sessionConfig(SessionConfig sessionConfig) {
            this.sessionConfig = sessionConfig;
            return this;
        }

        /**
         * Sets the base URI of the config and analytics API. Mostly useful for testing.
         *
         * @param apiBaseUri the base URI
         * @return the builder
         */
        public Builder apiBaseUri(URI apiBaseUri) {
            this.apiBaseUri = apiBaseUri == null ? DEFAULT_API_BASE_URI : apiBaseUri;
            return this;
        }

        /**
         * Sets the base URI the settings document is served from. Mostly useful for testing.
         *
         * @param settingsBaseUri the base URI
         * @return the builder
         */
        public Builder settingsBaseUri(URI settingsBaseUri) {
            this.settingsBaseUri = settingsBaseUri == null ? DEFAULT_SETTINGS_BASE_URI : settingsBaseUri;
            return this;
        }

        /**
         * Sets the directory where the client keeps its persistent state. The default is
         * {@code .customfit} in the user's home directory.
         *
         * @param cacheDir the directory
         * @return the builder
         */
        public Builder cacheDir(File cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        /**
         * Specifies the implementation of logging to use.
         * <p>
         * The <a href="https://github.com/launchdarkly/java-logging"><code>com.launchdarkly.logging</code></a>
         * API defines the {@link LDLogAdapter} interface to specify where log output should be
         * sent. The default is {@link Logs#basic()}, which writes to standard error. Use
         * {@link Logs#none()} to disable logging.
         *
         * @param logAdapter an {@link LDLogAdapter}
         * @return the builder
         * @see #logLevel(LDLogLevel)
         * @see #loggerName(String)
         */
        public Builder logAdapter(LDLogAdapter logAdapter) {
            this.logAdapter = logAdapter == null ? Logs.basic() : logAdapter;
            return this;
        }

        /**
         * Specifies the lowest level of logging to enable. The default is INFO.
         *
         * @param logLevel the lowest level of logging to enable
         * @return the builder
         * @see #logAdapter(LDLogAdapter)
         */
        public Builder logLevel(LDLogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        /**
         * Specifies a custom logger name for the SDK. The default is "CustomFitSdk".
         *
         * @param loggerName the logger name
         * @return the builder
         */
        public Builder loggerName(String loggerName) {
            this.loggerName = loggerName == null ? DEFAULT_LOGGER_NAME : loggerName;
            return this;
        }

        Builder persistentDataStore(PersistentDataStore persistentDataStore) {
            this.persistentDataStore = persistentDataStore;
            return this;
        }

        Builder blobStore(BlobStore blobStore) {
            this.blobStore = blobStore;
            return this;
        }

        Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        Builder idSource(Supplier<UUID> idSource) {
            this.idSource = idSource;
            return this;
        }

        /**
         * Returns the configured {@link CFConfig} object.
         *
         * @return the configuration
         */
        public CFConfig build() {
            if (retryMaxDelayMs < retryInitialDelayMs) {
                throw new IllegalArgumentException("retryMaxDelayMs must not be less than retryInitialDelayMs");
            }
            LDLogAdapter actualLogAdapter = Logs.level(logAdapter,
                    logLevel == null ? DEFAULT_LOG_LEVEL : logLevel);
            return new CFConfig(this, actualLogAdapter);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static long requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static long requireNonNegative(long value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            return value;
        }
    }
}
