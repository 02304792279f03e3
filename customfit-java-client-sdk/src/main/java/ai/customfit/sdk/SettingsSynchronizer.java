package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.ResponseMetadata;
import ai.customfit.sdk.subsystems.Transport;
import ai.customfit.sdk.subsystems.TransportResponse;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keeps the client's configs in sync with CustomFit, and serves them to the application.
 * <p>
 * Each settings check first asks for the validators ({@code ETag}/{@code Last-Modified}) of the
 * account settings document. Only if they changed since the previous check, or if the settings
 * document has never been loaded, is the document itself fetched; and only if they changed and
 * the account is enabled is the user's config document fetched. A new config document replaces
 * the live {@link ConfigSnapshot} in one step, is cached for offline use, and listeners are told
 * which keys changed.
 * <p>
 * Checks are single-flight: a check requested while another is running is skipped. The network
 * phase of a check runs behind the {@code sdk_settings_fetch} circuit breaker, under a time limit,
 * with retries; a failed or timed-out check changes nothing.
 * <p>
 * While the settings document disables the SDK, reads return the caller's defaults, no usage
 * summaries are recorded and listeners are not notified, but polling continues so that the client
 * recovers when the account is enabled again.
 */
final class SettingsSynchronizer implements Closeable {
    static final String CIRCUIT_BREAKER_KEY = "sdk_settings_fetch";
    static final String CONFIG_CACHE_KEY = "cf_config_data";
    static final int CONFIG_CACHE_TTL_SECONDS = 24 * 60 * 60;
    static final String CACHE_METADATA_ETAG = "etag";
    static final String CACHE_METADATA_LAST_MODIFIED = "lastModified";

    // the result of a check's network phase; nothing is applied until the whole phase succeeds
    private static final class CheckOutcome {
        final ResponseMetadata metadata;
        final SdkSettings settings;
        final JsonObject configDocument;
        final ResponseMetadata configMetadata;

        CheckOutcome(ResponseMetadata metadata, SdkSettings settings, JsonObject configDocument,
                     ResponseMetadata configMetadata) {
            this.metadata = metadata;
            this.settings = settings;
            this.configDocument = configDocument;
            this.configMetadata = configMetadata;
        }
    }

    private static final CheckOutcome ABORTED = new CheckOutcome(null, null, null, null);

    private final CFConfig config;
    private final Supplier<CFUser> userSource;
    private final Transport transport;
    private final TTLCache<JsonObject> configCache;
    private final PersistentDataStoreWrapper store;
    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final TaskExecutor taskExecutor;
    private final UsageSummaryRecorder summaryRecorder;
    private final ConnectionRecorder connectionRecorder;
    private final LDLogger logger;

    private final AtomicReference<ConfigSnapshot> snapshot = new AtomicReference<>(ConfigSnapshot.EMPTY);
    private final ReentrantLock checkLock = new ReentrantLock();
    private final AtomicBoolean loggedMissingDimension = new AtomicBoolean(false);
    private volatile ResponseMetadata previousMetadata;
    private volatile SdkSettings sdkSettings;
    private volatile boolean enabled = true;

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<ConfigChangeListener>> configListeners =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<AllFlagsListener> allFlagsListeners = new CopyOnWriteArrayList<>();

    private final Object timerLock = new Object();
    private ScheduledFuture<?> pollTask;
    private long pollIntervalMs;
    private boolean pollingPaused;
    private boolean closed;

    SettingsSynchronizer(
            CFConfig config,
            Supplier<CFUser> userSource,
            Transport transport,
            TTLCache<JsonObject> configCache,
            PersistentDataStoreWrapper store,
            CircuitBreakerRegistry circuitBreakers,
            RetryPolicy retryPolicy,
            TaskExecutor taskExecutor,
            UsageSummaryRecorder summaryRecorder,
            ConnectionRecorder connectionRecorder,
            LDLogger logger
    ) {
        this.config = config;
        this.userSource = userSource;
        this.transport = transport;
        this.configCache = configCache;
        this.store = store;
        this.circuitBreaker = circuitBreakers.getOrCreate(CIRCUIT_BREAKER_KEY,
                CircuitBreaker.DEFAULT_FAILURE_THRESHOLD,
                CircuitBreaker.DEFAULT_RESET_TIMEOUT_MILLIS,
                CircuitBreaker.DEFAULT_HALF_OPEN_TIMEOUT_MILLIS);
        this.retryPolicy = retryPolicy;
        this.taskExecutor = taskExecutor;
        this.summaryRecorder = summaryRecorder;
        this.connectionRecorder = connectionRecorder;
        this.logger = logger;
    }

    /**
     * Loads the cached config document, if there is a valid one, into the live snapshot. Makes no
     * network requests. The settings validators from the previous run are adopted only if the
     * cached config was loaded, so that a missing cache always leads to a full fetch.
     *
     * @return true if a cached config was loaded
     */
    boolean hydrateFromCache() {
        CacheEntry<JsonObject> entry = configCache.getEntry(CONFIG_CACHE_KEY, false);
        if (entry == null) {
            logger.debug("No cached config available");
            return false;
        }
        ConfigSnapshot cached;
        try {
            ResponseMetadata metadata = new ResponseMetadata(
                    entry.getMetadata().get(CACHE_METADATA_ETAG),
                    entry.getMetadata().get(CACHE_METADATA_LAST_MODIFIED));
            cached = ConfigSnapshot.parse(entry.getValue(), metadata, logger);
        } catch (RuntimeException e) {
            CFUtil.logExceptionAtWarnLevel(logger, e, "Cached config is unreadable; clearing it");
            configCache.remove(CONFIG_CACHE_KEY);
            return false;
        }
        snapshot.set(cached);
        ResponseMetadata stored = store.getSettingsMetadata();
        if (stored != null) {
            previousMetadata = stored;
        }
        logger.info("Loaded {} config(s) from cache", cached.size());
        return true;
    }

    /**
     * Runs one settings check, unless one is already running.
     * <p>
     * Never throws; failures are logged and reported to the {@link ConnectionRecorder}.
     *
     * @return false if the check was skipped because another was in progress
     */
    boolean checkSettings() {
        if (!checkLock.tryLock()) {
            logger.debug("Settings check already in progress; skipping");
            return false;
        }
        try {
            String url = config.getSettingsUrl();
            if (url == null) {
                if (!loggedMissingDimension.getAndSet(true)) {
                    logger.warn("Client key does not contain a dimension id; settings checks are disabled");
                }
                return true;
            }
            CheckOutcome outcome;
            try {
                outcome = circuitBreaker.execute(
                        () -> withTimeout(() -> retryPolicy.execute(() -> fetchChanges(url))),
                        () -> null);
            } catch (CFFailure e) {
                CFUtil.logExceptionAtWarnLevel(logger, e, "Settings check failed");
                connectionRecorder.recordConnectionFailure(e);
                return true;
            }
            if (outcome == null) {
                logger.debug("Settings circuit is open; check skipped");
                return true;
            }
            connectionRecorder.recordConnectionSuccess();
            if (outcome != ABORTED) {
                apply(outcome);
            }
            return true;
        } finally {
            checkLock.unlock();
        }
    }

    /**
     * Forgets the stored settings validators, so that the next check fetches everything, and
     * runs a check now.
     *
     * @return false if the check was skipped because another was in progress
     */
    boolean forceRefresh() {
        previousMetadata = null;
        store.setSettingsMetadata(null);
        return checkSettings();
    }

    /**
     * Reads a config value.
     *
     * @param key the config key
     * @param fallback returned if the config is missing, of the wrong type, or the SDK is disabled
     * @param converter extracts the requested type
     * @param <T> the value type
     * @return the value or {@code fallback}
     */
    <T> T getValue(String key, T fallback, ValueTypes.Converter<T> converter) {
        if (!enabled || key == null) {
            return fallback;
        }
        ConfigEntry entry = snapshot.get().get(key);
        if (entry == null) {
            return fallback;
        }
        T value = converter.extractValue(entry.variation);
        summaryRecorder.recordUsage(entry);
        return value == null ? fallback : value;
    }

    /**
     * @return every current config value, or an empty map while the SDK is disabled
     */
    Map<String, ConfigValue> getAllFlags() {
        return enabled ? snapshot.get().values() : Collections.emptyMap();
    }

    ConfigSnapshot getSnapshot() {
        return snapshot.get();
    }

    /**
     * @return the last settings document fetched, or null if none has been
     */
    SdkSettings getSdkSettings() {
        return sdkSettings;
    }

    boolean isEnabled() {
        return enabled;
    }

    ResponseMetadata getPreviousMetadata() {
        return previousMetadata;
    }

    Subscription registerConfigListener(String key, ConfigChangeListener listener) {
        CopyOnWriteArrayList<ConfigChangeListener> list =
                configListeners.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>());
        list.add(listener);
        return () -> list.remove(listener);
    }

    <T> Subscription registerTypedConfigListener(String key, ValueTypes.Converter<T> converter,
                                                 TypedConfigChangeListener<T> listener) {
        return registerConfigListener(key, (k, newValue) -> {
            if (newValue == null) {
                return;
            }
            T converted = converter.extractValue(newValue);
            if (converted != null) {
                listener.onConfigChanged(k, converted);
            }
        });
    }

    Subscription registerAllFlagsListener(AllFlagsListener listener) {
        allFlagsListeners.add(listener);
        return () -> allFlagsListeners.remove(listener);
    }

    /**
     * Starts periodic checks, replacing any existing schedule.
     *
     * @param intervalMs the interval between checks
     * @param initialCheck true to run the first check immediately
     */
    void startPolling(long intervalMs, boolean initialCheck) {
        synchronized (timerLock) {
            if (closed) {
                return;
            }
            pollIntervalMs = intervalMs;
            pollingPaused = false;
            restartTimerLocked(initialCheck ? 0 : intervalMs);
        }
        logger.debug("Polling for settings every {} ms", intervalMs);
    }

    /**
     * Changes the polling interval. A check already running is not affected.
     *
     * @param intervalMs the new interval
     */
    void updatePollingInterval(long intervalMs) {
        synchronized (timerLock) {
            if (closed || (intervalMs == pollIntervalMs && pollTask != null)) {
                return;
            }
            pollIntervalMs = intervalMs;
            if (!pollingPaused) {
                restartTimerLocked(intervalMs);
            }
        }
        logger.debug("Settings polling interval is now {} ms", intervalMs);
    }

    void pausePolling() {
        synchronized (timerLock) {
            pollingPaused = true;
            cancelTimerLocked();
        }
        logger.debug("Settings polling paused");
    }

    void resumePolling() {
        synchronized (timerLock) {
            if (closed || !pollingPaused || pollIntervalMs <= 0) {
                return;
            }
            pollingPaused = false;
            restartTimerLocked(pollIntervalMs);
        }
        logger.debug("Settings polling resumed");
    }

    boolean isPolling() {
        synchronized (timerLock) {
            return pollTask != null;
        }
    }

    long getPollingIntervalMs() {
        synchronized (timerLock) {
            return pollIntervalMs;
        }
    }

    @Override
    public void close() {
        synchronized (timerLock) {
            closed = true;
            cancelTimerLocked();
        }
        configListeners.clear();
        allFlagsListeners.clear();
    }

    private void restartTimerLocked(long initialDelayMs) {
        cancelTimerLocked();
        pollTask = taskExecutor.startRepeatingTask(this::checkSettings, initialDelayMs, pollIntervalMs);
    }

    private void cancelTimerLocked() {
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
    }

    private <T> T withTimeout(Callable<T> task) throws CFFailure {
        Future<T> future = taskExecutor.submitTask(task);
        try {
            return future.get(config.getSdkSettingsTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CFFailure("Settings check timed out after " + config.getSdkSettingsTimeoutMs() + " ms",
                    e, CFFailure.FailureType.TIMEOUT);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CFFailure("Settings check was interrupted", e, CFFailure.FailureType.INTERNAL_ERROR);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CFFailure) {
                throw (CFFailure) cause;
            }
            throw new CFFailure("Settings check failed", cause, CFFailure.FailureType.INTERNAL_ERROR);
        }
    }

    // network phase: reads only, so that a failure or timeout leaves no partial state behind
    private CheckOutcome fetchChanges(String settingsUrl) throws CFFailure {
        ResponseMetadata metadata = transport.fetchMetadata(settingsUrl);
        if (metadata == null || metadata.isEmpty()) {
            logger.debug("Settings response has no ETag or Last-Modified; nothing to compare");
            return ABORTED;
        }
        ResponseMetadata previous = previousMetadata;
        String previousLastModified = previous == null ? null : previous.getLastModified();
        String previousEtag = previous == null ? null : previous.getEtag();
        boolean changed = (metadata.getLastModified() != null && !metadata.getLastModified().equals(previousLastModified))
                || (metadata.getEtag() != null && !metadata.getEtag().equals(previousEtag));

        SdkSettings settings = null;
        if (sdkSettings == null || changed) {
            TransportResponse response = transport.fetchFull(settingsUrl, null, null);
            settings = SdkSettings.parse(response.getBody());
        }
        boolean nowEnabled = settings != null ? settings.isSdkEnabled() : enabled;

        JsonObject configDocument = null;
        ResponseMetadata configMetadata = null;
        if (changed && nowEnabled) {
            TransportResponse response = transport.fetchFull(config.getUserConfigsUrl(), configRequestBody(),
                    null, metadata.getLastModified());
            if (response.isNotModified()) {
                logger.debug("Config document not modified");
            } else {
                configDocument = parseObject(response.getBody());
                configMetadata = response.getMetadata();
            }
        }
        return new CheckOutcome(metadata, settings, configDocument, configMetadata);
    }

    private void apply(CheckOutcome outcome) {
        if (outcome.settings != null) {
            boolean wasEnabled = enabled;
            sdkSettings = outcome.settings;
            enabled = outcome.settings.isSdkEnabled();
            if (wasEnabled != enabled) {
                logger.info("SDK functionality is now {} by account settings", enabled ? "enabled" : "disabled");
            }
        }
        ConfigSnapshot next = null;
        Set<String> changedKeys = Collections.emptySet();
        if (outcome.configDocument != null) {
            next = ConfigSnapshot.parse(outcome.configDocument, outcome.configMetadata, logger);
            ConfigSnapshot previous = snapshot.getAndSet(next);
            changedKeys = next.changedKeys(previous);
            Map<String, String> cacheMetadata = new HashMap<>();
            if (outcome.configMetadata.getEtag() != null) {
                cacheMetadata.put(CACHE_METADATA_ETAG, outcome.configMetadata.getEtag());
            }
            if (outcome.configMetadata.getLastModified() != null) {
                cacheMetadata.put(CACHE_METADATA_LAST_MODIFIED, outcome.configMetadata.getLastModified());
            }
            configCache.put(CONFIG_CACHE_KEY, outcome.configDocument, CONFIG_CACHE_TTL_SECONDS, true, cacheMetadata);
            logger.info("Received {} config(s); {} changed", next.size(), changedKeys.size());
        }
        previousMetadata = outcome.metadata;
        store.setSettingsMetadata(outcome.metadata);
        if (next != null && !changedKeys.isEmpty() && enabled) {
            notifyListeners(changedKeys, next);
        }
    }

    private void notifyListeners(Set<String> changedKeys, ConfigSnapshot current) {
        for (String key: changedKeys) {
            CopyOnWriteArrayList<ConfigChangeListener> list = configListeners.get(key);
            if (list == null) {
                continue;
            }
            ConfigEntry entry = current.get(key);
            ConfigValue newValue = entry == null ? null : entry.variation;
            for (ConfigChangeListener listener: list) {
                taskExecutor.executeCallback(() -> listener.onConfigChanged(key, newValue));
            }
        }
        Map<String, ConfigValue> all = current.values();
        for (AllFlagsListener listener: allFlagsListeners) {
            taskExecutor.executeCallback(() -> listener.onFlagsChanged(all));
        }
    }

    private String configRequestBody() {
        JsonObject body = new JsonObject();
        body.add("user", GsonCache.getGson().toJsonTree(userSource.get()));
        body.addProperty("include_only_features_flags", true);
        return GsonCache.getGson().toJson(body);
    }

    private static JsonObject parseObject(String body) throws CFFailure {
        try {
            JsonElement e = body == null ? null : JsonParser.parseString(body);
            if (e == null || !e.isJsonObject()) {
                throw new CFFailure("Config document is not a JSON object", CFFailure.FailureType.INVALID_RESPONSE_BODY);
            }
            return e.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new CFFailure("Config document could not be parsed", e, CFFailure.FailureType.INVALID_RESPONSE_BODY);
        }
    }
}
