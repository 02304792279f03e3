package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.BlobStore;
import ai.customfit.sdk.subsystems.PersistentDataStore;
import ai.customfit.sdk.subsystems.Transport;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Client for accessing CustomFit configs and sending analytics.
 * <p>
 * Create one instance per application with {@link #init(CFConfig, CFUser)}. The client serves
 * configs from memory; a cached copy from the previous run is available immediately, and a
 * background poller keeps it up to date. Reads never block on the network.
 */
public class CFClient implements Closeable {
    static final long CACHE_CLEANUP_INTERVAL_MS = 60 * 60 * 1000;
    static final String CONFIG_CACHE_NAME = "configs";

    private static final int SETTINGS_MAX_ATTEMPTS = 3;
    private static final long SETTINGS_RETRY_INITIAL_DELAY_MS = 100;
    private static final long SETTINGS_RETRY_MAX_DELAY_MS = 1000;

    private final CFConfig config;
    private final LDLogger logger;
    private final TaskExecutor taskExecutor;
    private final Transport transport;
    private final DefaultPlatformState platformState;
    private final CircuitBreakerRegistry circuitBreakers;
    private final TTLCache<JsonObject> configCache;
    private final SessionManager sessionManager;
    private final SummaryManager summaryManager;
    private final EventTracker eventTracker;
    private final ConnectionManager connectionManager;
    private final SettingsSynchronizer settingsSynchronizer;
    private final ScheduledFuture<?> cacheCleanupTask;

    private final PlatformState.ConnectivityChangeListener connectivityListener;
    private final PlatformState.ForegroundChangeListener foregroundListener;
    private final PlatformState.BatteryChangeListener batteryListener;

    private final Object stateLock = new Object();
    private volatile CFUser user;
    private volatile boolean offline;
    private boolean closed;

    /**
     * Creates and starts a client.
     * <p>
     * Startup does not wait for the network: if a config document was cached by a previous run
     * it is served at once, and otherwise reads return their fallbacks until the first settings
     * check completes. Use {@link #registerAllFlagsListener(AllFlagsListener)} to find out when
     * configs arrive.
     *
     * @param config the client configuration
     * @param user the current user
     * @return the client
     */
    public static CFClient init(CFConfig config, CFUser user) {
        return new CFClient(config, user);
    }

    protected CFClient(CFConfig config, CFUser user) {
        this.config = Objects.requireNonNull(config, "config");
        this.user = user == null ? new CFUser.Builder(null).build() : user;
        this.logger = LDLogger.withAdapter(config.getLogAdapter(), config.getLoggerName());
        logger.info("Creating CustomFit client. Version: {}", CFPackageConsts.SDK_VERSION);

        File cacheDir = config.getCacheDir();
        this.platformState = new DefaultPlatformState();
        this.taskExecutor = new DefaultTaskExecutor(logger);
        this.transport = config.transport != null ? config.transport : new HttpTransport(config, logger);
        PersistentDataStore persistentStore = config.persistentDataStore != null
                ? config.persistentDataStore : new FilePersistentDataStore(cacheDir);
        BlobStore blobStore = config.blobStore != null
                ? config.blobStore : new FileBlobStore(new File(cacheDir, "blobs"));
        PersistentDataStoreWrapper store = new PersistentDataStoreWrapper(persistentStore, config.getClientKey(),
                logger.subLogger("Storage"));

        this.offline = config.isOffline();
        this.circuitBreakers = new CircuitBreakerRegistry(config.clock, logger);
        this.configCache = new TTLCache<>(CONFIG_CACHE_NAME, JsonObject.class, store, blobStore, taskExecutor,
                config.clock, logger.subLogger("Cache"));
        this.sessionManager = new SessionManager(config.getSessionConfig(), store, taskExecutor, config.clock,
                config.idSource, logger.subLogger("Session"));
        this.connectionManager = new ConnectionManager(store, taskExecutor, config.clock, offline,
                this::checkSettingsInBackground, logger.subLogger("Connection"));

        RetryPolicy deliveryRetry = RetryPolicy.fromConfig(config, logger);
        this.summaryManager = new SummaryManager(config, this::getUser, sessionManager::getCurrentSessionId,
                transport, store, taskExecutor, deliveryRetry, connectionManager, logger.subLogger("Summaries"));
        this.eventTracker = new EventTracker(config, this::getUser, sessionManager::getCurrentSessionId,
                transport, store, taskExecutor, deliveryRetry, connectionManager, summaryManager.getQueue(),
                logger.subLogger("Events"));

        RetryPolicy settingsRetry = RetryPolicy.builder()
                .maxAttempts(SETTINGS_MAX_ATTEMPTS)
                .initialDelayMillis(SETTINGS_RETRY_INITIAL_DELAY_MS)
                .maxDelayMillis(SETTINGS_RETRY_MAX_DELAY_MS)
                .shouldRetry(RetryPolicy.retryAllExceptCancellation())
                .logger(logger)
                .build();
        this.settingsSynchronizer = new SettingsSynchronizer(config, this::getUser, transport, configCache, store,
                circuitBreakers, settingsRetry, taskExecutor, summaryManager, connectionManager,
                logger.subLogger("Settings"));

        settingsSynchronizer.hydrateFromCache();
        sessionManager.initialize();
        summaryManager.getQueue().restorePersisted();
        eventTracker.getQueue().restorePersisted();
        summaryManager.getQueue().start();
        eventTracker.getQueue().start();
        if (!offline) {
            settingsSynchronizer.startPolling(currentPollingInterval(), true);
        }
        this.cacheCleanupTask = taskExecutor.startRepeatingTask(this::cleanupCache, 0, CACHE_CLEANUP_INTERVAL_MS);

        this.connectivityListener = this::onConnectivityChanged;
        this.foregroundListener = this::onForegroundChanged;
        this.batteryListener = batteryLow -> updatePolling();
        platformState.addConnectivityChangeListener(connectivityListener);
        platformState.addForegroundChangeListener(foregroundListener);
        platformState.addBatteryChangeListener(batteryListener);
    }

    /**
     * Returns the object through which the application reports host events: network
     * reachability, foreground/background transitions and battery state.
     *
     * @return the platform signal sink
     */
    public DefaultPlatformState getPlatformSignals() {
        return platformState;
    }

    public String getString(String key, String fallback) {
        return settingsSynchronizer.getValue(key, fallback, ValueTypes.STRING);
    }

    public boolean getBoolean(String key, boolean fallback) {
        return settingsSynchronizer.getValue(key, fallback, ValueTypes.BOOLEAN);
    }

    public double getNumber(String key, double fallback) {
        return settingsSynchronizer.getValue(key, fallback, ValueTypes.DOUBLE);
    }

    public int getInt(String key, int fallback) {
        return settingsSynchronizer.getValue(key, fallback, ValueTypes.INT);
    }

    public JsonElement getJson(String key, JsonElement fallback) {
        return settingsSynchronizer.getValue(key, fallback, ValueTypes.JSON);
    }

    /**
     * Reads a config value of any type.
     *
     * @param key the config key
     * @param fallback returned if the config is missing or does not convert
     * @param converter one of the {@link ValueTypes} converters, or a custom one
     * @param <T> the value type
     * @return the value or {@code fallback}
     */
    public <T> T getValue(String key, T fallback, ValueTypes.Converter<T> converter) {
        return settingsSynchronizer.getValue(key, fallback, converter);
    }

    /**
     * @return every current config value; empty while account settings disable the SDK
     */
    public Map<String, ConfigValue> getAllFlags() {
        return settingsSynchronizer.getAllFlags();
    }

    /**
     * Records an event with no properties.
     *
     * @param eventName the event name
     * @return the queued event, or the reason it was rejected
     */
    public CFResult<EventData> trackEvent(String eventName) {
        return trackEvent(eventName, Collections.emptyMap());
    }

    /**
     * Records an event. Events are delivered in batches, after any pending usage summaries.
     *
     * @param eventName the event name
     * @param properties event properties
     * @return the queued event, or the reason it was rejected
     */
    public CFResult<EventData> trackEvent(String eventName, Map<String, ?> properties) {
        sessionManager.updateActivity();
        return eventTracker.trackEvent(eventName, properties);
    }

    public Subscription registerConfigListener(String key, ConfigChangeListener listener) {
        return settingsSynchronizer.registerConfigListener(key, listener);
    }

    public <T> Subscription registerTypedConfigListener(String key, ValueTypes.Converter<T> converter,
                                                        TypedConfigChangeListener<T> listener) {
        return settingsSynchronizer.registerTypedConfigListener(key, converter, listener);
    }

    public Subscription registerAllFlagsListener(AllFlagsListener listener) {
        return settingsSynchronizer.registerAllFlagsListener(listener);
    }

    /**
     * Registers a listener for connection status changes. The listener is called at once with
     * the current status.
     *
     * @param listener the listener
     * @return a handle that unregisters the listener
     */
    public Subscription addConnectionStatusListener(ConnectionStatusListener listener) {
        return connectionManager.addConnectionStatusListener(listener);
    }

    public Subscription addSessionListener(SessionListener listener) {
        return sessionManager.addListener(listener);
    }

    public Subscription addEventDropListener(QueueItemDroppedListener<EventData> listener) {
        return eventTracker.getQueue().addDropListener(listener);
    }

    /**
     * Discards the stored settings validators and checks for new configs now. Blocks until the
     * check completes, unless another check is already running.
     */
    public void forceRefresh() {
        settingsSynchronizer.forceRefresh();
    }

    /**
     * Delivers all pending usage summaries, then all pending events. Blocks until done.
     *
     * @return the number of events delivered
     */
    public int flushEvents() {
        return eventTracker.flush();
    }

    /**
     * Stops all network activity. Analytics are kept on disk until the client goes online.
     */
    public void setOffline() {
        synchronized (stateLock) {
            if (closed || offline) {
                return;
            }
            offline = true;
        }
        logger.info("Going offline");
        settingsSynchronizer.pausePolling();
        connectionManager.setOfflineMode(true);
        updateQueueOfflineState();
    }

    /**
     * Resumes network activity: pending analytics are sent and configs are checked.
     */
    public void setOnline() {
        synchronized (stateLock) {
            if (closed || !offline) {
                return;
            }
            offline = false;
        }
        logger.info("Going online");
        updateQueueOfflineState();
        connectionManager.setOfflineMode(false);
        updatePolling();
    }

    public boolean isOffline() {
        return offline;
    }

    public ConnectionInformation getConnectionInformation() {
        return connectionManager.getConnectionInformation();
    }

    public String getCurrentSessionId() {
        return sessionManager.getCurrentSessionId();
    }

    public SessionStats getSessionStats() {
        return sessionManager.getSessionStats();
    }

    /**
     * Starts a new session now.
     *
     * @return the new session id
     */
    public String forceSessionRotation() {
        return sessionManager.forceRotation();
    }

    /**
     * Reports user activity, keeping the current session alive.
     */
    public void updateSessionActivity() {
        sessionManager.updateActivity();
    }

    /**
     * Replaces the current user. If the customer id changed, the session is rotated and configs
     * are fetched again for the new user.
     *
     * @param newUser the new user
     */
    public void setUser(CFUser newUser) {
        Objects.requireNonNull(newUser, "newUser");
        CFUser previous = user;
        user = newUser;
        if (!Objects.equals(previous.getUserCustomerId(), newUser.getUserCustomerId())) {
            sessionManager.onAuthenticationChange(newUser.getUserCustomerId());
            if (!offline) {
                taskExecutor.submitTask(() -> settingsSynchronizer.forceRefresh());
            }
        }
    }

    /**
     * Tells the client the user signed in or out, which starts a new session.
     *
     * @param userId the new user id, or null on sign-out
     */
    public void onUserAuthenticationChange(String userId) {
        sessionManager.onAuthenticationChange(userId);
    }

    public CFUser getUser() {
        return user;
    }

    /**
     * Shuts down the client, delivering what it can of the pending analytics first.
     *
     * @throws IOException if a component failed to shut down cleanly
     */
    @Override
    public void close() throws IOException {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        logger.info("Closing CustomFit client");
        platformState.removeConnectivityChangeListener(connectivityListener);
        platformState.removeForegroundChangeListener(foregroundListener);
        platformState.removeBatteryChangeListener(batteryListener);
        cacheCleanupTask.cancel(false);
        settingsSynchronizer.close();
        summaryManager.close();
        eventTracker.close();
        connectionManager.close();
        circuitBreakers.clear();
        taskExecutor.close();
        if (transport instanceof Closeable) {
            ((Closeable) transport).close();
        }
        platformState.close();
    }

    // package-private accessors for tests

    SettingsSynchronizer getSettingsSynchronizer() {
        return settingsSynchronizer;
    }

    SessionManager getSessionManager() {
        return sessionManager;
    }

    EventTracker getEventTracker() {
        return eventTracker;
    }

    SummaryManager getSummaryManager() {
        return summaryManager;
    }

    private void onConnectivityChanged(boolean networkAvailable) {
        logger.debug("Network {}", networkAvailable ? "available" : "unavailable");
        updateQueueOfflineState();
        connectionManager.setNetworkAvailable(networkAvailable);
    }

    private void onForegroundChanged(boolean foreground) {
        if (foreground) {
            sessionManager.onAppForeground();
        } else {
            sessionManager.onAppBackground();
        }
        updatePolling();
    }

    private void updateQueueOfflineState() {
        boolean queuesOffline = offline || !platformState.isNetworkAvailable();
        summaryManager.getQueue().setOffline(queuesOffline);
        eventTracker.getQueue().setOffline(queuesOffline);
    }

    private void updatePolling() {
        synchronized (stateLock) {
            if (closed) {
                return;
            }
        }
        if (offline || (!platformState.isForeground() && config.isDisableBackgroundPolling())) {
            settingsSynchronizer.pausePolling();
            return;
        }
        long interval = currentPollingInterval();
        if (settingsSynchronizer.isPolling()) {
            settingsSynchronizer.updatePollingInterval(interval);
        } else {
            settingsSynchronizer.startPolling(interval, false);
        }
    }

    private long currentPollingInterval() {
        long interval = platformState.isForeground()
                ? config.getSdkSettingsCheckIntervalMs() : config.getBackgroundPollingIntervalMs();
        if (platformState.isBatteryLow() && config.isUseReducedPollingWhenBatteryLow()) {
            interval = Math.max(interval, config.getReducedPollingIntervalMs());
        }
        return interval;
    }

    private void checkSettingsInBackground() {
        settingsSynchronizer.checkSettings();
    }

    private void cleanupCache() {
        int removed = configCache.cleanupExpired();
        if (removed > 0) {
            logger.debug("Removed {} expired cache entries", removed);
        }
    }
}
