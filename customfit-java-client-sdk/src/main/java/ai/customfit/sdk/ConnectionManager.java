package ai.customfit.sdk;

import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * Derives the client's {@link ConnectionStatus} from the outcome of real network traffic, and
 * drives reconnection after failures.
 * <p>
 * Every settings check and queue flush reports success or failure here. After a failure, a
 * reconnect attempt is scheduled with exponential backoff and jitter; the attempt runs the
 * reconnect action (a settings check), whose own outcome feeds back into this class. The times
 * of the last success and failure are kept in the persistent store.
 */
final class ConnectionManager implements ConnectionRecorder, Closeable {
    static final long BASE_RECONNECT_DELAY_MS = 1_000;
    static final long MAX_RECONNECT_DELAY_MS = 30_000;
    static final double RECONNECT_JITTER_FACTOR = 0.2;

    private final PersistentDataStoreWrapper store;
    private final TaskExecutor taskExecutor;
    private final Clock clock;
    private final Runnable reconnectAction;
    private final LDLogger logger;
    private final CopyOnWriteArrayList<ConnectionStatusListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private ConnectionStatus status;
    private boolean offlineMode;
    private boolean networkAvailable = true;
    private String lastError;
    private Long lastSuccessTime;
    private Long lastFailureTime;
    private int failureCount;
    private long nextReconnectTime;
    private ScheduledFuture<?> reconnectTask;
    private boolean closed;

    ConnectionManager(
            PersistentDataStoreWrapper store,
            TaskExecutor taskExecutor,
            Clock clock,
            boolean offline,
            Runnable reconnectAction,
            LDLogger logger
    ) {
        this.store = store;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
        this.reconnectAction = reconnectAction;
        this.logger = logger;
        this.offlineMode = offline;
        this.status = offline ? ConnectionStatus.OFFLINE : ConnectionStatus.CONNECTING;
        PersistentDataStoreWrapper.SavedConnectionInfo saved = store.getConnectionInfo();
        this.lastSuccessTime = saved.lastSuccessTime;
        this.lastFailureTime = saved.lastFailureTime;
        this.lastError = saved.lastFailureMessage;
    }

    @Override
    public void recordConnectionSuccess() {
        ConnectionInformation info;
        synchronized (lock) {
            failureCount = 0;
            lastError = null;
            lastSuccessTime = clock.millis();
            cancelReconnectLocked();
            saveLocked();
            info = updateStatusLocked(offlineMode ? ConnectionStatus.OFFLINE : ConnectionStatus.CONNECTED);
        }
        notifyListeners(info);
    }

    @Override
    public void recordConnectionFailure(Throwable error) {
        ConnectionInformation info;
        synchronized (lock) {
            failureCount++;
            lastError = error == null ? "unknown error" : error.getMessage();
            lastFailureTime = clock.millis();
            saveLocked();
            if (offlineMode || !networkAvailable || closed) {
                return;
            }
            long delay = RetryPolicy.nextDelay(failureCount, BASE_RECONNECT_DELAY_MS, MAX_RECONNECT_DELAY_MS,
                    RetryPolicy.DEFAULT_MULTIPLIER, RECONNECT_JITTER_FACTOR);
            scheduleReconnectLocked(delay);
            info = updateStatusLocked(ConnectionStatus.CONNECTING);
        }
        notifyListeners(info);
    }

    /**
     * Enters or leaves offline mode. Leaving it starts a reconnect attempt immediately.
     *
     * @param offline true to go offline
     */
    void setOfflineMode(boolean offline) {
        ConnectionInformation info;
        synchronized (lock) {
            offlineMode = offline;
            if (offline) {
                cancelReconnectLocked();
                info = updateStatusLocked(ConnectionStatus.OFFLINE);
            } else if (networkAvailable) {
                scheduleReconnectLocked(0);
                info = updateStatusLocked(ConnectionStatus.CONNECTING);
            } else {
                info = updateStatusLocked(ConnectionStatus.DISCONNECTED);
            }
        }
        notifyListeners(info);
    }

    /**
     * Reacts to the host's report of network availability. Regaining the network starts a
     * reconnect attempt immediately.
     *
     * @param available true if the network is available
     */
    void setNetworkAvailable(boolean available) {
        ConnectionInformation info;
        synchronized (lock) {
            if (networkAvailable == available) {
                return;
            }
            networkAvailable = available;
            if (offlineMode) {
                return;
            }
            if (available) {
                scheduleReconnectLocked(0);
                info = updateStatusLocked(ConnectionStatus.CONNECTING);
            } else {
                cancelReconnectLocked();
                info = updateStatusLocked(ConnectionStatus.DISCONNECTED);
            }
        }
        notifyListeners(info);
    }

    boolean isOffline() {
        synchronized (lock) {
            return offlineMode;
        }
    }

    ConnectionStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    ConnectionInformation getConnectionInformation() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    /**
     * Registers a listener, and notifies it of the current status.
     *
     * @param listener the listener
     * @return a handle that unregisters the listener
     */
    Subscription addConnectionStatusListener(ConnectionStatusListener listener) {
        listeners.add(listener);
        ConnectionInformation info = getConnectionInformation();
        taskExecutor.executeCallback(() -> listener.onConnectionStatusChanged(info.getStatus(), info));
        return () -> listeners.remove(listener);
    }

    @Override
    public void close() {
        synchronized (lock) {
            closed = true;
            cancelReconnectLocked();
        }
        listeners.clear();
    }

    private void scheduleReconnectLocked(long delayMs) {
        cancelReconnectLocked();
        if (closed) {
            return;
        }
        nextReconnectTime = delayMs > 0 ? clock.millis() + delayMs : 0;
        logger.debug("Scheduling reconnect in {} ms", delayMs);
        reconnectTask = taskExecutor.scheduleTask(() -> {
            synchronized (lock) {
                nextReconnectTime = 0;
                reconnectTask = null;
                if (offlineMode || !networkAvailable || closed) {
                    return;
                }
            }
            logger.debug("Attempting reconnection");
            reconnectAction.run();
        }, delayMs);
    }

    private void cancelReconnectLocked() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
        nextReconnectTime = 0;
    }

    // returns null if the status did not change
    private ConnectionInformation updateStatusLocked(ConnectionStatus newStatus) {
        if (status == newStatus) {
            return null;
        }
        status = newStatus;
        logger.info("Connection status changed to {}", newStatus);
        return snapshotLocked();
    }

    private ConnectionInformation snapshotLocked() {
        return new ConnectionInformationState(status, offlineMode, lastError, lastSuccessTime, lastFailureTime,
                failureCount, nextReconnectTime);
    }

    private void saveLocked() {
        store.setConnectionInfo(new PersistentDataStoreWrapper.SavedConnectionInfo(
                lastSuccessTime, lastFailureTime, lastError));
    }

    private void notifyListeners(ConnectionInformation info) {
        if (info == null) {
            return;
        }
        for (ConnectionStatusListener listener: listeners) {
            taskExecutor.executeCallback(() -> listener.onConnectionStatusChanged(info.getStatus(), info));
        }
    }
}
