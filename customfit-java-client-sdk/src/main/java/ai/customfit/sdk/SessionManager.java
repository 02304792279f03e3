package ai.customfit.sdk;

import com.google.gson.JsonParseException;
import com.launchdarkly.logging.LDLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Owns the current analytics session and decides when it is replaced.
 * <p>
 * A session is rotated when the application starts (unless the previous start was recent enough
 * to count as the same run), when it has lasted longer than the configured maximum, when the
 * application returns from a long stay in the background, when the user changes, or on request.
 * The current {@link SessionRecord} and the time of the last application start are kept in the
 * persistent store so that a quick restart resumes the same session.
 * <p>
 * State changes happen under a single lock; listeners are notified afterward, on the callback
 * thread of the {@link TaskExecutor}.
 */
final class SessionManager {
    private final SessionConfig config;
    private final PersistentDataStoreWrapper store;
    private final TaskExecutor taskExecutor;
    private final Clock clock;
    private final Supplier<UUID> idSource;
    private final LDLogger logger;
    private final CopyOnWriteArrayList<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private SessionRecord currentSession;
    private long appStartTime;
    private long backgroundSince; // 0 when in the foreground

    SessionManager(
            SessionConfig config,
            PersistentDataStoreWrapper store,
            TaskExecutor taskExecutor,
            Clock clock,
            Supplier<UUID> idSource,
            LDLogger logger
    ) {
        this.config = config;
        this.store = store;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
        this.idSource = idSource;
        this.logger = logger;
    }

    /**
     * Establishes the session for this run of the application: either resumes the stored session,
     * or rotates to a new one with reason {@link RotationReason#APP_START}.
     */
    void initialize() {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            long now = clock.millis();
            appStartTime = now;
            Long lastAppStart = store.getLastAppStart();
            store.setLastAppStart(now);
            String storedJson = store.getSessionRecord();
            SessionRecord stored = loadStoredSession(storedJson, notifications);
            boolean isNewAppStart = lastAppStart == null || now - lastAppStart > config.minSessionDurationMs;
            if (stored != null) {
                currentSession = stored;
            }
            if (isNewAppStart && config.rotateOnAppRestart) {
                rotateLocked(RotationReason.APP_START, now, notifications);
            } else if (stored != null && isSessionValid(stored, now)) {
                currentSession = stored.withLastActiveAt(now);
                storeCurrentSession();
                String id = stored.getSessionId();
                logger.info("Resumed session {}", id);
                notifications.add(() -> {
                    for (SessionListener l: listeners) {
                        l.onSessionRestored(id);
                    }
                });
            } else {
                boolean unreadable = storedJson != null && stored == null;
                rotateLocked(unreadable ? RotationReason.STORAGE_ERROR : RotationReason.APP_START, now, notifications);
            }
        }
        dispatch(notifications);
    }

    /**
     * Returns the current session id, starting a session first if there is none.
     *
     * @return the session id
     */
    String getCurrentSessionId() {
        List<Runnable> notifications = new ArrayList<>();
        String id;
        synchronized (lock) {
            if (currentSession == null) {
                rotateLocked(RotationReason.APP_START, clock.millis(), notifications);
            }
            id = currentSession.getSessionId();
        }
        dispatch(notifications);
        return id;
    }

    /**
     * @return the current session, or null if no session has started yet
     */
    SessionRecord getCurrentSession() {
        synchronized (lock) {
            return currentSession;
        }
    }

    /**
     * Records user activity. If the session has outlived its maximum duration, it is rotated
     * instead.
     */
    void updateActivity() {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            updateActivityLocked(clock.millis(), notifications);
        }
        dispatch(notifications);
    }

    void onAppBackground() {
        synchronized (lock) {
            backgroundSince = clock.millis();
        }
        logger.debug("Application moved to background");
    }

    /**
     * Rotates the session if the application was in the background longer than the configured
     * threshold; otherwise counts as activity.
     */
    void onAppForeground() {
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            long now = clock.millis();
            long backgroundDuration = backgroundSince > 0 ? now - backgroundSince : 0;
            backgroundSince = 0;
            logger.debug("Application returned to foreground after {} ms", backgroundDuration);
            if (backgroundDuration > config.backgroundThresholdMs) {
                rotateLocked(RotationReason.BACKGROUND_TIMEOUT, now, notifications);
            } else {
                updateActivityLocked(now, notifications);
            }
        }
        dispatch(notifications);
    }

    void onAuthenticationChange(String userId) {
        if (!config.rotateOnAuthChange) {
            return;
        }
        logger.info("User changed to {}; starting a new session", userId);
        List<Runnable> notifications = new ArrayList<>();
        synchronized (lock) {
            rotateLocked(RotationReason.AUTH_CHANGE, clock.millis(), notifications);
        }
        dispatch(notifications);
    }

    /**
     * Starts a new session unconditionally.
     *
     * @return the new session id
     */
    String forceRotation() {
        List<Runnable> notifications = new ArrayList<>();
        String id;
        synchronized (lock) {
            rotateLocked(RotationReason.MANUAL_ROTATION, clock.millis(), notifications);
            id = currentSession.getSessionId();
        }
        dispatch(notifications);
        return id;
    }

    Subscription addListener(SessionListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    SessionStats getSessionStats() {
        synchronized (lock) {
            long now = clock.millis();
            SessionRecord s = currentSession;
            return new SessionStats(
                    s != null,
                    s == null ? null : s.getSessionId(),
                    s == null ? 0 : now - s.getCreatedAt(),
                    s == null ? 0 : now - s.getLastActiveAt(),
                    backgroundSince,
                    listeners.size());
        }
    }

    private void updateActivityLocked(long now, List<Runnable> notifications) {
        if (currentSession == null) {
            rotateLocked(RotationReason.APP_START, now, notifications);
            return;
        }
        if (config.enableTimeBasedRotation && now - currentSession.getCreatedAt() >= config.maxSessionDurationMs) {
            rotateLocked(RotationReason.MAX_DURATION_EXCEEDED, now, notifications);
        } else {
            currentSession = currentSession.withLastActiveAt(now);
            storeCurrentSession();
        }
    }

    private void rotateLocked(RotationReason reason, long now, List<Runnable> notifications) {
        String oldId = currentSession == null ? null : currentSession.getSessionId();
        String newId = generateSessionId(now);
        currentSession = new SessionRecord(newId, now, now, appStartTime == 0 ? now : appStartTime, reason);
        storeCurrentSession();
        logger.info("Session rotated from {} to {} ({})", oldId, newId, reason.getDescription());
        notifications.add(() -> {
            for (SessionListener l: listeners) {
                l.onSessionRotated(oldId, newId, reason);
            }
        });
    }

    private String generateSessionId(long now) {
        String uuid = idSource.get().toString().replace("-", "").toLowerCase(Locale.ROOT);
        return config.sessionIdPrefix + "_" + now + "_" + uuid.substring(0, 8);
    }

    private boolean isSessionValid(SessionRecord session, long now) {
        return now - session.getCreatedAt() < config.maxSessionDurationMs
                && now - session.getLastActiveAt() < config.backgroundThresholdMs;
    }

    private SessionRecord loadStoredSession(String json, List<Runnable> notifications) {
        if (json == null) {
            return null;
        }
        try {
            SessionRecord record = GsonCache.getGson().fromJson(json, SessionRecord.class);
            if (record == null || CFUtil.isNullOrBlank(record.getSessionId())) {
                throw new JsonParseException("session record has no id");
            }
            return record;
        } catch (JsonParseException e) {
            CFUtil.logExceptionAtWarnLevel(logger, e, "Discarding unreadable stored session");
            store.setSessionRecord(null);
            String message = "Stored session could not be read: " + e.getMessage();
            notifications.add(() -> {
                for (SessionListener l: listeners) {
                    l.onSessionError(message);
                }
            });
            return null;
        }
    }

    private void storeCurrentSession() {
        store.setSessionRecord(GsonCache.getGson().toJson(currentSession));
    }

    private void dispatch(List<Runnable> notifications) {
        for (Runnable n: notifications) {
            taskExecutor.executeCallback(n);
        }
    }
}
