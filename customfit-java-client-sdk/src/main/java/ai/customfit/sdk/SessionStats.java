package ai.customfit.sdk;

/**
 * Point-in-time information about the current session, for diagnostics.
 *
 * @see CFClient#getSessionStats()
 */
public final class SessionStats {
    private final boolean hasActiveSession;
    private final String sessionId;
    private final long sessionAgeMs;
    private final long lastActiveAgeMs;
    private final long backgroundSince;
    private final int listenerCount;

    SessionStats(boolean hasActiveSession, String sessionId, long sessionAgeMs, long lastActiveAgeMs,
                 long backgroundSince, int listenerCount) {
        this.hasActiveSession = hasActiveSession;
        this.sessionId = sessionId;
        this.sessionAgeMs = sessionAgeMs;
        this.lastActiveAgeMs = lastActiveAgeMs;
        this.backgroundSince = backgroundSince;
        this.listenerCount = listenerCount;
    }

    public boolean hasActiveSession() {
        return hasActiveSession;
    }

    /**
     * @return the current session id, or null if there is no session yet
     */
    public String getSessionId() {
        return sessionId;
    }

    public long getSessionAgeMs() {
        return sessionAgeMs;
    }

    public long getLastActiveAgeMs() {
        return lastActiveAgeMs;
    }

    /**
     * @return when the application went to the background, or 0 if it is in the foreground
     */
    public long getBackgroundSince() {
        return backgroundSince;
    }

    public int getListenerCount() {
        return listenerCount;
    }

    @Override
    public String toString() {
        return "SessionStats(sessionId=" + sessionId + ", ageMs=" + sessionAgeMs
                + ", lastActiveAgeMs=" + lastActiveAgeMs + ")";
    }
}
