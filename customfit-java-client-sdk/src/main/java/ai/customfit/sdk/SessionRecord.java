package ai.customfit.sdk;

import com.google.gson.annotations.SerializedName;

/**
 * An immutable snapshot of an analytics session.
 */
public final class SessionRecord {
    @SerializedName("sessionId") private final String sessionId;
    @SerializedName("createdAt") private final long createdAt;
    @SerializedName("lastActiveAt") private final long lastActiveAt;
    @SerializedName("appStartTime") private final long appStartTime;
    @SerializedName("rotationReason") private final RotationReason rotationReason;

    SessionRecord(String sessionId, long createdAt, long lastActiveAt, long appStartTime,
                  RotationReason rotationReason) {
        this.sessionId = sessionId;
        this.createdAt = createdAt;
        this.lastActiveAt = lastActiveAt;
        this.appStartTime = appStartTime;
        this.rotationReason = rotationReason;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastActiveAt() {
        return lastActiveAt;
    }

    public long getAppStartTime() {
        return appStartTime;
    }

    /**
     * @return why this session was started, or null if it is not known
     */
    public RotationReason getRotationReason() {
        return rotationReason;
    }

    SessionRecord withLastActiveAt(long timestamp) {
        return new SessionRecord(sessionId, createdAt, timestamp, appStartTime, rotationReason);
    }

    @Override
    public String toString() {
        return "SessionRecord(" + sessionId + ", createdAt=" + createdAt + ", lastActiveAt=" + lastActiveAt
                + ", reason=" + rotationReason + ")";
    }
}
