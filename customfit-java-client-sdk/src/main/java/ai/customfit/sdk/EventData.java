package ai.customfit.sdk;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tracked analytics event, in the form it is delivered to the server.
 */
public final class EventData implements QueueItem {
    /**
     * The only event type the client reports.
     */
    public static final String EVENT_TYPE_TRACK = "TRACK";

    @SerializedName("event_customer_id") private final String eventCustomerId;
    @SerializedName("event_type") private final String eventType;
    @SerializedName("properties") private final Map<String, Object> properties;
    @SerializedName("event_timestamp") private final String eventTimestamp;
    @SerializedName("session_id") private final String sessionId;
    @SerializedName("insert_id") private final String insertId;

    EventData(String eventCustomerId, Map<String, ?> properties, String eventTimestamp,
              String sessionId, String insertId) {
        this.eventCustomerId = eventCustomerId;
        this.eventType = EVENT_TYPE_TRACK;
        this.properties = properties == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.eventTimestamp = eventTimestamp;
        this.sessionId = sessionId;
        this.insertId = insertId;
    }

    /**
     * @return the event name
     */
    public String getEventCustomerId() {
        return eventCustomerId;
    }

    public String getEventType() {
        return eventType;
    }

    public Map<String, Object> getProperties() {
        return properties == null ? Collections.emptyMap() : properties;
    }

    @Override
    public String getTimestamp() {
        return eventTimestamp;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getInsertId() {
        return insertId;
    }

    @Override
    public String toString() {
        return "EventData(" + eventCustomerId + ", " + eventTimestamp + ", " + insertId + ")";
    }
}
