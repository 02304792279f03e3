package ai.customfit.sdk;

import com.google.gson.annotations.SerializedName;

/**
 * A record that a config value was served, reported so that experiment exposure can be counted.
 */
final class SummaryData implements QueueItem {
    @SerializedName("config_id") final String configId;
    @SerializedName("version") final String version;
    @SerializedName("user_id") final String userId;
    @SerializedName("requested_time") final String requestedTime;
    @SerializedName("variation_id") final String variationId;
    @SerializedName("user_customer_id") final String userCustomerId;
    @SerializedName("session_id") final String sessionId;
    @SerializedName("behaviour_id") final String behaviourId;
    @SerializedName("experience_id") final String experienceId;
    @SerializedName("rule_id") final String ruleId;

    SummaryData(String configId, String version, String userId, String requestedTime, String variationId,
                String userCustomerId, String sessionId, String behaviourId, String experienceId, String ruleId) {
        this.configId = configId;
        this.version = version;
        this.userId = userId;
        this.requestedTime = requestedTime;
        this.variationId = variationId;
        this.userCustomerId = userCustomerId;
        this.sessionId = sessionId;
        this.behaviourId = behaviourId;
        this.experienceId = experienceId;
        this.ruleId = ruleId;
    }

    @Override
    public String getTimestamp() {
        return requestedTime;
    }

    @Override
    public String toString() {
        return "SummaryData(experience=" + experienceId + ", config=" + configId + ", variation=" + variationId + ")";
    }
}
