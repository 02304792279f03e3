package ai.customfit.sdk;

/**
 * Why a new session was started.
 *
 * @see SessionListener#onSessionRotated(String, String, RotationReason)
 */
public enum RotationReason {
    APP_START("Application started"),
    MAX_DURATION_EXCEEDED("Maximum session duration exceeded"),
    BACKGROUND_TIMEOUT("App was in background too long"),
    AUTH_CHANGE("User authentication changed"),
    MANUAL_ROTATION("Manually triggered rotation"),
    NETWORK_CHANGE("Network connectivity changed"),
    STORAGE_ERROR("Session storage error occurred");

    private final String description;

    RotationReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
