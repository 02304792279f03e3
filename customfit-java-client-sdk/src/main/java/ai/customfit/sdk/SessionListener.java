package ai.customfit.sdk;

/**
 * Receives session lifecycle notifications. Methods are called on the SDK's callback thread.
 *
 * @see CFClient#addSessionListener(SessionListener)
 */
public interface SessionListener {
    /**
     * Called when a new session replaces the current one.
     *
     * @param oldSessionId the previous session id, or null if there was none
     * @param newSessionId the new session id
     * @param reason why the session was rotated
     */
    void onSessionRotated(String oldSessionId, String newSessionId, RotationReason reason);

    /**
     * Called when a session stored by a previous run was still valid and has been resumed.
     *
     * @param sessionId the resumed session id
     */
    void onSessionRestored(String sessionId);

    /**
     * Called when session state could not be read or written.
     *
     * @param message a description of the problem
     */
    void onSessionError(String message);
}
