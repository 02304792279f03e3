package ai.customfit.sdk;

/**
 * The client's view of its connection to CustomFit.
 */
public enum ConnectionStatus {
    /**
     * The last network exchange succeeded.
     */
    CONNECTED,
    /**
     * The client is trying to reach the server, either for the first time or after a failure.
     */
    CONNECTING,
    /**
     * The host reports that no network is available.
     */
    DISCONNECTED,
    /**
     * The client was put in offline mode, and makes no network requests.
     */
    OFFLINE
}
