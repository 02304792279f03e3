package ai.customfit.sdk;

/**
 * Provides various information about the current or previous connection.
 */
public interface ConnectionInformation {
    /**
     * @return the current status
     */
    ConnectionStatus getStatus();

    /**
     * @return true if the client is in offline mode
     */
    boolean isOfflineMode();

    /**
     * @return a description of the last failure, or null if the last exchange succeeded
     */
    String getLastError();

    /**
     * @return millis since epoch when the last successful exchange occurred, or null if never
     */
    Long getLastSuccessfulConnection();

    /**
     * @return millis since epoch when the last failed exchange occurred, or null if never
     */
    Long getLastFailedConnection();

    /**
     * @return the number of consecutive failures
     */
    int getFailureCount();

    /**
     * @return millis since epoch when the next reconnect attempt is due, or 0 if none is scheduled
     */
    long getNextReconnectTime();
}
