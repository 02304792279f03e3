package ai.customfit.sdk;

/**
 * Listener for connection status changes.
 *
 * @see CFClient#addConnectionStatusListener(ConnectionStatusListener)
 */
@FunctionalInterface
public interface ConnectionStatusListener {
    /**
     * Called on the SDK's callback thread when the status changes, and once with the current
     * status when the listener is registered.
     *
     * @param status the new status
     * @param info details of the connection at the time of the change
     */
    void onConnectionStatusChanged(ConnectionStatus status, ConnectionInformation info);
}
