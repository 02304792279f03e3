package ai.customfit.sdk;

final class ConnectionInformationState implements ConnectionInformation {
    private final ConnectionStatus status;
    private final boolean offlineMode;
    private final String lastError;
    private final Long lastSuccessfulConnection;
    private final Long lastFailedConnection;
    private final int failureCount;
    private final long nextReconnectTime;

    ConnectionInformationState(ConnectionStatus status, boolean offlineMode, String lastError,
                               Long lastSuccessfulConnection, Long lastFailedConnection,
                               int failureCount, long nextReconnectTime) {
        this.status = status;
        this.offlineMode = offlineMode;
        this.lastError = lastError;
        this.lastSuccessfulConnection = lastSuccessfulConnection;
        this.lastFailedConnection = lastFailedConnection;
        this.failureCount = failureCount;
        this.nextReconnectTime = nextReconnectTime;
    }

    @Override
    public ConnectionStatus getStatus() {
        return status;
    }

    @Override
    public boolean isOfflineMode() {
        return offlineMode;
    }

    @Override
    public String getLastError() {
        return lastError;
    }

    @Override
    public Long getLastSuccessfulConnection() {
        return lastSuccessfulConnection;
    }

    @Override
    public Long getLastFailedConnection() {
        return lastFailedConnection;
    }

    @Override
    public int getFailureCount() {
        return failureCount;
    }

    @Override
    public long getNextReconnectTime() {
        return nextReconnectTime;
    }

    @Override
    public String toString() {
        return "ConnectionInformation(" + status + ", offline=" + offlineMode + ", failures=" + failureCount
                + ", lastError=" + lastError + ")";
    }
}
