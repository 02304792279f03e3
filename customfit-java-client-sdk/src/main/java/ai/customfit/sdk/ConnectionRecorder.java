package ai.customfit.sdk;

/**
 * Receives the outcome of each network exchange, so that connection status can be derived from
 * real traffic.
 */
interface ConnectionRecorder {
    ConnectionRecorder NONE = new ConnectionRecorder() {
        @Override
        public void recordConnectionSuccess() {
        }

        @Override
        public void recordConnectionFailure(Throwable error) {
        }
    };

    void recordConnectionSuccess();

    void recordConnectionFailure(Throwable error);
}
