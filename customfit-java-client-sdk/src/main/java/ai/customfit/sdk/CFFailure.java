package ai.customfit.sdk;

/**
 * Container class representing a failure inside the SDK, either while talking to CustomFit
 * servers or while validating data handed to the SDK by the application.
 */
public class CFFailure extends CustomFitException {

    /**
     * Enumerated type defining the possible values of {@link CFFailure#getFailureType()}.
     */
    public enum FailureType {
        /**
         * The network request could not be completed.
         */
        NETWORK_FAILURE,

        /**
         * The operation did not complete within its allotted time.
         */
        TIMEOUT,

        /**
         * This indicates the CFFailure is an instance of CFInvalidResponseCodeFailure.
         */
        UNEXPECTED_RESPONSE_CODE,

        /**
         * A response body was unable to be parsed.
         */
        INVALID_RESPONSE_BODY,

        /**
         * An item or value passed to the SDK was malformed. These are never retried.
         */
        VALIDATION_ERROR,

        /**
         * A delivery queue was full and could not make room for the item.
         */
        QUEUE_FULL,

        /**
         * A circuit breaker was open and the call was rejected without being attempted.
         */
        CIRCUIT_OPEN,

        /**
         * A retried operation failed on every attempt. The cause is the last error.
         */
        MAX_ATTEMPTS_EXCEEDED,

        /**
         * Some other issue occurred.
         */
        INTERNAL_ERROR
    }

    private final FailureType failureType;

    /**
     * @param message the message
     * @param failureType the failure type
     */
    public CFFailure(String message, FailureType failureType) {
        super(message);
        this.failureType = failureType;
    }

    /**
     * @param message the message
     * @param cause the cause of the failure
     * @param failureType the failure type
     */
    public CFFailure(String message, Throwable cause, FailureType failureType) {
        super(message, cause);
        this.failureType = failureType;
    }

    /**
     * @return the failure type
     */
    public FailureType getFailureType() {
        return failureType;
    }

    /**
     * Returns true if this failure belongs to the network category: a transport error, a
     * timeout, or a non-successful HTTP status.
     *
     * @return true for network failures
     */
    public boolean isNetworkError() {
        switch (failureType) {
            case NETWORK_FAILURE:
            case TIMEOUT:
            case UNEXPECTED_RESPONSE_CODE:
                return true;
            default:
                return false;
        }
    }
}
