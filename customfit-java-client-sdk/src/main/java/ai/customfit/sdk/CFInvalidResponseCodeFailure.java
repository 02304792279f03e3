package ai.customfit.sdk;

/**
 * Container class representing a communication failure with CustomFit servers in which the response was unexpected.
 */
public class CFInvalidResponseCodeFailure extends CFFailure {

    /**
     * The response code
     */
    private final int responseCode;

    /**
     * Whether or not the failure may be fixed by retrying
     */
    private final boolean retryable;

    /**
     * @param message the message
     * @param responseCode the response code
     * @param retryable whether or not retrying may resolve the issue
     */
    public CFInvalidResponseCodeFailure(String message, int responseCode, boolean retryable) {
        super(message, FailureType.UNEXPECTED_RESPONSE_CODE);
        this.responseCode = responseCode;
        this.retryable = retryable;
    }

    /**
     * @return true if retrying may resolve the issue
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * @return the response code
     */
    public int getResponseCode() {
        return responseCode;
    }
}
