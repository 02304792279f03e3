package ai.customfit.sdk;

/**
 * Exception class that can be thrown by CustomFit client methods.
 */
public class CustomFitException extends Exception {

    /**
     * @param message for the exception
     */
    public CustomFitException(String message) {
        super(message);
    }

    CustomFitException(String message, Throwable cause) {
        super(message, cause);
    }
}
