package ai.customfit.sdk;

import java.util.Objects;

/**
 * The outcome of an SDK write operation such as {@link CFClient#trackEvent(String)}.
 * <p>
 * A result only reflects validation and whether the item was accepted into its queue. It says
 * nothing about eventual delivery: once accepted, network failures are handled by re-queueing and
 * are never reported back to the original caller.
 *
 * @param <T> the type of the accepted value
 */
public final class CFResult<T> {
    private final T value;
    private final CFFailure error;

    private CFResult(T value, CFFailure error) {
        this.value = value;
        this.error = error;
    }

    /**
     * @param value the accepted value
     * @param <T> the value type
     * @return a successful result
     */
    public static <T> CFResult<T> success(T value) {
        return new CFResult<>(value, null);
    }

    /**
     * @param error the failure
     * @param <T> the value type
     * @return a failed result
     */
    public static <T> CFResult<T> error(CFFailure error) {
        return new CFResult<>(null, Objects.requireNonNull(error, "error"));
    }

    /**
     * @return true if the operation succeeded
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the accepted value, or null if the operation failed
     */
    public T getValue() {
        return value;
    }

    /**
     * @return the failure, or null if the operation succeeded
     */
    public CFFailure getError() {
        return error;
    }

    /**
     * @param defaultValue the value to return on failure
     * @return the accepted value, or {@code defaultValue} if the operation failed
     */
    public T getOrDefault(T defaultValue) {
        return error == null ? value : defaultValue;
    }

    @Override
    public String toString() {
        return error == null ? "CFResult(success=" + value + ")"
                : "CFResult(error=" + error.getFailureType() + ": " + error.getMessage() + ")";
    }
}
