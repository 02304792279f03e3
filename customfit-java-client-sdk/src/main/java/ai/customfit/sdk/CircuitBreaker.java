package ai.customfit.sdk;

import com.launchdarkly.logging.LDLogger;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Protects one kind of operation (identified by a key such as {@code "sdk_settings_fetch"}) from
 * being called over and over while it keeps failing.
 * <p>
 * State machine:
 * <ul>
 *     <li> CLOSED: calls go through. Failures are counted within a rolling window of
 *     {@code resetTimeoutMs}; reaching {@code failureThreshold} opens the circuit. </li>
 *     <li> OPEN: calls fail fast without invoking the operation, until {@code halfOpenTimeoutMs}
 *     has elapsed since the circuit opened. </li>
 *     <li> HALF_OPEN: exactly one trial call is let through; concurrent calls fail fast. Success
 *     closes the circuit, failure reopens it and restarts the open timer. </li>
 * </ul>
 * A breaker wraps a whole (possibly retrying) operation, so one failure is counted per call no
 * matter how many attempts the call made internally.
 */
final class CircuitBreaker {
    enum State { CLOSED, OPEN, HALF_OPEN }

    static final int DEFAULT_FAILURE_THRESHOLD = 3;
    static final long DEFAULT_RESET_TIMEOUT_MILLIS = 30_000;
    static final long DEFAULT_HALF_OPEN_TIMEOUT_MILLIS = 30_000;

    private final String key;
    private final int failureThreshold;
    private final long resetTimeoutMillis;
    private final long halfOpenTimeoutMillis;
    private final Clock clock;
    private final LDLogger logger;

    private final Object lock = new Object();
    private State state = State.CLOSED;
    private int failureCount;
    private long lastResetTime;
    private long openedAt;
    private boolean trialInFlight;

    CircuitBreaker(String key, int failureThreshold, long resetTimeoutMillis, long halfOpenTimeoutMillis,
                   Clock clock, LDLogger logger) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.key = key;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMillis = resetTimeoutMillis;
        this.halfOpenTimeoutMillis = halfOpenTimeoutMillis;
        this.clock = clock;
        this.logger = logger;
        this.lastResetTime = clock.millis();
    }

    String getKey() {
        return key;
    }

    /**
     * Runs the operation if the circuit allows it.
     *
     * @param operation the protected operation
     * @param <T> the result type
     * @return the operation's result
     * @throws CFFailure {@link CFFailure.FailureType#CIRCUIT_OPEN} if the call was rejected, or the
     *   operation's own failure
     */
    <T> T execute(Callable<T> operation) throws CFFailure {
        return execute(operation, null);
    }

    /**
     * Runs the operation if the circuit allows it, or returns the fallback's value if it does not.
     * Failures of the operation itself are still thrown.
     *
     * @param operation the protected operation
     * @param fallback supplies the result when the call is rejected; null to throw instead
     * @param <T> the result type
     * @return the operation's or the fallback's result
     * @throws CFFailure if the operation failed, or it was rejected and there is no fallback
     */
    <T> T execute(Callable<T> operation, Supplier<T> fallback) throws CFFailure {
        if (!tryAcquire()) {
            logger.debug("Circuit \"{}\" is open; not calling operation", key);
            if (fallback != null) {
                return fallback.get();
            }
            throw new CFFailure("Circuit breaker \"" + key + "\" is open", CFFailure.FailureType.CIRCUIT_OPEN);
        }
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            recordFailure();
            throw RetryPolicy.toFailure(e);
        }
        recordSuccess();
        return result;
    }

    State getState() {
        synchronized (lock) {
            return state;
        }
    }

    int getFailureCount() {
        synchronized (lock) {
            return failureCount;
        }
    }

    /**
     * Returns the breaker to its initial closed state.
     */
    void reset() {
        synchronized (lock) {
            state = State.CLOSED;
            failureCount = 0;
            trialInFlight = false;
            lastResetTime = clock.millis();
        }
        logger.debug("Circuit \"{}\" was reset", key);
    }

    private boolean tryAcquire() {
        State newState = null;
        boolean allowed;
        synchronized (lock) {
            long now = clock.millis();
            switch (state) {
                case OPEN:
                    if (now - openedAt >= halfOpenTimeoutMillis) {
                        state = newState = State.HALF_OPEN;
                        trialInFlight = true;
                        allowed = true;
                    } else {
                        allowed = false;
                    }
                    break;
                case HALF_OPEN:
                    allowed = !trialInFlight;
                    trialInFlight = true;
                    break;
                default:
                    expireWindow(now);
                    allowed = true;
                    break;
            }
        }
        logTransition(newState);
        return allowed;
    }

    private void recordSuccess() {
        State newState = null;
        synchronized (lock) {
            if (state != State.CLOSED) {
                newState = State.CLOSED;
            }
            state = State.CLOSED;
            failureCount = 0;
            trialInFlight = false;
            lastResetTime = clock.millis();
        }
        logTransition(newState);
    }

    private void recordFailure() {
        State newState = null;
        synchronized (lock) {
            long now = clock.millis();
            if (state == State.HALF_OPEN) {
                state = newState = State.OPEN;
                openedAt = now;
                trialInFlight = false;
            } else if (state == State.CLOSED) {
                expireWindow(now);
                failureCount++;
                if (failureCount >= failureThreshold) {
                    state = newState = State.OPEN;
                    openedAt = now;
                }
            }
        }
        logTransition(newState);
    }

    // failures older than the rolling window no longer count
    private void expireWindow(long now) {
        if (now - lastResetTime >= resetTimeoutMillis) {
            failureCount = 0;
            lastResetTime = now;
        }
    }

    private void logTransition(State newState) {
        if (newState != null) {
            logger.info("Circuit \"{}\" is now {}", key, newState);
        }
    }
}
