package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.Callback;

import com.launchdarkly.logging.LDLogger;

import java.io.IOException;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

/**
 * Exponential backoff with jitter for operations that may fail transiently.
 * <p>
 * A policy is immutable and holds no per-call state, so one instance can be shared by any number
 * of concurrent callers. Attempts belonging to one call never overlap: the blocking variant
 * sleeps the calling thread between attempts, and the asynchronous variant schedules the next
 * attempt only after the previous one has finished.
 * <p>
 * When every attempt fails, the caller receives a {@link CFFailure} of type
 * {@link CFFailure.FailureType#MAX_ATTEMPTS_EXCEEDED} whose cause is the last error. Errors that
 * the {@code shouldRetry} predicate rejects, and cancellations, are passed through immediately.
 */
final class RetryPolicy {
    static final int DEFAULT_MAX_ATTEMPTS = 3;
    static final long DEFAULT_INITIAL_DELAY_MILLIS = 1_000;
    static final long DEFAULT_MAX_DELAY_MILLIS = 30_000;
    static final double DEFAULT_MULTIPLIER = 2.0;
    static final double DEFAULT_JITTER_FACTOR = 0.2;

    private final int maxAttempts;
    private final long initialDelayMillis;
    private final long maxDelayMillis;
    private final double multiplier;
    private final double jitterFactor;
    private final Predicate<Throwable> shouldRetry;
    private final LDLogger logger;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelayMillis = builder.initialDelayMillis;
        this.maxDelayMillis = builder.maxDelayMillis;
        this.multiplier = builder.multiplier;
        this.jitterFactor = builder.jitterFactor;
        this.shouldRetry = builder.shouldRetry;
        this.logger = builder.logger;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the client-wide policy used for analytics delivery.
     */
    static RetryPolicy fromConfig(CFConfig config, LDLogger logger) {
        return builder()
                .maxAttempts(config.getMaxRetryAttempts())
                .initialDelayMillis(config.getRetryInitialDelayMs())
                .maxDelayMillis(config.getRetryMaxDelayMs())
                .multiplier(config.getRetryBackoffMultiplier())
                .jitterFactor(config.getRetryJitterFactor())
                .logger(logger)
                .build();
    }

    /**
     * The default retry predicate: everything is retried except cancellation.
     *
     * @return a predicate
     */
    static Predicate<Throwable> retryAllExceptCancellation() {
        return e -> !CFUtil.isCancellation(e);
    }

    /**
     * A retry predicate that accepts only network-category errors, and of those, only the ones
     * that might resolve on their own.
     *
     * @return a predicate
     */
    static Predicate<Throwable> networkErrorsOnly() {
        return e -> {
            if (CFUtil.isCancellation(e)) {
                return false;
            }
            if (e instanceof CFInvalidResponseCodeFailure) {
                return ((CFInvalidResponseCodeFailure) e).isRetryable();
            }
            if (e instanceof CFFailure) {
                return ((CFFailure) e).isNetworkError();
            }
            return e instanceof IOException;
        };
    }

    /**
     * Computes the delay before retrying after a failed attempt.
     * <p>
     * The base delay is {@code min(initial * multiplier^(attempt-1), max)}. A uniformly
     * distributed jitter of up to {@code base * jitterFactor} in either direction is then applied,
     * and the result is clamped to {@code [0, max]}.
     *
     * @param attempt the attempt that just failed, starting at 1
     * @param initialMillis delay after the first attempt
     * @param maxMillis upper bound for any delay
     * @param multiplier growth factor per attempt
     * @param jitterFactor fraction of the base delay to randomize, between 0 and 1
     * @return the delay in milliseconds
     */
    static long nextDelay(int attempt, long initialMillis, long maxMillis, double multiplier, double jitterFactor) {
        return nextDelay(attempt, initialMillis, maxMillis, multiplier, jitterFactor, ThreadLocalRandom.current());
    }

    static long nextDelay(int attempt, long initialMillis, long maxMillis, double multiplier,
                          double jitterFactor, Random random) {
        if (maxMillis <= 0) {
            return 0;
        }
        int exponent = Math.max(0, attempt - 1);
        double base = Math.min(initialMillis * Math.pow(multiplier, exponent), (double) maxMillis);
        double jitter = base * jitterFactor * (random.nextDouble() * 2 - 1);
        double delay = base + jitter;
        return Math.max(0, Math.min(maxMillis, Math.round(delay)));
    }

    int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs an operation, sleeping the current thread between failed attempts.
     *
     * @param operation the operation
     * @param <T> the result type
     * @return the operation's result
     * @throws CFFailure if the operation failed and was not retried, or failed on every attempt
     */
    <T> T execute(Callable<T> operation) throws CFFailure {
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastError = e;
                if (!shouldRetry.test(e)) {
                    if (e instanceof InterruptedException) {
                        Thread.currentThread().interrupt();
                    }
                    throw toFailure(e);
                }
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = delayAfter(attempt);
                logger.debug("Attempt {} of {} failed ({}); retrying in {} ms",
                        attempt, maxAttempts, e.toString(), delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CFFailure("Retry was interrupted", ie, CFFailure.FailureType.INTERNAL_ERROR);
                }
            }
        }
        throw exhausted(lastError);
    }

    /**
     * Runs an operation on a worker thread. Retries are scheduled with the executor rather than
     * by sleeping, so no thread is held while waiting. Exactly one of the callback's methods is
     * called, exactly once.
     *
     * @param operation the operation
     * @param executor used for the first attempt and to schedule retries
     * @param callback receives the result or the final failure
     * @param <T> the result type
     */
    <T> void executeAsync(Callable<T> operation, TaskExecutor executor, Callback<T> callback) {
        executor.submitTask(() -> {
            runAttempt(operation, executor, callback, 1);
            return null;
        });
    }

    private <T> void runAttempt(Callable<T> operation, TaskExecutor executor, Callback<T> callback, int attempt) {
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            if (!shouldRetry.test(e)) {
                callback.onError(toFailure(e));
            } else if (attempt >= maxAttempts) {
                callback.onError(exhausted(e));
            } else {
                long delay = delayAfter(attempt);
                logger.debug("Attempt {} of {} failed ({}); retrying in {} ms",
                        attempt, maxAttempts, e.toString(), delay);
                executor.scheduleTask(() -> runAttempt(operation, executor, callback, attempt + 1), delay);
            }
            return;
        }
        callback.onSuccess(result);
    }

    private long delayAfter(int attempt) {
        return nextDelay(attempt, initialDelayMillis, maxDelayMillis, multiplier, jitterFactor);
    }

    private CFFailure exhausted(Exception lastError) {
        return new CFFailure("Operation failed after " + maxAttempts + " attempt(s)", lastError,
                CFFailure.FailureType.MAX_ATTEMPTS_EXCEEDED);
    }

    static CFFailure toFailure(Exception e) {
        if (e instanceof CFFailure) {
            return (CFFailure) e;
        }
        return new CFFailure(e.toString(), e, CFFailure.FailureType.INTERNAL_ERROR);
    }

    static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long initialDelayMillis = DEFAULT_INITIAL_DELAY_MILLIS;
        private long maxDelayMillis = DEFAULT_MAX_DELAY_MILLIS;
        private double multiplier = DEFAULT_MULTIPLIER;
        private double jitterFactor = DEFAULT_JITTER_FACTOR;
        private Predicate<Throwable> shouldRetry = retryAllExceptCancellation();
        private LDLogger logger = LDLogger.none();

        Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        Builder initialDelayMillis(long initialDelayMillis) {
            this.initialDelayMillis = Math.max(0, initialDelayMillis);
            return this;
        }

        Builder maxDelayMillis(long maxDelayMillis) {
            this.maxDelayMillis = Math.max(0, maxDelayMillis);
            return this;
        }

        Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = Math.max(0, Math.min(1, jitterFactor));
            return this;
        }

        Builder shouldRetry(Predicate<Throwable> shouldRetry) {
            this.shouldRetry = shouldRetry == null ? retryAllExceptCancellation() : shouldRetry;
            return this;
        }

        Builder logger(LDLogger logger) {
            this.logger = logger == null ? LDLogger.none() : logger;
            return this;
        }

        RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
