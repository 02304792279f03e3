package ai.customfit.sdk;

import com.launchdarkly.logging.LDLogger;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one {@link CircuitBreaker} per operation key. Each {@link CFClient} owns a registry, so
 * independently constructed clients (and tests) never share breaker state.
 */
final class CircuitBreakerRegistry {
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final LDLogger logger;

    CircuitBreakerRegistry(Clock clock, LDLogger logger) {
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * Returns the breaker for a key, creating it with the given settings if it does not exist.
     * Settings are ignored for a breaker that already exists.
     */
    CircuitBreaker getOrCreate(String key, int failureThreshold, long resetTimeoutMillis,
                               long halfOpenTimeoutMillis) {
        return breakers.computeIfAbsent(key, k ->
                new CircuitBreaker(k, failureThreshold, resetTimeoutMillis, halfOpenTimeoutMillis, clock, logger));
    }

    CircuitBreaker get(String key) {
        return breakers.get(key);
    }

    void resetAll() {
        for (CircuitBreaker breaker: breakers.values()) {
            breaker.reset();
        }
    }

    void clear() {
        breakers.clear();
    }
}
