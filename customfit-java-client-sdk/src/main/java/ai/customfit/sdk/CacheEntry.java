package ai.customfit.sdk;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * An immutable value held by a {@link TTLCache}, with its lifetime and any string metadata that
 * was stored along with it.
 */
final class CacheEntry<V> {
    private final V value;
    private final long createdAt;
    private final long expiresAt;
    private final Map<String, String> metadata;

    CacheEntry(V value, long createdAt, long expiresAt, Map<String, String> metadata) {
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.metadata = metadata == null || metadata.isEmpty() ? Collections.emptyMap()
                : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    V getValue() {
        return value;
    }

    long getCreatedAt() {
        return createdAt;
    }

    long getExpiresAt() {
        return expiresAt;
    }

    Map<String, String> getMetadata() {
        return metadata;
    }

    boolean isExpired(long now) {
        return expiresAt <= now;
    }

    long getTtlMillis() {
        return expiresAt - createdAt;
    }
}
