package ai.customfit.sdk;

/**
 * How long a {@link TTLCache} value lives, whether it is refreshed in the background as it nears
 * expiry, and whether it is written to durable storage.
 */
final class CachePolicy {
    static final CachePolicy NO_CACHING = new CachePolicy(0, false, false);
    static final CachePolicy SHORT_LIVED = new CachePolicy(60, true, false);
    static final CachePolicy STANDARD = new CachePolicy(60 * 60, true, true);
    static final CachePolicy LONG_LIVED = new CachePolicy(24 * 60 * 60, true, true);

    final int ttlSeconds;
    final boolean staleWhileRevalidate;
    final boolean persist;

    CachePolicy(int ttlSeconds, boolean staleWhileRevalidate, boolean persist) {
        this.ttlSeconds = ttlSeconds;
        this.staleWhileRevalidate = staleWhileRevalidate;
        this.persist = persist;
    }
}
