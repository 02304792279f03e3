package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.BlobStore;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.launchdarkly.logging.LDLogger;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A key/value cache with per-entry expiry and two tiers: an in-process map, and durable storage
 * for entries put with {@code persist=true}.
 * <p>
 * Reads check the in-process map first, then fall back to durable storage and copy what they
 * find into the map. Durable records are small JSON documents in the
 * {@link PersistentDataStoreWrapper}; a value whose serialized form is larger than
 * {@link #MAX_INLINE_VALUE_LENGTH} characters is written to the {@link BlobStore} and the record
 * refers to it by name.
 * <p>
 * A record or blob that cannot be read or parsed is treated as a miss, and is removed.
 *
 * @param <V> the value type; must be serializable with Gson
 */
final class TTLCache<V> {
    static final String KEY_PREFIX = "cf_cache_";
    static final int MAX_INLINE_VALUE_LENGTH = 4096;

    private static final String CACHE_METADATA_KEY = "cache_metadata";
    private static final int REFRESH_THRESHOLD_DIVISOR = 10; // refresh when under 10% of TTL remains

    private static final class StoredRecord {
        long createdAt;
        long expiresAt;
        Map<String, String> metadata;
        JsonElement value;
        String blob;
    }

    private final String name;
    private final Type valueType;
    private final PersistentDataStoreWrapper.Namespace store;
    private final BlobStore blobStore;
    private final TaskExecutor taskExecutor;
    private final Clock clock;
    private final LDLogger logger;
    private final Gson gson = GsonCache.getGson();

    private final ConcurrentHashMap<String, CacheEntry<V>> memory = new ConcurrentHashMap<>();
    private final Set<String> refreshesInFlight = ConcurrentHashMap.newKeySet();

    TTLCache(
            String name,
            Type valueType,
            PersistentDataStoreWrapper storeWrapper,
            BlobStore blobStore,
            TaskExecutor taskExecutor,
            Clock clock,
            LDLogger logger
    ) {
        this.name = name;
        this.valueType = valueType;
        this.store = storeWrapper.cacheNamespace(name);
        this.blobStore = blobStore;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
        this.logger = logger;
    }

    boolean put(String key, V value, int ttlSeconds, boolean persist) {
        return put(key, value, ttlSeconds, persist, null);
    }

    boolean put(String key, V value, CachePolicy policy) {
        return put(key, value, policy.ttlSeconds, policy.persist, null);
    }

    /**
     * Stores a value.
     *
     * @param key the cache key; normalized before use
     * @param value the value
     * @param ttlSeconds lifetime; a value of zero or less means "do not cache"
     * @param persist true to also write the value to durable storage
     * @param metadata string metadata to keep with the value, or null
     * @return true if the value was cached (and, if requested, persisted)
     */
    boolean put(String key, V value, int ttlSeconds, boolean persist, Map<String, String> metadata) {
        if (ttlSeconds <= 0 || value == null) {
            return false;
        }
        String storageKey = storageKey(key);
        long now = clock.millis();
        CacheEntry<V> entry = new CacheEntry<>(value, now, now + ttlSeconds * 1000L, metadata);
        memory.put(storageKey, entry);
        if (persist) {
            return writeDurable(storageKey, entry);
        }
        removeDurable(storageKey);
        return true;
    }

    V get(String key) {
        return get(key, false);
    }

    V get(String key, boolean allowExpired) {
        CacheEntry<V> entry = getEntry(key, allowExpired);
        return entry == null ? null : entry.getValue();
    }

    /**
     * Returns the full entry for a key.
     *
     * @param key the cache key
     * @param allowExpired true to return an entry even if it has expired
     * @return the entry, or null
     */
    CacheEntry<V> getEntry(String key, boolean allowExpired) {
        String storageKey = storageKey(key);
        long now = clock.millis();
        CacheEntry<V> entry = memory.get(storageKey);
        if (entry != null && (allowExpired || !entry.isExpired(now))) {
            return entry;
        }
        CacheEntry<V> durable = readDurable(storageKey);
        if (durable == null) {
            return null;
        }
        memory.put(storageKey, durable);
        return allowExpired || !durable.isExpired(now) ? durable : null;
    }

    V getOrFetch(String key, Callable<V> provider, int ttlSeconds) {
        return getOrFetch(key, provider, new CachePolicy(ttlSeconds, true, true));
    }

    /**
     * Returns a cached value, fetching it with {@code provider} if there is none.
     * <p>
     * If a cached value exists but less than 10% of its lifetime remains, and the policy allows
     * stale-while-revalidate, the cached value is returned immediately and a refresh runs on a
     * worker thread. Concurrent refreshes of the same key are coalesced.
     *
     * @param key the cache key
     * @param provider fetches a fresh value
     * @param policy lifetime and persistence of fetched values
     * @return the value, or null if there was none and the fetch failed
     */
    V getOrFetch(String key, Callable<V> provider, CachePolicy policy) {
        CacheEntry<V> entry = getEntry(key, false);
        if (entry != null) {
            long remaining = entry.getExpiresAt() - clock.millis();
            if (policy.staleWhileRevalidate && remaining <= entry.getTtlMillis() / REFRESH_THRESHOLD_DIVISOR) {
                refreshInBackground(key, provider, policy);
            }
            return entry.getValue();
        }
        return refresh(key, provider, policy.ttlSeconds, policy.persist);
    }

    /**
     * Fetches a value with {@code provider} and replaces the cached one. If the fetch fails, the
     * cached value is left alone.
     *
     * @return the fetched value, or null if the fetch failed
     */
    V refresh(String key, Callable<V> provider, int ttlSeconds, boolean persist) {
        V value;
        try {
            value = provider.call();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            CFUtil.logExceptionAtWarnLevel(logger, e, "Could not refresh cache entry \"{}\"", key);
            return null;
        }
        if (value != null) {
            Map<String, String> metadata = null;
            CacheEntry<V> existing = memory.get(storageKey(key));
            if (existing != null) {
                metadata = existing.getMetadata();
            }
            put(key, value, ttlSeconds, persist, metadata);
        }
        return value;
    }

    void remove(String key) {
        String storageKey = storageKey(key);
        memory.remove(storageKey);
        removeDurable(storageKey);
    }

    void clear() {
        memory.clear();
        for (String storageKey: store.keysWithPrefix(KEY_PREFIX)) {
            removeDurable(storageKey);
        }
        logger.debug("Cache \"{}\" cleared", name);
    }

    /**
     * Removes expired entries from both tiers.
     *
     * @return the number of durable records removed
     */
    int cleanupExpired() {
        long now = clock.millis();
        memory.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = 0;
        for (String storageKey: store.keysWithPrefix(KEY_PREFIX)) {
            StoredRecord record = readRecord(storageKey);
            if (record == null || record.expiresAt <= now) {
                removeDurable(storageKey);
                removed++;
            }
        }
        JsonObject meta = new JsonObject();
        meta.addProperty("lastCleanup", now);
        store.setString(CACHE_METADATA_KEY, gson.toJson(meta));
        if (removed > 0) {
            logger.debug("Removed {} expired entries from cache \"{}\"", removed, name);
        }
        return removed;
    }

    /**
     * @return when {@link #cleanupExpired()} last ran, or null if it never has
     */
    Long getLastCleanupTime() {
        String json = store.getString(CACHE_METADATA_KEY);
        if (json == null) {
            return null;
        }
        try {
            JsonObject meta = JsonParser.parseString(json).getAsJsonObject();
            return meta.has("lastCleanup") ? meta.get("lastCleanup").getAsLong() : null;
        } catch (RuntimeException e) {
            return null;
        }
    }

    static String storageKey(String key) {
        return KEY_PREFIX + CFUtil.normalizeKey(key);
    }

    private void refreshInBackground(String key, Callable<V> provider, CachePolicy policy) {
        String storageKey = storageKey(key);
        if (!refreshesInFlight.add(storageKey)) {
            return;
        }
        logger.debug("Refreshing cache entry \"{}\" in background", key);
        taskExecutor.submitTask(() -> {
            try {
                refresh(key, provider, policy.ttlSeconds, policy.persist);
            } finally {
                refreshesInFlight.remove(storageKey);
            }
            return null;
        });
    }

    private String blobName(String storageKey) {
        return CFUtil.normalizeKey(name) + "__" + storageKey;
    }

    private boolean writeDurable(String storageKey, CacheEntry<V> entry) {
        StoredRecord record = new StoredRecord();
        record.createdAt = entry.getCreatedAt();
        record.expiresAt = entry.getExpiresAt();
        record.metadata = entry.getMetadata().isEmpty() ? null : new HashMap<>(entry.getMetadata());
        JsonElement valueJson = gson.toJsonTree(entry.getValue(), valueType);
        String serializedValue = gson.toJson(valueJson);
        String blob = blobName(storageKey);
        try {
            if (serializedValue.length() > MAX_INLINE_VALUE_LENGTH) {
                blobStore.write(blob, serializedValue.getBytes(StandardCharsets.UTF_8));
                record.blob = blob;
            } else {
                record.value = valueJson;
                blobStore.delete(blob);
            }
        } catch (IOException e) {
            CFUtil.logExceptionAtErrorLevel(logger, e, "Could not persist cache entry \"{}\"", storageKey);
            return false;
        }
        store.setString(storageKey, gson.toJson(record));
        return true;
    }

    private StoredRecord readRecord(String storageKey) {
        String json = store.getString(storageKey);
        if (json == null) {
            return null;
        }
        try {
            return gson.fromJson(json, StoredRecord.class);
        } catch (JsonParseException e) {
            return null;
        }
    }

    private CacheEntry<V> readDurable(String storageKey) {
        String json = store.getString(storageKey);
        if (json == null) {
            return null;
        }
        try {
            StoredRecord record = gson.fromJson(json, StoredRecord.class);
            if (record == null) {
                throw new JsonParseException("empty record");
            }
            JsonElement valueJson = record.value;
            if (record.blob != null) {
                byte[] data = blobStore.read(record.blob);
                if (data == null) {
                    throw new IOException("blob " + record.blob + " is missing");
                }
                valueJson = JsonParser.parseString(new String(data, StandardCharsets.UTF_8));
            }
            V value = valueJson == null ? null : gson.fromJson(valueJson, valueType);
            if (value == null) {
                throw new JsonParseException("record has no value");
            }
            return new CacheEntry<>(value, record.createdAt, record.expiresAt,
                    record.metadata == null ? Collections.emptyMap() : record.metadata);
        } catch (IOException | RuntimeException e) {
            CFUtil.logExceptionAtWarnLevel(logger, e, "Discarding unreadable cache entry \"{}\"", storageKey);
            removeDurable(storageKey);
            return null;
        }
    }

    private void removeDurable(String storageKey) {
        store.remove(storageKey);
        try {
            blobStore.delete(blobName(storageKey));
        } catch (IOException e) {
            CFUtil.logExceptionAtWarnLevel(logger, e, "Could not delete cache blob for \"{}\"", storageKey);
        }
    }
}
