package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.PersistentDataStore;
import ai.customfit.sdk.subsystems.ResponseMetadata;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.launchdarkly.logging.LDLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A facade over some implementation of {@link PersistentDataStore}, which adds behavior that
 * should be the same for all implementations, such as the specific data keys we use, the logging
 * of errors, and how data is serialized and deserialized. This allows the SDK components that
 * need durable state to be written in a clearer way without embedding many implementation
 * details.
 * <p>
 * See {@link PersistentDataStore} for the rules about what namespaces and keys we can use. It is
 * {@code PersistentDataStoreWrapper}'s responsibility to follow those rules. We are OK as long as
 * we use base64url-encoding for the client key, and normalize everything else with
 * {@link CFUtil#normalizeKey(String)}.
 * <p>
 * Data is split into three namespaces: a global one for the device-level session, one per client
 * key for settings metadata, connection status and undelivered analytics, and one per client key
 * and cache name for {@link TTLCache} records.
 * <p>
 * All operations have the following error-handling behavior: if the underlying data store throws
 * an exception, the wrapper catches and logs it, and the operation is a no-op (if it was a setter)
 * or returns null (if it was a getter).
 */
final class PersistentDataStoreWrapper {
    static class SavedConnectionInfo {
        final Long lastSuccessTime;
        final Long lastFailureTime;
        final String lastFailureMessage;

        SavedConnectionInfo(Long lastSuccessTime, Long lastFailureTime, String lastFailureMessage) {
            this.lastSuccessTime = lastSuccessTime;
            this.lastFailureTime = lastFailureTime;
            this.lastFailureMessage = lastFailureMessage;
        }
    }

    private static final String GLOBAL_NAMESPACE = "CustomFit";
    private static final String NAMESPACE_PREFIX = "CustomFit_";

    private static final String CURRENT_SESSION_KEY = "cf_current_session";
    private static final String LAST_APP_START_KEY = "cf_last_app_start";

    private static final String SETTINGS_METADATA_KEY = "sdk_settings_metadata";
    private static final String LAST_SUCCESS_TIME_KEY = "lastSuccessfulConnection";
    private static final String LAST_FAILURE_TIME_KEY = "lastFailedConnection";
    private static final String LAST_FAILURE_KEY = "lastFailure";
    private static final String QUEUE_KEY_PREFIX = "queue_";

    private final PersistentDataStore persistentStore;
    private final LDLogger logger;
    private final Object storeLock = new Object();
    private final AtomicBoolean loggedStorageError = new AtomicBoolean(false);

    private final Namespace global;
    private final Namespace client;
    private final String clientNamespace;

    PersistentDataStoreWrapper(
            PersistentDataStore persistentStore,
            String clientKey,
            LDLogger logger
    ) {
        this.persistentStore = persistentStore;
        this.logger = logger;
        this.clientNamespace = NAMESPACE_PREFIX + CFUtil.urlSafeBase64Hash(clientKey);
        this.global = new Namespace(GLOBAL_NAMESPACE);
        this.client = new Namespace(clientNamespace);
    }

    /**
     * Returns the namespace used by a {@link TTLCache} with the given name.
     *
     * @param cacheName the cache name
     * @return a data access object
     */
    Namespace cacheNamespace(String cacheName) {
        return new Namespace(clientNamespace + "_" + CFUtil.normalizeKey(cacheName));
    }

    /**
     * @return the serialized current session record, or null if none was stored
     */
    String getSessionRecord() {
        return global.getString(CURRENT_SESSION_KEY);
    }

    /**
     * @param serializedRecord the serialized record, or null to remove it
     */
    void setSessionRecord(String serializedRecord) {
        global.setString(CURRENT_SESSION_KEY, serializedRecord);
    }

    Long getLastAppStart() {
        return global.getInt(LAST_APP_START_KEY);
    }

    void setLastAppStart(long timestamp) {
        global.setInt(LAST_APP_START_KEY, timestamp);
    }

    /**
     * Retrieves the validators that the last settings check saw.
     *
     * @return the metadata, or null if none was stored or it could not be parsed
     */
    ResponseMetadata getSettingsMetadata() {
        String json = client.getString(SETTINGS_METADATA_KEY);
        if (json == null) {
            return null;
        }
        try {
            JsonObject o = GsonCache.getGson().fromJson(json, JsonObject.class);
            if (o == null) {
                return null;
            }
            return new ResponseMetadata(stringOrNull(o, "etag"), stringOrNull(o, "lastModified"));
        } catch (JsonParseException | ClassCastException | IllegalStateException e) {
            return null;
        }
    }

    void setSettingsMetadata(ResponseMetadata metadata) {
        if (metadata == null) {
            client.setString(SETTINGS_METADATA_KEY, null);
            return;
        }
        JsonObject o = new JsonObject();
        o.addProperty("etag", metadata.getEtag());
        o.addProperty("lastModified", metadata.getLastModified());
        client.setString(SETTINGS_METADATA_KEY, GsonCache.getGson().toJson(o));
    }

    /**
     * Retrieves stored connection status properties.
     *
     * @return a {@link SavedConnectionInfo} (never null; fields are null if nothing was stored)
     */
    SavedConnectionInfo getConnectionInfo() {
        return new SavedConnectionInfo(
                client.getInt(LAST_SUCCESS_TIME_KEY),
                client.getInt(LAST_FAILURE_TIME_KEY),
                client.getString(LAST_FAILURE_KEY));
    }

    void setConnectionInfo(SavedConnectionInfo connectionInfo) {
        Map<String, String> updates = new HashMap<>();
        updates.put(LAST_SUCCESS_TIME_KEY,
                connectionInfo.lastSuccessTime == null ? null : String.valueOf(connectionInfo.lastSuccessTime));
        updates.put(LAST_FAILURE_TIME_KEY,
                connectionInfo.lastFailureTime == null ? null : String.valueOf(connectionInfo.lastFailureTime));
        updates.put(LAST_FAILURE_KEY, connectionInfo.lastFailureMessage);
        client.setStrings(updates);
    }

    /**
     * @param queueName the delivery queue name
     * @return the serialized undelivered items, or null if there are none
     */
    String getQueuedItems(String queueName) {
        return client.getString(QUEUE_KEY_PREFIX + CFUtil.normalizeKey(queueName));
    }

    /**
     * @param queueName the delivery queue name
     * @param serializedItems the serialized items, or null to remove them
     */
    void setQueuedItems(String queueName, String serializedItems) {
        client.setString(QUEUE_KEY_PREFIX + CFUtil.normalizeKey(queueName), serializedItems);
    }

    /**
     * String, integer and key-listing access to one store namespace.
     */
    final class Namespace {
        private final String name;

        private Namespace(String name) {
            this.name = name;
        }

        String getString(String key) {
            try {
                synchronized (storeLock) {
                    return persistentStore.getValue(name, key);
                }
            } catch (Exception e) {
                maybeLogStoreError(e);
                return null;
            }
        }

        void setString(String key, String value) {
            try {
                synchronized (storeLock) {
                    persistentStore.setValue(name, key, value);
                }
            } catch (Exception e) {
                maybeLogStoreError(e);
            }
        }

        void setStrings(Map<String, String> keysAndValues) {
            try {
                synchronized (storeLock) {
                    persistentStore.setValues(name, keysAndValues);
                }
            } catch (Exception e) {
                maybeLogStoreError(e);
            }
        }

        Long getInt(String key) {
            String value = getString(key);
            if (value == null) {
                return null;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                return null;
            }
        }

        void setInt(String key, long value) {
            setString(key, String.valueOf(value));
        }

        void remove(String key) {
            setString(key, null);
        }

        /**
         * @param prefix a key prefix; empty to list every key
         * @return the matching keys (never null)
         */
        List<String> keysWithPrefix(String prefix) {
            Collection<String> keys;
            try {
                synchronized (storeLock) {
                    keys = persistentStore.getKeys(name);
                }
            } catch (Exception e) {
                maybeLogStoreError(e);
                return Collections.emptyList();
            }
            List<String> result = new ArrayList<>();
            if (keys != null) {
                for (String key: keys) {
                    if (key.startsWith(prefix)) {
                        result.add(key);
                    }
                }
            }
            return result;
        }

        void clear() {
            try {
                synchronized (storeLock) {
                    persistentStore.clear(name);
                }
            } catch (Exception e) {
                maybeLogStoreError(e);
            }
        }
    }

    private void maybeLogStoreError(Exception e) {
        if (loggedStorageError.getAndSet(true)) {
            return;
        }
        CFUtil.logExceptionAtErrorLevel(logger, e, "Failure in persistent data store");
    }

    private static String stringOrNull(JsonObject o, String name) {
        return o.has(name) && !o.get(name).isJsonNull() ? o.get(name).getAsString() : null;
    }
}
