package ai.customfit.sdk.subsystems;

import java.util.Collection;
import java.util.Map;

/**
 * Interface for a data store that holds cached configuration, session state, and undelivered
 * analytics in a simple string format.
 * <p>
 * The SDK has a default implementation which uses the {@code java.util.prefs} API. A custom
 * implementation of this interface could store data somewhere else.
 * <p>
 * Each data item is uniquely identified by the combination of a "namespace" and a "key", and has
 * a string value. These are defined as follows:
 * <ul>
 *     <li> Both the namespace and the key are non-empty strings. </li>
 *     <li> Both the namespace and the key contain only alphanumeric characters, hyphens, and
 *     underscores.</li>
 *     <li> The value can be any non-null string, including an empty string. </li>
 * </ul>
 * <p>
 * Values may be large (a serialized configuration document, for instance), but the SDK moves any
 * value over a few kilobytes into the {@link BlobStore} and keeps only a small record here.
 * <p>
 * The SDK provides its own caching layer on top of the persistent data store; the data store
 * implementation should not provide caching, but simply do every query or update that the SDK
 * tells it to do.
 * <p>
 * Error handling is defined as follows: if any data store operation encounters an I/O error, or
 * is otherwise unable to complete its task, it should throw an exception to make the SDK aware
 * of this. The SDK will decide whether to log the exception.
 */
public interface PersistentDataStore {
    /**
     * Attempts to retrieve a string value from the store.
     *
     * @param storeNamespace the namespace identifier
     * @param key the unique key within that namespace
     * @return the value, or null if not found
     */
    String getValue(String storeNamespace, String key);

    /**
     * Attempts to update or remove a string value in the store.
     *
     * @param storeNamespace the namespace identifier
     * @param key the unique key within that namespace
     * @param value the new value, or null to remove the key
     */
    void setValue(String storeNamespace, String key, String value);

    /**
     * Attempts to update multiple values atomically.
     *
     * @param storeNamespace the namespace identifier
     * @param keysAndValues the keys and values to update; a null value removes the key
     */
    void setValues(String storeNamespace, Map<String, String> keysAndValues);

    /**
     * Returns all keys that exist in the namespace.
     *
     * @param storeNamespace the namespace identifier
     * @return the keys
     */
    Collection<String> getKeys(String storeNamespace);

    /**
     * Removes any values that currently exist in the given namespace.
     *
     * @param storeNamespace the namespace identifier
     */
    void clear(String storeNamespace);
}
