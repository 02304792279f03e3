package ai.customfit.sdk;

/**
 * Callback interface used for listening to changes to a single config.
 *
 * @see CFClient#registerConfigListener(String, ConfigChangeListener)
 */
@FunctionalInterface
public interface ConfigChangeListener {
    /**
     * The SDK calls this method when the value of the config changes. It is called on the SDK's
     * callback thread.
     *
     * @param key the config key
     * @param newValue the new value, or null if the config was removed
     */
    void onConfigChanged(String key, ConfigValue newValue);
}
