package ai.customfit.sdk;

import java.util.Map;

/**
 * Callback interface used for listening to changes to any config.
 *
 * @see CFClient#registerAllFlagsListener(AllFlagsListener)
 */
@FunctionalInterface
public interface AllFlagsListener {
    /**
     * Called once per update in which at least one config changed, on the SDK's callback thread.
     *
     * @param flags every current config value, keyed by config key
     */
    void onFlagsChanged(Map<String, ConfigValue> flags);
}
