package ai.customfit.sdk;

/**
 * Like {@link ConfigChangeListener}, but receives the new value already converted. It is only
 * called if the new value converts with the converter it was registered with.
 *
 * @param <T> the value type
 * @see CFClient#registerTypedConfigListener(String, ValueTypes.Converter, TypedConfigChangeListener)
 */
@FunctionalInterface
public interface TypedConfigChangeListener<T> {
    void onConfigChanged(String key, T newValue);
}
