package ai.customfit.sdk;

import com.google.gson.JsonElement;

/**
 * Allows the client's typed read methods and listeners to treat the supported value types
 * generically.
 */
public abstract class ValueTypes {
    private ValueTypes() {
    }

    /**
     * Implements {@link ConfigValue} conversion for a specific type.
     *
     * @param <T> the requested value type
     */
    public interface Converter<T> {
        /**
         * Converts a config value to the desired type. The value is guaranteed to be non-null.
         *
         * @param value the config value
         * @return the converted value, or null if the value was not of the correct type
         */
        T extractValue(ConfigValue value);
    }

    public static final Converter<Boolean> BOOLEAN =
            v -> v.isBoolean() ? v.booleanValue() : null;

    public static final Converter<Integer> INT =
            v -> v.isNumber() ? v.intValue() : null;

    public static final Converter<Long> LONG =
            v -> v.isNumber() ? v.longValue() : null;

    public static final Converter<Double> DOUBLE =
            v -> v.isNumber() ? v.doubleValue() : null;

    public static final Converter<String> STRING =
            ConfigValue::stringValue;

    public static final Converter<JsonElement> JSON =
            v -> v.isJson() ? v.jsonValue() : null;

    public static final Converter<ConfigValue> CONFIG_VALUE =
            v -> v;
}
