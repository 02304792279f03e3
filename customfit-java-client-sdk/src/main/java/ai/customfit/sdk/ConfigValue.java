package ai.customfit.sdk;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

/**
 * The value of a config, tagged with its JSON shape.
 * <p>
 * The shape is determined once, when the config document is parsed, so that reads can check it
 * without inspecting the JSON again. Instances are immutable.
 */
public final class ConfigValue {
    /**
     * The shape of a {@link ConfigValue}.
     */
    public enum Type {
        BOOLEAN,
        NUMBER,
        STRING,
        /**
         * An object or an array.
         */
        JSON
    }

    private final Type type;
    private final JsonElement value;

    private ConfigValue(Type type, JsonElement value) {
        this.type = type;
        this.value = value;
    }

    /**
     * Wraps a JSON value.
     *
     * @param element the value
     * @return the tagged value, or null if {@code element} is null or JSON null
     */
    public static ConfigValue of(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive p = element.getAsJsonPrimitive();
            if (p.isBoolean()) {
                return new ConfigValue(Type.BOOLEAN, p);
            }
            if (p.isNumber()) {
                return new ConfigValue(Type.NUMBER, p);
            }
            return new ConfigValue(Type.STRING, p);
        }
        return new ConfigValue(Type.JSON, element.deepCopy());
    }

    public static ConfigValue of(boolean value) {
        return new ConfigValue(Type.BOOLEAN, new JsonPrimitive(value));
    }

    public static ConfigValue of(Number value) {
        return new ConfigValue(Type.NUMBER, new JsonPrimitive(value));
    }

    public static ConfigValue of(String value) {
        return value == null ? null : new ConfigValue(Type.STRING, new JsonPrimitive(value));
    }

    public Type getType() {
        return type;
    }

    public boolean isBoolean() {
        return type == Type.BOOLEAN;
    }

    public boolean isNumber() {
        return type == Type.NUMBER;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    public boolean isJson() {
        return type == Type.JSON;
    }

    /**
     * @return the boolean value, or false if this is not a boolean
     */
    public boolean booleanValue() {
        return type == Type.BOOLEAN && value.getAsBoolean();
    }

    /**
     * @return the numeric value, or zero if this is not a number
     */
    public double doubleValue() {
        return type == Type.NUMBER ? value.getAsDouble() : 0;
    }

    public int intValue() {
        return (int) doubleValue();
    }

    public long longValue() {
        return type == Type.NUMBER ? value.getAsLong() : 0;
    }

    /**
     * @return the string value, or null if this is not a string
     */
    public String stringValue() {
        return type == Type.STRING ? value.getAsString() : null;
    }

    /**
     * @return a copy of the underlying JSON value
     */
    public JsonElement jsonValue() {
        return value.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfigValue)) {
            return false;
        }
        ConfigValue other = (ConfigValue) o;
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
