package ai.customfit.sdk;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The user on whose behalf the SDK requests configuration and reports analytics.
 * <p>
 * Instances are immutable; use {@link Builder} to create one. The user is sent with every config
 * request and every analytics payload, serialized with Gson.
 */
public final class CFUser {
    @SerializedName("user_customer_id") private final String userCustomerId;
    @SerializedName("anonymous") private final boolean anonymous;
    @SerializedName("properties") private final Map<String, Object> properties;

    private CFUser(Builder builder) {
        this.userCustomerId = builder.userCustomerId;
        this.anonymous = builder.anonymous;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    /**
     * @return the customer's identifier for this user, or null for an anonymous user
     */
    public String getUserCustomerId() {
        return userCustomerId;
    }

    public boolean isAnonymous() {
        return anonymous;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * Returns a builder initialized with this user's attributes.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder(userCustomerId).anonymous(anonymous);
        b.properties.putAll(properties);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CFUser)) {
            return false;
        }
        CFUser other = (CFUser) o;
        return anonymous == other.anonymous && Objects.equals(userCustomerId, other.userCustomerId)
                && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userCustomerId, anonymous, properties);
    }

    @Override
    public String toString() {
        return "CFUser(" + userCustomerId + (anonymous ? ", anonymous" : "") + ")";
    }

    /**
     * Builder for {@link CFUser}.
     */
    public static final class Builder {
        private final String userCustomerId;
        private boolean anonymous;
        private final Map<String, Object> properties = new LinkedHashMap<>();

        /**
         * @param userCustomerId the customer's identifier for the user; may be null for an
         *                       anonymous user
         */
        public Builder(String userCustomerId) {
            this.userCustomerId = userCustomerId;
        }

        public Builder anonymous(boolean anonymous) {
            this.anonymous = anonymous;
            return this;
        }

        public Builder property(String key, String value) {
            if (CFUtil.isNullOrBlank(value)) {
                throw new IllegalArgumentException("String value for '" + key + "' cannot be blank");
            }
            properties.put(key, value);
            return this;
        }

        public Builder property(String key, Number value) {
            properties.put(key, value);
            return this;
        }

        public Builder property(String key, boolean value) {
            properties.put(key, value);
            return this;
        }

        /**
         * Adds a geographic point, sent as {@code {"lat": ..., "lon": ...}}.
         *
         * @param key the property name
         * @param lat the latitude
         * @param lon the longitude
         * @return the builder
         */
        public Builder geoPointProperty(String key, double lat, double lon) {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("lat", lat);
            point.put("lon", lon);
            properties.put(key, point);
            return this;
        }

        /**
         * Adds several properties. Values must be strings, numbers, booleans, or lists and maps
         * of those.
         *
         * @param values the properties
         * @return the builder
         */
        public Builder properties(Map<String, ?> values) {
            properties.putAll(values);
            return this;
        }

        public CFUser build() {
            if (userCustomerId == null && !anonymous) {
                anonymous = true;
            }
            return new CFUser(this);
        }
    }
}
