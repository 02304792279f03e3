package ai.customfit.sdk;

import java.util.Objects;

/**
 * The current value of one config, with the identifiers needed to report that it was served.
 */
final class ConfigEntry {
    final String key;
    final ConfigValue variation;
    final String experienceId;
    final String configId;
    final String variationId;
    final String version;
    final String behaviourId;
    final String ruleId;
    final String userId;

    ConfigEntry(String key, ConfigValue variation, String experienceId, String configId, String variationId,
                String version, String behaviourId, String ruleId, String userId) {
        this.key = key;
        this.variation = variation;
        this.experienceId = experienceId;
        this.configId = configId;
        this.variationId = variationId;
        this.version = version;
        this.behaviourId = behaviourId;
        this.ruleId = ruleId;
        this.userId = userId;
    }

    /**
     * @return true if this entry carries every identifier a usage summary requires
     */
    boolean hasSummaryFields() {
        return experienceId != null && configId != null && variationId != null && version != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConfigEntry)) {
            return false;
        }
        ConfigEntry other = (ConfigEntry) o;
        return key.equals(other.key) && variation.equals(other.variation)
                && Objects.equals(experienceId, other.experienceId) && Objects.equals(configId, other.configId)
                && Objects.equals(variationId, other.variationId) && Objects.equals(version, other.version)
                && Objects.equals(behaviourId, other.behaviourId) && Objects.equals(ruleId, other.ruleId)
                && Objects.equals(userId, other.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, variation, configId, variationId, version);
    }

    @Override
    public String toString() {
        return "ConfigEntry(" + key + "=" + variation + ")";
    }
}
