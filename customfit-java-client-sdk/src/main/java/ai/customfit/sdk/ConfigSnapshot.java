package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.ResponseMetadata;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.launchdarkly.logging.LDLogger;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable view of every config known to the client, along with the validators of the
 * document it was parsed from. The live snapshot is replaced as a whole, never modified.
 */
final class ConfigSnapshot {
    static final ConfigSnapshot EMPTY = new ConfigSnapshot(Collections.emptyMap(), new ResponseMetadata(null, null));

    private final Map<String, ConfigEntry> entries;
    private final ResponseMetadata metadata;

    ConfigSnapshot(Map<String, ConfigEntry> entries, ResponseMetadata metadata) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.metadata = metadata;
    }

    /**
     * Parses a config document. The document is either {@code {"configs": {...}}} or the config
     * map itself. Entries that are not objects, or that have no {@code variation}, are skipped.
     *
     * @param document the document
     * @param metadata the validators it was served with
     * @param logger for reporting skipped entries
     * @return the snapshot
     */
    static ConfigSnapshot parse(JsonObject document, ResponseMetadata metadata, LDLogger logger) {
        JsonObject configs = document;
        if (document.has("configs") && document.get("configs").isJsonObject()) {
            configs = document.getAsJsonObject("configs");
        }
        Map<String, ConfigEntry> entries = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> e: configs.entrySet()) {
            String key = e.getKey();
            if (!e.getValue().isJsonObject()) {
                logger.warn("Skipping config \"{}\": not an object", key);
                continue;
            }
            JsonObject o = e.getValue().getAsJsonObject();
            ConfigValue variation = ConfigValue.of(o.get("variation"));
            if (variation == null) {
                logger.warn("Skipping config \"{}\": no variation", key);
                continue;
            }
            JsonObject experience = o.has("experience_behaviour_response")
                    && o.get("experience_behaviour_response").isJsonObject()
                    ? o.getAsJsonObject("experience_behaviour_response") : o;
            entries.put(key, new ConfigEntry(
                    key,
                    variation,
                    stringField(experience, "experience_id"),
                    stringField(o, "config_id"),
                    stringField(o, "variation_id"),
                    stringField(o, "version"),
                    stringField(experience, "behaviour_id"),
                    stringField(experience, "rule_id"),
                    stringField(o, "user_id")));
        }
        return new ConfigSnapshot(entries, metadata == null ? new ResponseMetadata(null, null) : metadata);
    }

    ConfigEntry get(String key) {
        return entries.get(key);
    }

    Map<String, ConfigEntry> getEntries() {
        return entries;
    }

    ResponseMetadata getMetadata() {
        return metadata;
    }

    int size() {
        return entries.size();
    }

    /**
     * @return every config value, keyed by config key
     */
    Map<String, ConfigValue> values() {
        Map<String, ConfigValue> result = new LinkedHashMap<>();
        for (ConfigEntry entry: entries.values()) {
            result.put(entry.key, entry.variation);
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Returns the keys whose value differs between this snapshot and an earlier one, including
     * keys present in only one of them.
     *
     * @param previous the earlier snapshot
     * @return the changed keys
     */
    Set<String> changedKeys(ConfigSnapshot previous) {
        Set<String> changed = new HashSet<>();
        for (ConfigEntry entry: entries.values()) {
            ConfigEntry old = previous.entries.get(entry.key);
            if (old == null || !old.variation.equals(entry.variation)) {
                changed.add(entry.key);
            }
        }
        for (String key: previous.entries.keySet()) {
            if (!entries.containsKey(key)) {
                changed.add(key);
            }
        }
        return changed;
    }

    private static String stringField(JsonObject o, String name) {
        JsonElement e = o.get(name);
        if (e == null || !e.isJsonPrimitive()) {
            return null;
        }
        return e.getAsString();
    }
}
