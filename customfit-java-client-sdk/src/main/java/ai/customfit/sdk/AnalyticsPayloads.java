package ai.customfit.sdk;

import com.google.gson.Gson;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * Builds the bodies of analytics submissions: {@code {"<kind>": [...], "user": {...},
 * "cf_client_sdk_version": "..."}}.
 */
final class AnalyticsPayloads {
    static final String SDK_VERSION_PROPERTY = "cf_client_sdk_version";

    private AnalyticsPayloads() {
    }

    static String build(String itemsProperty, List<?> items, CFUser user) {
        Gson gson = GsonCache.getGson();
        JsonObject o = new JsonObject();
        o.add(itemsProperty, gson.toJsonTree(items));
        o.add("user", gson.toJsonTree(user));
        o.addProperty(SDK_VERSION_PROPERTY, CFPackageConsts.SDK_VERSION);
        return gson.toJson(o);
    }
}
