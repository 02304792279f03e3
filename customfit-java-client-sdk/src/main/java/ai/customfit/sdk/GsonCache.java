package ai.customfit.sdk;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

class GsonCache {

    private static final Gson gson = createGson();

    static Gson getGson() {
        return gson;
    }

    private static Gson createGson() {
        // nulls are kept so that optional summary fields are always present in the payload
        return new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    }
}
