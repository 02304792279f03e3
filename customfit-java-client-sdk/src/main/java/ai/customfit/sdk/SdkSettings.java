package ai.customfit.sdk;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * The account-level settings document that tells the client whether it should operate at all.
 */
public final class SdkSettings {
    private final boolean accountEnabled;
    private final boolean skipSdk;
    private final JsonObject document;

    SdkSettings(boolean accountEnabled, boolean skipSdk, JsonObject document) {
        this.accountEnabled = accountEnabled;
        this.skipSdk = skipSdk;
        this.document = document;
    }

    /**
     * Parses the settings document. Missing flags take their permissive defaults: the account is
     * enabled, and the SDK is not skipped.
     *
     * @param json the document
     * @return the settings
     * @throws CFFailure with type {@link CFFailure.FailureType#INVALID_RESPONSE_BODY} if the
     *   document is not a JSON object
     */
    static SdkSettings parse(String json) throws CFFailure {
        JsonObject o;
        try {
            JsonElement e = json == null ? null : JsonParser.parseString(json);
            if (e == null || !e.isJsonObject()) {
                throw new CFFailure("Settings document is not a JSON object",
                        CFFailure.FailureType.INVALID_RESPONSE_BODY);
            }
            o = e.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new CFFailure("Settings document could not be parsed", e,
                    CFFailure.FailureType.INVALID_RESPONSE_BODY);
        }
        return new SdkSettings(booleanField(o, "cf_account_enabled", true),
                booleanField(o, "cf_skip_sdk", false), o);
    }

    public boolean isAccountEnabled() {
        return accountEnabled;
    }

    public boolean isSkipSdk() {
        return skipSdk;
    }

    /**
     * @return true if the client should serve configs and report analytics
     */
    public boolean isSdkEnabled() {
        return accountEnabled && !skipSdk;
    }

    /**
     * @return a copy of the full settings document
     */
    public JsonObject getDocument() {
        return document.deepCopy();
    }

    @Override
    public String toString() {
        return "SdkSettings(accountEnabled=" + accountEnabled + ", skipSdk=" + skipSdk + ")";
    }

    private static boolean booleanField(JsonObject o, String name, boolean defaultValue) {
        JsonElement e = o.get(name);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isBoolean()) {
            return defaultValue;
        }
        return e.getAsBoolean();
    }
}
