package ai.customfit.sdk;

/**
 * Records that a config value was served.
 */
interface UsageSummaryRecorder {
    UsageSummaryRecorder NONE = entry -> { };

    void recordUsage(ConfigEntry entry);
}
