package ai.customfit.sdk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import java.net.URI;

public class CFConfigTest {
    @Test
    public void defaults() {
        CFConfig config = new CFConfig.Builder("key").build();
        assertEquals("key", config.getClientKey());
        assertEquals(CFConfig.DEFAULT_EVENTS_QUEUE_SIZE, config.getEventsQueueSize());
        assertEquals(CFConfig.DEFAULT_EVENTS_FLUSH_TIME_SECONDS, config.getEventsFlushTimeSeconds());
        assertEquals(CFConfig.DEFAULT_EVENTS_FLUSH_INTERVAL_MS, config.getEventsFlushIntervalMs());
        assertEquals(CFConfig.DEFAULT_MAX_STORED_EVENTS, config.getMaxStoredEvents());
        assertEquals(CFConfig.DEFAULT_SUMMARIES_QUEUE_SIZE, config.getSummariesQueueSize());
        assertEquals(CFConfig.DEFAULT_SUMMARIES_FLUSH_INTERVAL_MS, config.getSummariesFlushIntervalMs());
        assertEquals(CFConfig.DEFAULT_MAX_RETRY_ATTEMPTS, config.getMaxRetryAttempts());
        assertEquals(CFConfig.DEFAULT_SDK_SETTINGS_CHECK_INTERVAL_MS, config.getSdkSettingsCheckIntervalMs());
        assertEquals(CFConfig.DEFAULT_SDK_SETTINGS_TIMEOUT_MS, config.getSdkSettingsTimeoutMs());
        assertEquals(CFConfig.DEFAULT_BACKGROUND_POLLING_INTERVAL_MS, config.getBackgroundPollingIntervalMs());
        assertEquals(CFConfig.DEFAULT_REDUCED_POLLING_INTERVAL_MS, config.getReducedPollingIntervalMs());
        assertEquals(CFConfig.DEFAULT_LOGGER_NAME, config.getLoggerName());
        assertFalse(config.isOffline());
        assertFalse(config.isDisableBackgroundPolling());
        assertTrue(config.isUseReducedPollingWhenBatteryLow());
        assertEquals(CFConfig.DEFAULT_API_BASE_URI, config.getApiBaseUri());
    }

    @Test
    public void clientKeyIsRequired() {
        assertThrows(() -> new CFConfig.Builder(null));
        assertThrows(() -> new CFConfig.Builder("  "));
    }

    @Test
    public void invalidValuesAreRejected() {
        CFConfig.Builder builder = new CFConfig.Builder("key");
        assertThrows(() -> builder.eventsQueueSize(0));
        assertThrows(() -> builder.maxRetryAttempts(0));
        assertThrows(() -> builder.retryInitialDelayMs(-1));
        assertThrows(() -> builder.retryBackoffMultiplier(1.0));
        assertThrows(() -> builder.retryJitterFactor(1.5));
        assertThrows(() -> builder.sdkSettingsTimeoutMs(0));
    }

    @Test
    public void maxDelayMustNotBeBelowInitialDelay() {
        CFConfig.Builder builder = new CFConfig.Builder("key").retryInitialDelayMs(5000).retryMaxDelayMs(1000);
        assertThrows(builder::build);
    }

    @Test
    public void dimensionIdIsReadFromClientKey() {
        CFConfig config = new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).build();
        assertEquals("dim-1", config.getDimensionId());
        assertEquals("https://sdk.customfit.ai/dim-1/cf-sdk-settings.json", config.getSettingsUrl());
    }

    @Test
    public void malformedClientKeyHasNoDimension() {
        assertNull(CFConfig.extractDimensionId("not-a-jwt"));
        assertNull(CFConfig.extractDimensionId("a.!!!.c"));
        assertNull(new CFConfig.Builder("not-a-jwt").build().getSettingsUrl());
    }

    @Test
    public void endpointUrlsCarryClientKey() {
        CFConfig config = new CFConfig.Builder("key")
                .apiBaseUri(URI.create("http://localhost:8080/"))
                .build();
        assertEquals("http://localhost:8080/v1/cfe?cfenc=key", config.getEventsUrl());
        assertEquals("http://localhost:8080/v1/config/request/summary?cfenc=key", config.getSummariesUrl());
        assertEquals("http://localhost:8080/v1/users/configs?cfenc=key", config.getUserConfigsUrl());
    }

    private static void assertThrows(Runnable action) {
        try {
            action.run();
        } catch (IllegalArgumentException e) {
            return;
        }
        throw new AssertionError("expected IllegalArgumentException");
    }
}
