package ai.customfit.sdk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import ai.customfit.sdk.subsystems.TransportResponse;

import com.google.gson.JsonPrimitive;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class CFClientTest {
    private static final String SETTINGS = "{\"cf_account_enabled\":true,\"cf_skip_sdk\":false}";
    private static final String CONFIGS = "{\"configs\":{"
            + "\"hero_text\":{\"variation\":\"Hi\"},"
            + "\"dark_mode\":{\"variation\":true},"
            + "\"max_items\":{\"variation\":12},"
            + "\"ratio\":{\"variation\":0.5}}}";

    @Rule
    public LogCaptureRule logging = new LogCaptureRule();

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private final MockTransport transport = new MockTransport();
    private CFClient client;

    @After
    public void after() throws IOException {
        if (client != null) {
            client.close();
        }
    }

    private CFClient makeClient(CFConfig.Builder builder) {
        client = CFClient.init(builder
                .cacheDir(tempFolder.getRoot())
                .logAdapter(logging.logAdapter)
                .persistentDataStore(new InMemoryPersistentDataStore())
                .blobStore(new InMemoryBlobStore())
                .transport(transport)
                .build(), new CFUser.Builder("user-1").build());
        return client;
    }

    private CFClient makeOnlineClient() {
        transport.serve("v1", null, SETTINGS, CONFIGS);
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY));
        assertTrue(TestUtil.awaitCondition(() -> c.getAllFlags().size() == 4, 5000));
        return c;
    }

    @Test
    public void typedReads() {
        CFClient c = makeOnlineClient();
        assertEquals("Hi", c.getString("hero_text", "default"));
        assertTrue(c.getBoolean("dark_mode", false));
        assertEquals(12, c.getInt("max_items", 0));
        assertEquals(0.5, c.getNumber("ratio", 0), 0);
        assertEquals(new JsonPrimitive("Hi"), c.getJson("hero_text", null));
        assertEquals("fallback", c.getString("missing", "fallback"));
        assertEquals(7, c.getInt("hero_text", 7));
    }

    @Test
    public void readsReturnFallbacksBeforeAnyConfigArrives() {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).offline(true));
        assertEquals("default", c.getString("hero_text", "default"));
        assertTrue(c.getAllFlags().isEmpty());
        assertTrue(c.isOffline());
        assertEquals(ConnectionStatus.OFFLINE, c.getConnectionInformation().getStatus());
    }

    @Test
    public void offlineClientDoesNotPoll() {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).offline(true));
        assertFalse(c.getSettingsSynchronizer().isPolling());
        c.setOnline();
        assertTrue(c.getSettingsSynchronizer().isPolling());
        c.setOffline();
        assertFalse(c.getSettingsSynchronizer().isPolling());
        assertTrue(c.getEventTracker().getQueue().isOffline());
    }

    @Test
    public void backgroundPollingUsesBackgroundInterval() {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY)
                .sdkSettingsCheckIntervalMs(60_000)
                .backgroundPollingIntervalMs(600_000));
        assertEquals(60_000, c.getSettingsSynchronizer().getPollingIntervalMs());

        c.getPlatformSignals().setForeground(false);
        assertEquals(600_000, c.getSettingsSynchronizer().getPollingIntervalMs());
        c.getPlatformSignals().setForeground(true);
        assertEquals(60_000, c.getSettingsSynchronizer().getPollingIntervalMs());
    }

    @Test
    public void backgroundPollingCanBeDisabled() {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).disableBackgroundPolling(true));
        c.getPlatformSignals().setForeground(false);
        assertFalse(c.getSettingsSynchronizer().isPolling());
        c.getPlatformSignals().setForeground(true);
        assertTrue(c.getSettingsSynchronizer().isPolling());
    }

    @Test
    public void lowBatteryReducesPolling() {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY)
                .sdkSettingsCheckIntervalMs(60_000)
                .reducedPollingIntervalMs(7_200_000));
        c.getPlatformSignals().setBatteryLow(true);
        assertEquals(7_200_000, c.getSettingsSynchronizer().getPollingIntervalMs());
        c.getPlatformSignals().setBatteryLow(false);
        assertEquals(60_000, c.getSettingsSynchronizer().getPollingIntervalMs());
    }

    @Test
    public void networkLossTakesQueuesOffline() {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY));
        c.getPlatformSignals().setNetworkAvailable(false);
        assertTrue(c.getEventTracker().getQueue().isOffline());
        assertTrue(c.getSummaryManager().getQueue().isOffline());
        assertEquals(ConnectionStatus.DISCONNECTED, c.getConnectionInformation().getStatus());

        c.getPlatformSignals().setNetworkAvailable(true);
        assertFalse(c.getEventTracker().getQueue().isOffline());
    }

    @Test
    public void changingUserRotatesSessionAndRefetchesConfigs() {
        CFClient c = makeOnlineClient();
        String session = c.getCurrentSessionId();
        int fetches = transport.countConfigFetches();

        c.setUser(new CFUser.Builder("user-2").build());
        assertNotEquals(session, c.getCurrentSessionId());
        assertEquals("user-2", c.getUser().getUserCustomerId());
        assertTrue(TestUtil.awaitCondition(() -> transport.countConfigFetches() > fetches, 5000));
    }

    @Test
    public void trackedEventsCarrySessionId() {
        CFClient c = makeOnlineClient();
        String session = c.getCurrentSessionId();
        assertTrue(c.trackEvent("click").isSuccess());
        assertEquals(1, c.flushEvents());

        MockTransport.Request post = transport.getRequests(MockTransport.METHOD_POST).get(0);
        assertTrue(post.body.contains(session));
    }

    @Test
    public void forcedSessionRotationChangesId() {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).offline(true));
        String session = c.getCurrentSessionId();
        String rotated = c.forceSessionRotation();
        assertNotEquals(session, rotated);
        assertEquals(rotated, c.getCurrentSessionId());
    }

    @Test
    public void sessionStatsDescribeCurrentSession() {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).offline(true));
        SessionStats stats = c.getSessionStats();
        assertTrue(stats.hasActiveSession());
        assertEquals(c.getCurrentSessionId(), stats.getSessionId());
        assertEquals(0, stats.getBackgroundSince());

        c.getPlatformSignals().setForeground(false);
        assertNotEquals(0, c.getSessionStats().getBackgroundSince());
    }

    @Test
    public void closeIsIdempotent() throws IOException {
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).offline(true));
        c.close();
        c.close();
        client = null;
    }

    @Test
    public void readsDoNotWaitForSummaryDelivery() {
        String configs = "{\"configs\":{"
                + summaryConfig("k1") + "," + summaryConfig("k2") + ","
                + summaryConfig("k3") + "," + summaryConfig("k4") + "}}";
        transport.serve("v1", null, SETTINGS, configs);
        CountDownLatch releaseDelivery = new CountDownLatch(1);
        transport.postHandler = r -> {
            try {
                releaseDelivery.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new TransportResponse(202, null, "");
        };
        CFClient c = makeClient(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).summariesQueueSize(1));
        try {
            assertTrue(TestUtil.awaitCondition(() -> c.getAllFlags().size() == 4, 5000));
            assertEquals("value-k1", c.getString("k1", "default"));
            assertTrue(TestUtil.awaitCondition(() -> countSummaryPosts() == 1, 5000));
            assertEquals("value-k2", c.getString("k2", "default"));
            assertEquals("value-k3", c.getString("k3", "default"));

            long start = System.nanoTime();
            assertEquals("value-k4", c.getString("k4", "default"));
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue("read took " + elapsedMillis + " ms", elapsedMillis < 500);
        } finally {
            releaseDelivery.countDown();
        }
        assertTrue(TestUtil.awaitCondition(() -> countSummaryPosts() >= 3, 5000));
    }

    private static String summaryConfig(String key) {
        return "\"" + key + "\":{\"variation\":\"value-" + key + "\",\"config_id\":\"cfg-" + key
                + "\",\"variation_id\":\"var-" + key + "\",\"version\":1,"
                + "\"experience_behaviour_response\":{\"experience_id\":\"exp-" + key + "\"}}";
    }

    private int countSummaryPosts() {
        int count = 0;
        for (MockTransport.Request r: transport.getRequests(MockTransport.METHOD_POST)) {
            if (r.url.contains("/summary")) {
                count++;
            }
        }
        return count;
    }
}
