package ai.customfit.sdk;

import static ai.customfit.sdk.TestUtil.requireNoMoreValues;
import static ai.customfit.sdk.TestUtil.requireValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import ai.customfit.sdk.subsystems.ResponseMetadata;
import ai.customfit.sdk.subsystems.TransportResponse;

import com.google.gson.JsonObject;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class SettingsSynchronizerTest {
    private static final String ENABLED = "{\"cf_account_enabled\":true,\"cf_skip_sdk\":false}";
    private static final String DISABLED = "{\"cf_account_enabled\":false,\"cf_skip_sdk\":false}";
    private static final String HI = "{\"configs\":{\"hero_text\":{\"variation\":\"Hi\",\"config_id\":\"c1\","
            + "\"experience_behaviour_response\":{\"experience_id\":\"exp-1\"}},"
            + "\"count\":{\"variation\":5}}}";
    private static final String HELLO = "{\"configs\":{\"hero_text\":{\"variation\":\"Hello\",\"config_id\":\"c1\","
            + "\"experience_behaviour_response\":{\"experience_id\":\"exp-1\"}},"
            + "\"count\":{\"variation\":5}}}";

    @Rule
    public LogCaptureRule logging = new LogCaptureRule();

    private final SimpleTestTaskExecutor taskExecutor = new SimpleTestTaskExecutor();
    private final MockTransport transport = new MockTransport();
    private final PersistentDataStoreWrapper store = TestUtil.makeSimplePersistentDataStoreWrapper();
    private final InMemoryBlobStore blobs = new InMemoryBlobStore();
    private final List<ConfigEntry> usage = new CopyOnWriteArrayList<>();
    private final AtomicInteger connectionSuccesses = new AtomicInteger();
    private final AtomicInteger connectionFailures = new AtomicInteger();
    private final ConnectionRecorder recorder = new ConnectionRecorder() {
        @Override
        public void recordConnectionSuccess() {
            connectionSuccesses.incrementAndGet();
        }

        @Override
        public void recordConnectionFailure(Throwable error) {
            connectionFailures.incrementAndGet();
        }
    };

    @After
    public void after() {
        taskExecutor.close();
    }

    private SettingsSynchronizer makeSynchronizer(CFConfig config) {
        TTLCache<JsonObject> cache = new TTLCache<>("configs", JsonObject.class, store, blobs, taskExecutor,
                Clock.SYSTEM, logging.logger);
        return new SettingsSynchronizer(
                config,
                () -> new CFUser.Builder("user-1").build(),
                transport,
                cache,
                store,
                new CircuitBreakerRegistry(Clock.SYSTEM, logging.logger),
                RetryPolicy.builder().maxAttempts(1).build(),
                taskExecutor,
                usage::add,
                recorder,
                logging.logger);
    }

    private SettingsSynchronizer makeSynchronizer() {
        return makeSynchronizer(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY).build());
    }

    @Test
    public void checkWithoutValidatorsFetchesNothing() {
        SettingsSynchronizer sync = makeSynchronizer();
        assertTrue(sync.checkSettings());

        assertEquals(1, transport.getRequests().size());
        assertEquals(MockTransport.METHOD_METADATA, transport.getRequests().get(0).method);
        assertEquals(0, sync.getSnapshot().size());
        assertNull(sync.getSdkSettings());
        assertEquals(1, connectionSuccesses.get());
    }

    @Test
    public void firstCheckFetchesSettingsAndConfig() {
        transport.serve("v1", "Mon, 01 Jan 2024 00:00:00 GMT", ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        assertTrue(sync.checkSettings());

        assertEquals(1, transport.countSettingsFetches());
        assertEquals(1, transport.countConfigFetches());
        MockTransport.Request configRequest = transport.getRequests(MockTransport.METHOD_FULL).get(1);
        assertEquals("Mon, 01 Jan 2024 00:00:00 GMT", configRequest.lastModified);
        assertThat(configRequest.url, containsString("/v1/users/configs?cfenc="));
        assertThat(configRequest.body, containsString("user-1"));

        assertEquals("Hi", sync.getValue("hero_text", "default", ValueTypes.STRING));
        assertEquals(Integer.valueOf(5), sync.getValue("count", 0, ValueTypes.INT));
        assertEquals("v1", sync.getPreviousMetadata().getEtag());
        assertEquals("v1", store.getSettingsMetadata().getEtag());
        assertTrue(sync.isEnabled());
    }

    @Test
    public void unchangedValidatorsSkipDocumentFetches() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();
        transport.clearRequests();

        sync.checkSettings();
        assertEquals(1, transport.getRequests().size());
        assertEquals(MockTransport.METHOD_METADATA, transport.getRequests().get(0).method);
        assertEquals("Hi", sync.getValue("hero_text", "default", ValueTypes.STRING));
    }

    @Test
    public void forceRefreshFetchesEverythingAgain() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();
        transport.clearRequests();

        assertTrue(sync.forceRefresh());
        assertEquals(1, transport.countSettingsFetches());
        assertEquals(1, transport.countConfigFetches());
    }

    @Test
    public void changedConfigNotifiesListenersOfChangedKeysOnly() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();

        BlockingQueue<ConfigValue> heroChanges = new LinkedBlockingQueue<>();
        BlockingQueue<ConfigValue> countChanges = new LinkedBlockingQueue<>();
        BlockingQueue<Map<String, ConfigValue>> allChanges = new LinkedBlockingQueue<>();
        sync.registerConfigListener("hero_text", (key, value) -> heroChanges.add(value));
        sync.registerConfigListener("count", (key, value) -> countChanges.add(value));
        sync.registerAllFlagsListener(allChanges::add);

        transport.serve("v2", null, ENABLED, HELLO);
        sync.checkSettings();

        assertEquals("Hello", requireValue(heroChanges, 1, TimeUnit.SECONDS, "change").stringValue());
        assertEquals("Hello", requireValue(allChanges, 1, TimeUnit.SECONDS, "change").get("hero_text").stringValue());
        requireNoMoreValues(countChanges, 100, TimeUnit.MILLISECONDS, "change of unchanged key");
        requireNoMoreValues(heroChanges, 100, TimeUnit.MILLISECONDS, "second change");
    }

    @Test
    public void unsubscribedListenerIsNotNotified() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        BlockingQueue<ConfigValue> changes = new LinkedBlockingQueue<>();
        Subscription subscription = sync.registerConfigListener("hero_text", (key, value) -> changes.add(value));
        subscription.close();

        sync.checkSettings();
        requireNoMoreValues(changes, 100, TimeUnit.MILLISECONDS, "change");
    }

    @Test
    public void typedListenerIgnoresValuesOfOtherTypes() {
        transport.serve("v1", null, ENABLED, "{\"configs\":{\"count\":{\"variation\":5}}}");
        SettingsSynchronizer sync = makeSynchronizer();
        BlockingQueue<Integer> changes = new LinkedBlockingQueue<>();
        sync.registerTypedConfigListener("count", ValueTypes.INT, (key, value) -> changes.add(value));

        sync.checkSettings();
        assertEquals(Integer.valueOf(5), requireValue(changes, 1, TimeUnit.SECONDS, "change"));

        transport.serve("v2", null, ENABLED, "{\"configs\":{\"count\":{\"variation\":\"five\"}}}");
        sync.checkSettings();
        requireNoMoreValues(changes, 100, TimeUnit.MILLISECONDS, "change");
    }

    @Test
    public void notModifiedConfigKeepsSnapshot() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();

        ResponseMetadata v2 = new ResponseMetadata("v2", null);
        transport.metadataHandler = r -> v2;
        transport.fullHandler = r -> r.isSettingsRequest()
                ? new TransportResponse(200, v2, ENABLED)
                : new TransportResponse(TransportResponse.NOT_MODIFIED, v2, null);
        sync.checkSettings();

        assertEquals("Hi", sync.getValue("hero_text", "default", ValueTypes.STRING));
        assertEquals("v2", sync.getPreviousMetadata().getEtag());
    }

    @Test
    public void disabledAccountServesDefaults() {
        transport.serve("v1", null, DISABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();

        assertFalse(sync.isEnabled());
        assertEquals(0, transport.countConfigFetches());
        assertEquals("default", sync.getValue("hero_text", "default", ValueTypes.STRING));
        assertTrue(sync.getAllFlags().isEmpty());
        assertTrue(usage.isEmpty());
    }

    @Test
    public void disablingAccountStopsListenersAndSummaries() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();
        BlockingQueue<ConfigValue> changes = new LinkedBlockingQueue<>();
        sync.registerConfigListener("hero_text", (key, value) -> changes.add(value));

        transport.serve("v2", null, DISABLED, HELLO);
        sync.checkSettings();

        assertFalse(sync.isEnabled());
        logging.assertInfoLogged("SDK functionality is now disabled");
        assertEquals("default", sync.getValue("hero_text", "default", ValueTypes.STRING));
        assertTrue(usage.isEmpty());
        requireNoMoreValues(changes, 100, TimeUnit.MILLISECONDS, "change");

        // polling continues, so re-enabling the account is picked up
        transport.serve("v3", null, ENABLED, HELLO);
        sync.checkSettings();
        assertTrue(sync.isEnabled());
        assertEquals("Hello", sync.getValue("hero_text", "default", ValueTypes.STRING));
    }

    @Test
    public void readsRecordUsageForHitsOnly() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();

        sync.getValue("hero_text", "default", ValueTypes.STRING);
        sync.getValue("missing", "default", ValueTypes.STRING);

        assertEquals(1, usage.size());
        assertEquals("hero_text", usage.get(0).key);
        assertEquals("exp-1", usage.get(0).experienceId);
    }

    @Test
    public void wrongTypeReturnsFallback() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();
        assertEquals(Integer.valueOf(-1), sync.getValue("hero_text", -1, ValueTypes.INT));
    }

    @Test
    public void hydrateLoadsCachedConfigAndStoredValidators() {
        transport.serve("v1", null, ENABLED, HI);
        makeSynchronizer().checkSettings();
        transport.clearRequests();

        SettingsSynchronizer restarted = makeSynchronizer();
        assertTrue(restarted.hydrateFromCache());
        assertEquals("Hi", restarted.getValue("hero_text", "default", ValueTypes.STRING));
        assertEquals("v1", restarted.getPreviousMetadata().getEtag());
        assertTrue(transport.getRequests().isEmpty());

        restarted.checkSettings();
        assertEquals(0, transport.countConfigFetches());
    }

    @Test
    public void storedValidatorsAreIgnoredWithoutCachedConfig() {
        store.setSettingsMetadata(new ResponseMetadata("v1", null));
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();

        assertFalse(sync.hydrateFromCache());
        assertNull(sync.getPreviousMetadata());
        sync.checkSettings();
        assertEquals(1, transport.countConfigFetches());
    }

    @Test
    public void failedCheckChangesNothing() {
        transport.serve("v1", null, ENABLED, HI);
        SettingsSynchronizer sync = makeSynchronizer();
        sync.checkSettings();

        transport.metadataHandler = r -> new ResponseMetadata("v2", null);
        transport.fullHandler = r -> {
            throw new CFFailure("boom", CFFailure.FailureType.NETWORK_FAILURE);
        };
        sync.checkSettings();

        assertEquals("Hi", sync.getValue("hero_text", "default", ValueTypes.STRING));
        assertEquals("v1", sync.getPreviousMetadata().getEtag());
        assertEquals(1, connectionFailures.get());
        logging.assertWarnLogged("Settings check failed");
    }

    @Test
    public void slowCheckTimesOut() {
        transport.metadataHandler = r -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                throw new CFFailure("interrupted", e, CFFailure.FailureType.NETWORK_FAILURE);
            }
            return new ResponseMetadata("v1", null);
        };
        SettingsSynchronizer sync = makeSynchronizer(new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY)
                .sdkSettingsTimeoutMs(100).build());

        long start = System.currentTimeMillis();
        assertTrue(sync.checkSettings());
        assertTrue(System.currentTimeMillis() - start < 4000);
        assertEquals(1, connectionFailures.get());
        logging.assertWarnLogged("timed out");
        assertNull(sync.getPreviousMetadata());
    }

    @Test
    public void repeatedFailuresOpenCircuit() {
        transport.metadataHandler = r -> {
            throw new CFFailure("unreachable", CFFailure.FailureType.NETWORK_FAILURE);
        };
        SettingsSynchronizer sync = makeSynchronizer();
        for (int i = 0; i < CircuitBreaker.DEFAULT_FAILURE_THRESHOLD; i++) {
            sync.checkSettings();
        }
        assertEquals(CircuitBreaker.DEFAULT_FAILURE_THRESHOLD, transport.getRequests().size());

        sync.checkSettings();
        assertEquals(CircuitBreaker.DEFAULT_FAILURE_THRESHOLD, transport.getRequests().size());
        assertEquals(CircuitBreaker.DEFAULT_FAILURE_THRESHOLD, connectionFailures.get());
    }

    @Test
    public void concurrentCheckIsSkipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        transport.metadataHandler = r -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                throw new CFFailure("interrupted", e, CFFailure.FailureType.NETWORK_FAILURE);
            }
            return new ResponseMetadata(null, null);
        };
        SettingsSynchronizer sync = makeSynchronizer();
        Thread first = new Thread(sync::checkSettings);
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertFalse(sync.checkSettings());
        release.countDown();
        first.join(5000);
        assertEquals(1, transport.getRequests().size());
        assertTrue(sync.checkSettings());
    }

    @Test
    public void clientKeyWithoutDimensionDisablesChecks() {
        SettingsSynchronizer sync = makeSynchronizer(new CFConfig.Builder(TestUtil.CLIENT_KEY).build());
        assertTrue(sync.checkSettings());
        assertTrue(sync.checkSettings());
        assertTrue(transport.getRequests().isEmpty());
        assertEquals(1, logging.logCapture.getMessageStrings().stream()
                .filter(s -> s.contains("does not contain a dimension id")).count());
    }

    @Test
    public void pollingRunsChecksUntilPaused() {
        SettingsSynchronizer sync = makeSynchronizer();
        sync.startPolling(30, true);
        assertTrue(sync.isPolling());
        assertTrue(TestUtil.awaitCondition(() -> transport.getRequests().size() >= 2, 5000));

        sync.pausePolling();
        assertFalse(sync.isPolling());
        sync.resumePolling();
        assertTrue(sync.isPolling());

        sync.updatePollingInterval(60_000);
        assertEquals(60_000, sync.getPollingIntervalMs());
        sync.close();
        assertFalse(sync.isPolling());
        assertNotNull(sync.getSnapshot());
    }
}
