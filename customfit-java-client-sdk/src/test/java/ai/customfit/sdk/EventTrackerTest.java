package ai.customfit.sdk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

public class EventTrackerTest {
    private static final UUID INSERT_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");

    @Rule
    public LogCaptureRule logging = new LogCaptureRule();

    private final SimpleTestTaskExecutor taskExecutor = new SimpleTestTaskExecutor();
    private final MockTransport transport = new MockTransport();
    private final PersistentDataStoreWrapper store = TestUtil.makeSimplePersistentDataStoreWrapper();
    private final CFUser user = new CFUser.Builder("user-1").build();
    private final CFConfig config = new CFConfig.Builder("key")
            .clock(new TestClock(1_700_000_000_000L))
            .idSource(() -> INSERT_ID)
            .build();

    @After
    public void after() {
        taskExecutor.close();
    }

    private SummaryManager makeSummaryManager() {
        return new SummaryManager(config, () -> user, () -> "session-1", transport, store, taskExecutor,
                RetryPolicy.builder().maxAttempts(1).build(), ConnectionRecorder.NONE, logging.logger);
    }

    private EventTracker makeTracker(DeliveryQueue<?> precedingQueue) {
        return new EventTracker(config, () -> user, () -> "session-1", transport, store, taskExecutor,
                RetryPolicy.builder().maxAttempts(1).build(), ConnectionRecorder.NONE, precedingQueue, logging.logger);
    }

    @Test
    public void trackedEventIsPostedWithUserAndSdkVersion() {
        EventTracker tracker = makeTracker(null);
        CFResult<EventData> result = tracker.trackEvent("click", Collections.singletonMap("button", "buy"));
        assertTrue(result.isSuccess());
        assertEquals(1, tracker.flush());

        List<MockTransport.Request> posts = transport.getRequests(MockTransport.METHOD_POST);
        assertEquals(1, posts.size());
        assertEquals(config.getEventsUrl(), posts.get(0).url);
        JsonObject body = JsonParser.parseString(posts.get(0).body).getAsJsonObject();
        assertEquals(CFPackageConsts.SDK_VERSION, body.get(AnalyticsPayloads.SDK_VERSION_PROPERTY).getAsString());
        assertEquals("user-1", body.getAsJsonObject("user").get("user_customer_id").getAsString());

        JsonArray events = body.getAsJsonArray("events");
        assertEquals(1, events.size());
        JsonObject event = events.get(0).getAsJsonObject();
        assertEquals("click", event.get("event_customer_id").getAsString());
        assertEquals(EventData.EVENT_TYPE_TRACK, event.get("event_type").getAsString());
        assertEquals("session-1", event.get("session_id").getAsString());
        assertEquals(INSERT_ID.toString(), event.get("insert_id").getAsString());
        assertEquals("buy", event.getAsJsonObject("properties").get("button").getAsString());
        assertEquals(CFUtil.formatTimestamp(1_700_000_000_000L), event.get("event_timestamp").getAsString());
    }

    @Test
    public void blankEventNameIsRejected() {
        EventTracker tracker = makeTracker(null);
        CFResult<EventData> result = tracker.trackEvent(" ", null);
        assertFalse(result.isSuccess());
        assertEquals(CFFailure.FailureType.VALIDATION_ERROR, result.getError().getFailureType());
        assertEquals(0, tracker.getQueue().size());
        logging.assertWarnLogged("Event name cannot be blank");
    }

    @Test
    public void summariesAreDeliveredBeforeEvents() {
        SummaryManager summaries = makeSummaryManager();
        EventTracker tracker = makeTracker(summaries.getQueue());
        summaries.recordUsage(new ConfigEntry("hero_text", ConfigValue.of("Hi"), "exp-1", "c1", "var-1", "1",
                "b1", "r1", "u1"));
        tracker.trackEvent("click", null);

        tracker.flush();
        List<MockTransport.Request> posts = transport.getRequests(MockTransport.METHOD_POST);
        assertEquals(2, posts.size());
        assertEquals(config.getSummariesUrl(), posts.get(0).url);
        assertEquals(config.getEventsUrl(), posts.get(1).url);
    }

    @Test
    public void failedPostKeepsEventsQueued() {
        transport.postHandler = r -> {
            throw new CFInvalidResponseCodeFailure("server error", 500, true);
        };
        EventTracker tracker = makeTracker(null);
        tracker.trackEvent("click", null);
        assertEquals(0, tracker.flush());
        assertEquals(1, tracker.getQueue().size());
    }

    @Test
    public void closeWhileOfflinePersistsEvents() {
        CFConfig offlineConfig = new CFConfig.Builder("key").offline(true).build();
        EventTracker tracker = new EventTracker(offlineConfig, () -> user, () -> "session-1", transport, store,
                taskExecutor, RetryPolicy.builder().maxAttempts(1).build(), ConnectionRecorder.NONE, null,
                logging.logger);
        tracker.trackEvent("click", null);
        tracker.close();
        assertTrue(transport.getRequests().isEmpty());
        assertTrue(store.getQueuedItems(EventTracker.QUEUE_NAME).contains("click"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void flushTimeMustBePositive() {
        makeTracker(null).updateFlushTimeSeconds(0);
    }
}
