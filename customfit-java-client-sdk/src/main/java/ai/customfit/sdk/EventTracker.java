package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.Transport;

import com.google.gson.reflect.TypeToken;
import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Turns application events into {@link EventData} and delivers them through the events
 * {@link DeliveryQueue}.
 * <p>
 * The queue drops its oldest events when full, flushes as soon as it is full, and otherwise
 * delivers an event once it has waited {@code eventsFlushTimeSeconds}. Usage summaries are always
 * flushed before events.
 */
final class EventTracker implements Closeable {
    static final String QUEUE_NAME = "events";

    private final DeliveryQueue<EventData> queue;
    private final Supplier<String> sessionIdSource;
    private final Supplier<UUID> idSource;
    private final Clock clock;
    private final LDLogger logger;

    EventTracker(
            CFConfig config,
            Supplier<CFUser> userSource,
            Supplier<String> sessionIdSource,
            Transport transport,
            PersistentDataStoreWrapper store,
            TaskExecutor taskExecutor,
            RetryPolicy retryPolicy,
            ConnectionRecorder connectionRecorder,
            DeliveryQueue<?> precedingQueue,
            LDLogger logger
    ) {
        this.sessionIdSource = sessionIdSource;
        this.idSource = config.idSource;
        this.clock = config.clock;
        this.logger = logger;
        String url = config.getEventsUrl();
        DeliveryQueue.Transmitter<EventData> transmitter = batch -> {
            logger.debug("Posting {} event(s)", batch.size());
            transport.post(url, AnalyticsPayloads.build("events", batch, userSource.get()));
        };
        this.queue = DeliveryQueue.builder(QUEUE_NAME, transmitter)
                .capacity(config.getEventsQueueSize())
                .flushThreshold(config.getEventsQueueSize())
                .flushIntervalMs(config.getEventsFlushIntervalMs())
                .maxItemAgeMs(config.getEventsFlushTimeSeconds() * 1000L)
                .maxStoredItems(config.getMaxStoredEvents())
                .overflowStrategy(DeliveryQueue.OverflowStrategy.DROP_OLDEST)
                .rules(new DeliveryQueue.ItemRules<EventData>(
                        new TypeToken<List<EventData>>() {}.getType(),
                        e -> CFUtil.isNullOrBlank(e.getEventCustomerId()) ? "Event name cannot be blank" : null,
                        null))
                .retryPolicy(retryPolicy)
                .precedingQueue(precedingQueue)
                .connectionRecorder(connectionRecorder)
                .store(store)
                .taskExecutor(taskExecutor)
                .clock(config.clock)
                .logger(logger)
                .offline(config.isOffline())
                .build();
    }

    /**
     * Records an event.
     *
     * @param eventName the event name; must not be blank
     * @param properties event properties, or null
     * @return a success holding the queued event, or a validation error
     */
    CFResult<EventData> trackEvent(String eventName, Map<String, ?> properties) {
        if (CFUtil.isNullOrBlank(eventName)) {
            logger.warn("Event name cannot be blank; event not tracked");
            return CFResult.error(new CFFailure("Event name cannot be blank", CFFailure.FailureType.VALIDATION_ERROR));
        }
        EventData event = new EventData(
                eventName,
                properties,
                CFUtil.formatTimestamp(clock.millis()),
                sessionIdSource.get(),
                idSource.get().toString());
        return queue.enqueue(event);
    }

    /**
     * Changes how long an event may wait before the periodic timer delivers it.
     *
     * @param seconds the maximum wait; must be positive
     */
    void updateFlushTimeSeconds(int seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("flush time must be positive");
        }
        queue.updateMaxItemAge(seconds * 1000L);
        logger.debug("Events flush time is now {} s", seconds);
    }

    void updateFlushInterval(long intervalMs) {
        queue.updateFlushInterval(intervalMs);
    }

    int flush() {
        return queue.flush();
    }

    Future<Integer> flushAsync() {
        return queue.flushAsync();
    }

    DeliveryQueue<EventData> getQueue() {
        return queue;
    }

    @Override
    public void close() {
        queue.close();
    }
}
