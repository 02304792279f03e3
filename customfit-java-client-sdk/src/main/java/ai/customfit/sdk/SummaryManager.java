package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.Transport;

import com.google.gson.reflect.TypeToken;
import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reports which config values were served, through the summaries {@link DeliveryQueue}.
 * <p>
 * Only the first summary for each experience is kept for the lifetime of the queue. When the
 * queue is full, the summary waits while a worker thread flushes, so recording a summary never
 * blocks a config read on the network. A summary that still does not fit is reported to the drop
 * listeners.
 */
final class SummaryManager implements UsageSummaryRecorder, Closeable {
    static final String QUEUE_NAME = "summaries";

    private final DeliveryQueue<SummaryData> queue;
    private final Supplier<CFUser> userSource;
    private final Supplier<String> sessionIdSource;
    private final Clock clock;
    private final LDLogger logger;

    SummaryManager(
            CFConfig config,
            Supplier<CFUser> userSource,
            Supplier<String> sessionIdSource,
            Transport transport,
            PersistentDataStoreWrapper store,
            TaskExecutor taskExecutor,
            RetryPolicy retryPolicy,
            ConnectionRecorder connectionRecorder,
            LDLogger logger
    ) {
        this.userSource = userSource;
        this.sessionIdSource = sessionIdSource;
        this.clock = config.clock;
        this.logger = logger;
        String url = config.getSummariesUrl();
        DeliveryQueue.Transmitter<SummaryData> transmitter = batch -> {
            logger.debug("Posting {} summary(ies)", batch.size());
            transport.post(url, AnalyticsPayloads.build("summaries", batch, userSource.get()));
        };
        this.queue = DeliveryQueue.builder(QUEUE_NAME, transmitter)
                .capacity(config.getSummariesQueueSize())
                .flushThreshold(config.getSummariesQueueSize())
                .flushIntervalMs(config.getSummariesFlushIntervalMs())
                .maxItemAgeMs(0)
                .maxStoredItems(config.getSummariesQueueSize())
                .overflowStrategy(DeliveryQueue.OverflowStrategy.FLUSH_THEN_REJECT)
                .rules(new DeliveryQueue.ItemRules<SummaryData>(
                        new TypeToken<List<SummaryData>>() {}.getType(),
                        SummaryManager::validate,
                        s -> s.experienceId))
                .retryPolicy(retryPolicy)
                .connectionRecorder(connectionRecorder)
                .store(store)
                .taskExecutor(taskExecutor)
                .clock(config.clock)
                .logger(logger)
                .offline(config.isOffline())
                .build();
    }

    /**
     * Records that a config was served. Entries that lack any of the identifiers a summary
     * requires are skipped silently.
     *
     * @param entry the config that was served
     */
    @Override
    public void recordUsage(ConfigEntry entry) {
        if (!entry.hasSummaryFields()) {
            logger.debug("Config \"{}\" lacks summary identifiers; summary not recorded", entry.key);
            return;
        }
        pushSummary(entry);
    }

    /**
     * Queues a summary for a served config.
     *
     * @param entry the config that was served
     * @return a success holding the summary, or a validation or queue-full error
     */
    CFResult<SummaryData> pushSummary(ConfigEntry entry) {
        CFUser user = userSource.get();
        SummaryData summary = new SummaryData(
                entry.configId,
                entry.version,
                entry.userId,
                CFUtil.formatTimestamp(clock.millis()),
                entry.variationId,
                user == null ? null : user.getUserCustomerId(),
                sessionIdSource.get(),
                entry.behaviourId,
                entry.experienceId,
                entry.ruleId);
        return queue.enqueue(summary);
    }

    void updateFlushInterval(long intervalMs) {
        queue.updateFlushInterval(intervalMs);
    }

    int flush() {
        return queue.flush();
    }

    DeliveryQueue<SummaryData> getQueue() {
        return queue;
    }

    @Override
    public void close() {
        queue.close();
    }

    private static String validate(SummaryData s) {
        if (s.experienceId == null) {
            return "Summary is missing experience_id";
        }
        if (s.configId == null) {
            return "Summary is missing config_id";
        }
        if (s.variationId == null) {
            return "Summary is missing variation_id";
        }
        if (s.version == null) {
            return "Summary is missing version";
        }
        return null;
    }
}
