package ai.customfit.sdk;

import static ai.customfit.sdk.TestUtil.requireNoMoreValues;
import static ai.customfit.sdk.TestUtil.requireValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.google.gson.reflect.TypeToken;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class DeliveryQueueTest {
    static final class TestItem implements QueueItem {
        int id;
        String key;
        String timestamp;

        TestItem(int id, String key) {
            this.id = id;
            this.key = key;
            this.timestamp = "2024-01-01 00:00:00.000Z";
        }

        @Override
        public String getTimestamp() {
            return timestamp;
        }
    }

    private static final DeliveryQueue.ItemRules<TestItem> RULES = new DeliveryQueue.ItemRules<TestItem>(
            new TypeToken<List<TestItem>>() {}.getType(),
            item -> item.id < 0 ? "id must not be negative" : null,
            item -> item.key);

    @Rule
    public LogCaptureRule logging = new LogCaptureRule();

    private final SimpleTestTaskExecutor taskExecutor = new SimpleTestTaskExecutor();
    private final PersistentDataStoreWrapper store = TestUtil.makeSimplePersistentDataStoreWrapper();
    private final BlockingQueue<List<TestItem>> transmitted = new LinkedBlockingQueue<>();
    private final AtomicBoolean failDelivery = new AtomicBoolean(false);
    private final AtomicInteger connectionFailures = new AtomicInteger();
    private final AtomicInteger connectionSuccesses = new AtomicInteger();

    private final DeliveryQueue.Transmitter<TestItem> transmitter = batch -> {
        if (failDelivery.get()) {
            throw new CFFailure("server unavailable", CFFailure.FailureType.NETWORK_FAILURE);
        }
        transmitted.add(new ArrayList<>(batch));
    };

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

    private DeliveryQueue.Builder<TestItem> queueBuilder(String name) {
        return DeliveryQueue.builder(name, transmitter)
                .rules(RULES)
                .retryPolicy(RetryPolicy.builder().maxAttempts(1).build())
                .connectionRecorder(recorder)
                .flushIntervalMs(60_000)
                .store(store)
                .taskExecutor(taskExecutor)
                .logger(logging.logger);
    }

    private static List<Integer> ids(List<TestItem> items) {
        List<Integer> ret = new ArrayList<>();
        for (TestItem item: items) {
            ret.add(item.id);
        }
        return ret;
    }

    @Test
    public void reachingThresholdTriggersExactlyOneFlushOfOneBatch() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").capacity(100).flushThreshold(100).build();
        for (int i = 1; i <= 101; i++) {
            assertTrue(queue.enqueue(new TestItem(i, null)).isSuccess());
        }

        List<TestItem> batch = requireValue(transmitted, 5, TimeUnit.SECONDS, "threshold flush");
        requireNoMoreValues(transmitted, 200, TimeUnit.MILLISECONDS, "second flush");
        assertEquals(100, batch.size());
        int first = batch.get(0).id;
        for (int i = 0; i < batch.size(); i++) {
            assertEquals(first + i, batch.get(i).id);
        }
        assertEquals(1, queue.size() + queue.getDroppedCount());
    }

    @Test
    public void dropOldestEvictsAndNotifiesListeners() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").capacity(3).maxStoredItems(3).offline(true).build();
        BlockingQueue<List<TestItem>> dropped = new LinkedBlockingQueue<>();
        queue.addDropListener((name, items) -> dropped.add(items));

        for (int i = 1; i <= 5; i++) {
            assertTrue(queue.enqueue(new TestItem(i, null)).isSuccess());
        }

        assertEquals(3, queue.size());
        assertEquals(2, queue.getDroppedCount());
        assertEquals(Arrays.asList(1), ids(requireValue(dropped, 1, TimeUnit.SECONDS, "drop")));
        assertEquals(Arrays.asList(2), ids(requireValue(dropped, 1, TimeUnit.SECONDS, "drop")));
    }

    @Test
    public void flushThenRejectReturnsQueueFullAndReleasesKey() {
        DeliveryQueue<TestItem> queue = queueBuilder("summaries").capacity(2).maxStoredItems(2)
                .overflowStrategy(DeliveryQueue.OverflowStrategy.FLUSH_THEN_REJECT).offline(true).build();
        assertTrue(queue.enqueue(new TestItem(1, "a")).isSuccess());
        assertTrue(queue.enqueue(new TestItem(2, "b")).isSuccess());

        CFResult<TestItem> rejected = queue.enqueue(new TestItem(3, "c"));
        assertFalse(rejected.isSuccess());
        assertEquals(CFFailure.FailureType.QUEUE_FULL, rejected.getError().getFailureType());

        // the key of a rejected item is not remembered, so it is not silently ignored next time
        CFResult<TestItem> again = queue.enqueue(new TestItem(3, "c"));
        assertEquals(CFFailure.FailureType.QUEUE_FULL, again.getError().getFailureType());
        assertEquals(2, queue.size());
    }

    @Test
    public void fullQueueDoesNotWaitForDeliveryWhenOnline() throws Exception {
        CountDownLatch releaseDelivery = new CountDownLatch(1);
        DeliveryQueue.Transmitter<TestItem> slowTransmitter = batch -> {
            try {
                releaseDelivery.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            transmitted.add(new ArrayList<>(batch));
        };
        DeliveryQueue<TestItem> queue = DeliveryQueue.builder("summaries", slowTransmitter)
                .rules(RULES)
                .retryPolicy(RetryPolicy.builder().maxAttempts(1).build())
                .connectionRecorder(recorder)
                .flushIntervalMs(60_000)
                .capacity(1)
                .flushThreshold(1)
                .overflowStrategy(DeliveryQueue.OverflowStrategy.FLUSH_THEN_REJECT)
                .store(store)
                .taskExecutor(taskExecutor)
                .logger(logging.logger)
                .build();

        // the first item's delivery is held up by the transmitter
        assertTrue(queue.enqueue(new TestItem(1, "a")).isSuccess());
        assertTrue(TestUtil.awaitCondition(() -> queue.size() == 0, 5000));
        assertTrue(queue.enqueue(new TestItem(2, "b")).isSuccess());

        long start = System.nanoTime();
        CFResult<TestItem> result = queue.enqueue(new TestItem(3, "c"));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(result.isSuccess());
        assertTrue("enqueue took " + elapsedMillis + " ms", elapsedMillis < 500);

        releaseDelivery.countDown();
        List<Integer> delivered = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            delivered.addAll(ids(requireValue(transmitted, 5, TimeUnit.SECONDS, "delivery")));
        }
        assertEquals(Arrays.asList(1, 2, 3), delivered);
    }

    @Test
    public void itemsWaitingForRoomAreRejectedOnceTheWaitingListIsFull() {
        CountDownLatch releaseDelivery = new CountDownLatch(1);
        DeliveryQueue.Transmitter<TestItem> slowTransmitter = batch -> {
            try {
                releaseDelivery.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            transmitted.add(new ArrayList<>(batch));
        };
        DeliveryQueue<TestItem> queue = DeliveryQueue.builder("summaries", slowTransmitter)
                .rules(RULES)
                .retryPolicy(RetryPolicy.builder().maxAttempts(1).build())
                .connectionRecorder(recorder)
                .flushIntervalMs(60_000)
                .capacity(1)
                .flushThreshold(1)
                .overflowStrategy(DeliveryQueue.OverflowStrategy.FLUSH_THEN_REJECT)
                .store(store)
                .taskExecutor(taskExecutor)
                .logger(logging.logger)
                .build();
        try {
            assertTrue(queue.enqueue(new TestItem(1, "a")).isSuccess());
            assertTrue(TestUtil.awaitCondition(() -> queue.size() == 0, 5000));
            assertTrue(queue.enqueue(new TestItem(2, "b")).isSuccess());
            assertTrue(queue.enqueue(new TestItem(3, "c")).isSuccess());

            CFResult<TestItem> rejected = queue.enqueue(new TestItem(4, "d"));
            assertFalse(rejected.isSuccess());
            assertEquals(CFFailure.FailureType.QUEUE_FULL, rejected.getError().getFailureType());
        } finally {
            releaseDelivery.countDown();
        }
    }

    @Test
    public void duplicateKeysAreIgnored() {
        DeliveryQueue<TestItem> queue = queueBuilder("summaries").capacity(10).flushThreshold(10).build();
        assertTrue(queue.enqueue(new TestItem(1, "exp-1")).isSuccess());
        assertTrue(queue.enqueue(new TestItem(2, "exp-1")).isSuccess());
        assertTrue(queue.enqueue(new TestItem(3, "exp-2")).isSuccess());
        assertEquals(2, queue.size());

        assertEquals(2, queue.flush());
        assertEquals(Arrays.asList(1, 3), ids(requireValue(transmitted, 1, TimeUnit.SECONDS, "flush")));

        // keys stay remembered after a flush
        assertTrue(queue.enqueue(new TestItem(4, "exp-1")).isSuccess());
        assertEquals(0, queue.size());
    }

    @Test
    public void invalidItemIsRejected() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").build();
        CFResult<TestItem> result = queue.enqueue(new TestItem(-1, null));
        assertFalse(result.isSuccess());
        assertEquals(CFFailure.FailureType.VALIDATION_ERROR, result.getError().getFailureType());
        assertEquals(0, queue.size());
        logging.assertWarnLogged("id must not be negative");
    }

    @Test
    public void failedDeliveryRequeuesBatchInOrder() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").capacity(10).flushThreshold(10).build();
        for (int i = 1; i <= 3; i++) {
            queue.enqueue(new TestItem(i, null));
        }
        failDelivery.set(true);
        assertEquals(0, queue.flush());
        assertEquals(3, queue.size());
        assertEquals(1, connectionFailures.get());

        queue.enqueue(new TestItem(4, null));
        failDelivery.set(false);
        assertEquals(4, queue.flush());
        assertEquals(Arrays.asList(1, 2, 3, 4), ids(requireValue(transmitted, 1, TimeUnit.SECONDS, "flush")));
        assertEquals(1, connectionSuccesses.get());
    }

    @Test
    public void requeueOverflowIsReportedAsDropped() {
        AtomicReference<DeliveryQueue<TestItem>> self = new AtomicReference<>();
        DeliveryQueue<TestItem> queue = DeliveryQueue.builder("events", (DeliveryQueue.Transmitter<TestItem>) batch -> {
            // new items arrive while the batch is in flight, leaving room for only part of it
            self.get().enqueue(new TestItem(10, null));
            self.get().enqueue(new TestItem(11, null));
            throw new CFFailure("down", CFFailure.FailureType.NETWORK_FAILURE);
        }).rules(RULES).retryPolicy(RetryPolicy.builder().maxAttempts(1).build()).capacity(3)
                .store(store).taskExecutor(taskExecutor).logger(logging.logger).build();
        self.set(queue);
        BlockingQueue<List<TestItem>> dropped = new LinkedBlockingQueue<>();
        queue.addDropListener((name, items) -> dropped.add(items));
        queue.enqueue(new TestItem(1, null));
        queue.enqueue(new TestItem(2, null));

        assertEquals(0, queue.flush());
        assertEquals(3, queue.size());
        assertEquals(1, queue.getDroppedCount());
        assertEquals(Arrays.asList(1), ids(requireValue(dropped, 1, TimeUnit.SECONDS, "drop")));
        logging.assertWarnLogged("could not be re-queued");
    }

    @Test
    public void offlineItemsArePersistedAndRestored() {
        DeliveryQueue<TestItem> first = queueBuilder("events").capacity(10).flushThreshold(10).offline(true).build();
        for (int i = 1; i <= 3; i++) {
            first.enqueue(new TestItem(i, null));
        }
        assertEquals(0, first.flush());
        assertNotNull(store.getQueuedItems("events"));
        requireNoMoreValues(transmitted, 100, TimeUnit.MILLISECONDS, "flush while offline");

        DeliveryQueue<TestItem> second = queueBuilder("events").capacity(10).flushThreshold(10).build();
        assertEquals(3, second.restorePersisted());
        assertNull(store.getQueuedItems("events"));
        assertEquals(3, second.flush());
        assertEquals(Arrays.asList(1, 2, 3), ids(requireValue(transmitted, 1, TimeUnit.SECONDS, "flush")));
    }

    @Test
    public void restoreKeepsOnlyNewestStoredItems() {
        DeliveryQueue<TestItem> first = queueBuilder("events").capacity(10).maxStoredItems(10).offline(true).build();
        for (int i = 1; i <= 5; i++) {
            first.enqueue(new TestItem(i, null));
        }
        first.close();

        DeliveryQueue<TestItem> second = queueBuilder("events").capacity(10).maxStoredItems(2).build();
        assertEquals(2, second.restorePersisted());
        second.flush();
        assertEquals(Arrays.asList(4, 5), ids(requireValue(transmitted, 1, TimeUnit.SECONDS, "flush")));
    }

    @Test
    public void goingOnlineFlushes() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").capacity(10).flushThreshold(10).offline(true).build();
        queue.enqueue(new TestItem(1, null));
        queue.setOffline(false);
        assertEquals(Arrays.asList(1), ids(requireValue(transmitted, 5, TimeUnit.SECONDS, "flush")));
        assertTrue(TestUtil.awaitCondition(() -> store.getQueuedItems("events") == null, 5000));
    }

    @Test
    public void precedingQueueIsFlushedFirst() {
        List<String> order = new CopyOnWriteArrayList<>();
        DeliveryQueue<TestItem> summaries = DeliveryQueue.builder("summaries",
                        (DeliveryQueue.Transmitter<TestItem>) batch -> order.add("summaries"))
                .rules(RULES).store(store).taskExecutor(taskExecutor).build();
        DeliveryQueue<TestItem> events = DeliveryQueue.builder("events",
                        (DeliveryQueue.Transmitter<TestItem>) batch -> order.add("events"))
                .rules(RULES).precedingQueue(summaries).store(store).taskExecutor(taskExecutor).build();
        summaries.enqueue(new TestItem(1, "s"));
        events.enqueue(new TestItem(2, null));

        assertEquals(1, events.flush());
        assertEquals(Arrays.asList("summaries", "events"), order);
    }

    @Test
    public void timerFlushesItemsOlderThanMaximumAge() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").capacity(10).flushThreshold(10)
                .flushIntervalMs(20).maxItemAgeMs(0).build();
        queue.start();
        queue.enqueue(new TestItem(1, null));
        assertEquals(Arrays.asList(1), ids(requireValue(transmitted, 5, TimeUnit.SECONDS, "timer flush")));
        queue.close();
    }

    @Test
    public void timerWaitsForItemsToReachMaximumAge() {
        TestClock clock = new TestClock(0);
        DeliveryQueue<TestItem> queue = queueBuilder("events").capacity(10).flushThreshold(10)
                .flushIntervalMs(20).maxItemAgeMs(60_000).clock(clock).build();
        queue.start();
        queue.enqueue(new TestItem(1, null));
        requireNoMoreValues(transmitted, 200, TimeUnit.MILLISECONDS, "early flush");

        clock.advance(60_000);
        assertEquals(Arrays.asList(1), ids(requireValue(transmitted, 5, TimeUnit.SECONDS, "timer flush")));
        queue.close();
    }

    @Test
    public void updateFlushIntervalReplacesTimer() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").capacity(10).flushThreshold(10)
                .flushIntervalMs(60_000).build();
        queue.start();
        queue.enqueue(new TestItem(1, null));
        requireNoMoreValues(transmitted, 100, TimeUnit.MILLISECONDS, "flush");

        queue.updateFlushInterval(20);
        assertEquals(20, queue.getFlushIntervalMs());
        assertEquals(Arrays.asList(1), ids(requireValue(transmitted, 5, TimeUnit.SECONDS, "timer flush")));
        queue.close();
    }

    @Test
    public void closeDeliversEverythingInBatches() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").capacity(300).flushThreshold(300)
                .batchSize(100).build();
        for (int i = 1; i <= 250; i++) {
            queue.enqueue(new TestItem(i, null));
        }
        queue.close();
        assertEquals(100, requireValue(transmitted, 1, TimeUnit.SECONDS, "batch").size());
        assertEquals(100, requireValue(transmitted, 1, TimeUnit.SECONDS, "batch").size());
        assertEquals(50, requireValue(transmitted, 1, TimeUnit.SECONDS, "batch").size());
        assertEquals(0, queue.size());
    }

    @Test
    public void closeWhileOfflinePersists() {
        DeliveryQueue<TestItem> queue = queueBuilder("events").offline(true).build();
        queue.enqueue(new TestItem(1, null));
        queue.close();
        assertNotNull(store.getQueuedItems("events"));
    }
}
