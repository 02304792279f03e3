package ai.customfit.sdk;

import com.google.gson.JsonParseException;
import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * A bounded buffer of analytics items with a flush engine that delivers them in batches.
 * <p>
 * Items are flushed when the queue reaches its threshold, when the periodic timer finds an item
 * that has waited long enough, when the network comes back, and on {@link #close()}. A flush
 * drains at most one batch, in enqueue order, and hands it to the {@link Transmitter} under the
 * configured {@link RetryPolicy}. If delivery fails, the batch goes back to the head of the queue
 * as far as capacity allows; whatever does not fit is reported to the drop listeners.
 * <p>
 * While offline, flushes do not drain anything. The items stay queued, capped at
 * {@code maxStoredItems}, and are written to the persistent store so that
 * {@link #restorePersisted()} can bring them back after a restart.
 * <p>
 * Queue contents are guarded by one lock. Network I/O happens outside it, and listeners are
 * called on the callback thread.
 *
 * @param <T> the item type
 */
final class DeliveryQueue<T extends QueueItem> implements Closeable {
    /**
     * What {@link #enqueue(QueueItem)} does when the queue is full.
     */
    enum OverflowStrategy {
        /**
         * Evict the oldest items to make room, and report them to the drop listeners.
         */
        DROP_OLDEST,
        /**
         * Flush on a worker thread and add the new item once there is room. While offline, or
         * when too many items are already waiting for that flush, the new item is rejected
         * immediately. Items that still do not fit after the flush are reported to the drop
         * listeners.
         */
        FLUSH_THEN_REJECT
    }

    /**
     * Sends one batch to the server.
     */
    interface Transmitter<T> {
        void transmit(List<T> batch) throws CFFailure;
    }

    /**
     * Item-kind specific behavior.
     */
    static final class ItemRules<T> {
        final Type listType;
        final Function<T, String> validator;
        final Function<T, String> dedupKey;

        /**
         * @param listType Gson type of a {@code List<T>}, used for offline persistence
         * @param validator returns an error message for an invalid item, or null if it is valid
         * @param dedupKey returns the deduplication key of an item, or null; may be null
         */
        ItemRules(Type listType, Function<T, String> validator, Function<T, String> dedupKey) {
            this.listType = listType;
            this.validator = validator;
            this.dedupKey = dedupKey;
        }
    }

    static final int DEFAULT_BATCH_SIZE = 100;

    private static final class Entry<T> {
        final T item;
        final long enqueuedAt;

        Entry(T item, long enqueuedAt) {
            this.item = item;
            this.enqueuedAt = enqueuedAt;
        }
    }

    private final String name;
    private final Transmitter<T> transmitter;
    private final int capacity;
    private final int flushThreshold;
    private final int batchSize;
    private volatile long maxItemAgeMs;
    private final int maxStoredItems;
    private final OverflowStrategy overflowStrategy;
    private final ItemRules<T> rules;
    private final RetryPolicy retryPolicy;
    private final DeliveryQueue<?> precedingQueue;
    private final ConnectionRecorder connectionRecorder;
    private final PersistentDataStoreWrapper store;
    private final TaskExecutor taskExecutor;
    private final Clock clock;
    private final LDLogger logger;

    private final Object lock = new Object();
    private final ArrayDeque<Entry<T>> items = new ArrayDeque<>();
    private final Set<String> seenKeys = new HashSet<>();
    private final Object flushLock = new Object();
    private final Object timerLock = new Object();
    private final AtomicBoolean flushScheduled = new AtomicBoolean(false);
    private final AtomicLong droppedCount = new AtomicLong();
    private final CopyOnWriteArrayList<QueueItemDroppedListener<T>> dropListeners = new CopyOnWriteArrayList<>();

    private volatile boolean offline;
    private volatile boolean closed;
    private final List<Entry<T>> awaitingRoom = new ArrayList<>();
    private final AtomicBoolean overflowFlushScheduled = new AtomicBoolean();
    private volatile boolean hasPersistedCopy;
    private long flushIntervalMs;
    private ScheduledFuture<?> timer;

    private DeliveryQueue(Builder<T> builder) {
        this.name = builder.name;
        this.transmitter = builder.transmitter;
        this.capacity = builder.capacity;
        this.flushThreshold = Math.min(builder.flushThreshold, builder.capacity);
        this.batchSize = builder.batchSize;
        this.flushIntervalMs = builder.flushIntervalMs;
        this.maxItemAgeMs = builder.maxItemAgeMs;
        this.maxStoredItems = builder.maxStoredItems;
        this.overflowStrategy = builder.overflowStrategy;
        this.rules = builder.rules;
        this.retryPolicy = builder.retryPolicy;
        this.precedingQueue = builder.precedingQueue;
        this.connectionRecorder = builder.connectionRecorder;
        this.store = builder.store;
        this.taskExecutor = builder.taskExecutor;
        this.clock = builder.clock;
        this.logger = builder.logger;
        this.offline = builder.offline;
    }

    static <T extends QueueItem> Builder<T> builder(String name, Transmitter<T> transmitter) {
        return new Builder<>(name, transmitter);
    }

    String getName() {
        return name;
    }

    /**
     * Adds an item.
     * <p>
     * An invalid item is rejected with {@link CFFailure.FailureType#VALIDATION_ERROR}. An item
     * whose deduplication key was already seen by this queue is ignored, and the result is still
     * a success. What happens when the queue is full depends on the {@link OverflowStrategy}.
     *
     * @param item the item
     * @return a success holding the item, or an error
     */
    CFResult<T> enqueue(T item) {
        String invalid = item == null ? "item is null" : rules.validator.apply(item);
        if (invalid != null) {
            logger.warn("Rejected {} item: {}", name, invalid);
            return CFResult.error(new CFFailure(invalid, CFFailure.FailureType.VALIDATION_ERROR));
        }
        String key = rules.dedupKey == null ? null : rules.dedupKey.apply(item);
        List<T> dropped = null;
        boolean full;
        synchronized (lock) {
            if (key != null && !seenKeys.add(key)) {
                logger.debug("Ignoring duplicate {} item with key {}", name, key);
                return CFResult.success(item);
            }
            full = items.size() >= effectiveCapacity();
            if (!full || overflowStrategy == OverflowStrategy.DROP_OLDEST) {
                dropped = evictForRoomLocked();
                items.addLast(new Entry<>(item, clock.millis()));
                full = false;
            }
        }
        if (full) {
            return offerAfterFlush(item, key);
        }
        notifyDropped(dropped);
        maybeTriggerThresholdFlush();
        return CFResult.success(item);
    }

    /**
     * Delivers up to one batch, after first flushing the preceding queue if there is one. Blocks
     * while the batch is transmitted, including retries.
     *
     * @return the number of items delivered
     */
    int flush() {
        if (precedingQueue != null) {
            precedingQueue.flush();
        }
        synchronized (flushLock) {
            if (offline) {
                persistItems();
                return 0;
            }
            List<Entry<T>> batch = new ArrayList<>();
            synchronized (lock) {
                while (batch.size() < batchSize && !items.isEmpty()) {
                    batch.add(items.pollFirst());
                }
            }
            if (batch.isEmpty()) {
                clearPersistedCopy();
                return 0;
            }
            List<T> values = new ArrayList<>(batch.size());
            for (Entry<T> e: batch) {
                values.add(e.item);
            }
            logger.debug("Flushing {} {} item(s)", values.size(), name);
            try {
                retryPolicy.execute(() -> {
                    transmitter.transmit(values);
                    return null;
                });
            } catch (CFFailure e) {
                CFUtil.logExceptionAtWarnLevel(logger, e, "Could not deliver {} {} item(s)", values.size(), name);
                connectionRecorder.recordConnectionFailure(e);
                requeue(batch);
                return 0;
            }
            connectionRecorder.recordConnectionSuccess();
            clearPersistedCopy();
            logger.debug("Delivered {} {} item(s)", values.size(), name);
            return values.size();
        }
    }

    Future<Integer> flushAsync() {
        return taskExecutor.submitTask(this::flush);
    }

    /**
     * Starts the periodic flush timer.
     */
    void start() {
        synchronized (timerLock) {
            if (closed || timer != null) {
                return;
            }
            timer = taskExecutor.startRepeatingTask(this::onTimer, flushIntervalMs, flushIntervalMs);
        }
    }

    /**
     * Replaces the flush timer with one running at a new interval. The old timer is always
     * cancelled before the new one starts.
     *
     * @param intervalMs the new interval; must be positive
     */
    void updateFlushInterval(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("flush interval must be positive");
        }
        synchronized (timerLock) {
            flushIntervalMs = intervalMs;
            if (timer == null || closed) {
                return;
            }
            timer.cancel(false);
            timer = taskExecutor.startRepeatingTask(this::onTimer, intervalMs, intervalMs);
        }
        logger.debug("{} flush interval is now {} ms", name, intervalMs);
    }

    /**
     * Changes how long an item may wait before the periodic timer delivers it.
     *
     * @param maxItemAgeMs the maximum wait; zero means every tick flushes
     */
    void updateMaxItemAge(long maxItemAgeMs) {
        if (maxItemAgeMs < 0) {
            throw new IllegalArgumentException("maximum item age must not be negative");
        }
        this.maxItemAgeMs = maxItemAgeMs;
    }

    long getFlushIntervalMs() {
        synchronized (timerLock) {
            return flushIntervalMs;
        }
    }

    /**
     * Switches between online and offline delivery. Going offline persists the current items;
     * coming back online starts a flush.
     *
     * @param offline true if items cannot be delivered
     */
    void setOffline(boolean offline) {
        boolean wasOffline = this.offline;
        this.offline = offline;
        if (offline && !wasOffline) {
            synchronized (flushLock) {
                persistItems();
            }
        } else if (!offline && wasOffline) {
            logger.debug("{} queue is back online; flushing", name);
            flushAsync();
        }
    }

    boolean isOffline() {
        return offline;
    }

    int size() {
        synchronized (lock) {
            return items.size();
        }
    }

    long getDroppedCount() {
        return droppedCount.get();
    }

    Subscription addDropListener(QueueItemDroppedListener<T> listener) {
        dropListeners.add(listener);
        return () -> dropListeners.remove(listener);
    }

    /**
     * Loads items persisted while offline by a previous run, and queues them again. Only the
     * newest {@code maxStoredItems} are kept. The persisted copy is removed.
     *
     * @return the number of items restored
     */
    int restorePersisted() {
        String json = store.getQueuedItems(name);
        if (json == null) {
            return 0;
        }
        store.setQueuedItems(name, null);
        List<T> restored;
        try {
            restored = GsonCache.getGson().fromJson(json, rules.listType);
        } catch (JsonParseException e) {
            CFUtil.logExceptionAtWarnLevel(logger, e, "Discarding unreadable persisted {} items", name);
            return 0;
        }
        if (restored == null || restored.isEmpty()) {
            return 0;
        }
        if (restored.size() > maxStoredItems) {
            restored = restored.subList(restored.size() - maxStoredItems, restored.size());
        }
        int count = 0;
        for (T item: restored) {
            if (enqueue(item).isSuccess()) {
                count++;
            }
        }
        logger.info("Restored {} persisted {} item(s)", count, name);
        if (offline) {
            synchronized (flushLock) {
                persistItems();
            }
        }
        return count;
    }

    /**
     * Stops the timer, then delivers everything still queued if online, or persists it if not.
     */
    @Override
    public void close() {
        synchronized (timerLock) {
            closed = true;
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
        }
        admitAwaitingItems();
        if (offline) {
            synchronized (flushLock) {
                persistItems();
            }
            return;
        }
        while (size() > 0) {
            if (flush() == 0) {
                break;
            }
        }
        if (size() > 0) {
            synchronized (flushLock) {
                persistItems();
            }
        }
    }

    private void onTimer() {
        if (closed) {
            return;
        }
        Entry<T> oldest;
        synchronized (lock) {
            oldest = items.peekFirst();
        }
        if (oldest == null && (precedingQueue == null || precedingQueue.size() == 0)) {
            return;
        }
        if (oldest == null || clock.millis() - oldest.enqueuedAt >= maxItemAgeMs) {
            flush();
        }
    }

    private int effectiveCapacity() {
        return offline ? Math.min(capacity, maxStoredItems) : capacity;
    }

    private List<T> evictForRoomLocked() {
        List<T> dropped = null;
        while (items.size() >= effectiveCapacity() && !items.isEmpty()) {
            if (dropped == null) {
                dropped = new ArrayList<>();
            }
            dropped.add(items.pollFirst().item);
        }
        return dropped;
    }

    private void maybeTriggerThresholdFlush() {
        if (size() < flushThreshold || offline) {
            return;
        }
        if (flushScheduled.compareAndSet(false, true)) {
            logger.debug("{} queue reached {} items; flushing", name, flushThreshold);
            taskExecutor.submitTask(() -> {
                try {
                    return flush();
                } finally {
                    flushScheduled.set(false);
                }
            });
        }
    }

    // FLUSH_THEN_REJECT when full: never flushes on the caller's thread
    private CFResult<T> offerAfterFlush(T item, String key) {
        boolean accepted = false;
        synchronized (lock) {
            if (!offline && awaitingRoom.size() < capacity) {
                awaitingRoom.add(new Entry<>(item, clock.millis()));
                accepted = true;
            } else if (key != null) {
                seenKeys.remove(key);
            }
        }
        if (!accepted) {
            logger.warn("{} queue is full; item rejected", name);
            return CFResult.error(new CFFailure("The " + name + " queue is full",
                    CFFailure.FailureType.QUEUE_FULL));
        }
        if (overflowFlushScheduled.compareAndSet(false, true)) {
            logger.debug("{} queue is full; flushing before adding waiting items", name);
            taskExecutor.submitTask(() -> {
                try {
                    flush();
                } finally {
                    overflowFlushScheduled.set(false);
                }
                admitAwaitingItems();
                if (!offline && size() >= flushThreshold) {
                    flush();
                }
                return null;
            });
        }
        return CFResult.success(item);
    }

    private void admitAwaitingItems() {
        List<T> rejected = new ArrayList<>();
        synchronized (lock) {
            for (Entry<T> e: awaitingRoom) {
                if (items.size() < effectiveCapacity()) {
                    items.addLast(e);
                } else {
                    rejected.add(e.item);
                    if (rules.dedupKey != null) {
                        seenKeys.remove(rules.dedupKey.apply(e.item));
                    }
                }
            }
            awaitingRoom.clear();
        }
        if (!rejected.isEmpty()) {
            logger.warn("{} queue is still full after flush; {} item(s) rejected", name, rejected.size());
        }
        notifyDropped(rejected);
    }

    private void requeue(List<Entry<T>> batch) {
        List<T> dropped = new ArrayList<>();
        synchronized (lock) {
            for (int i = batch.size() - 1; i >= 0; i--) {
                Entry<T> e = batch.get(i);
                if (items.size() < effectiveCapacity()) {
                    items.addFirst(e);
                } else {
                    dropped.add(e.item);
                }
            }
        }
        Collections.reverse(dropped);
        if (!dropped.isEmpty()) {
            logger.warn("{} {} item(s) could not be re-queued after a failed delivery", dropped.size(), name);
        }
        notifyDropped(dropped);
    }

    private void notifyDropped(List<T> dropped) {
        if (dropped == null || dropped.isEmpty()) {
            return;
        }
        droppedCount.addAndGet(dropped.size());
        logger.debug("Dropped {} {} item(s)", dropped.size(), name);
        List<T> copy = Collections.unmodifiableList(new ArrayList<>(dropped));
        for (QueueItemDroppedListener<T> listener: dropListeners) {
            taskExecutor.executeCallback(() -> listener.onItemsDropped(name, copy));
        }
    }

    // must be called with flushLock held
    private void persistItems() {
        List<T> snapshot = new ArrayList<>();
        List<T> dropped = new ArrayList<>();
        synchronized (lock) {
            while (items.size() > maxStoredItems) {
                dropped.add(items.pollFirst().item);
            }
            for (Iterator<Entry<T>> it = items.iterator(); it.hasNext(); ) {
                snapshot.add(it.next().item);
            }
        }
        notifyDropped(dropped);
        if (snapshot.isEmpty()) {
            clearPersistedCopy();
            return;
        }
        store.setQueuedItems(name, GsonCache.getGson().toJson(snapshot, rules.listType));
        hasPersistedCopy = true;
    }

    private void clearPersistedCopy() {
        if (hasPersistedCopy) {
            store.setQueuedItems(name, null);
            hasPersistedCopy = false;
        }
    }

    static final class Builder<T extends QueueItem> {
        private final String name;
        private final Transmitter<T> transmitter;
        private int capacity = 100;
        private int flushThreshold = 100;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private long flushIntervalMs = 1000;
        private long maxItemAgeMs = 0;
        private int maxStoredItems = 100;
        private OverflowStrategy overflowStrategy = OverflowStrategy.DROP_OLDEST;
        private ItemRules<T> rules;
        private RetryPolicy retryPolicy = RetryPolicy.builder().build();
        private DeliveryQueue<?> precedingQueue;
        private ConnectionRecorder connectionRecorder = ConnectionRecorder.NONE;
        private PersistentDataStoreWrapper store;
        private TaskExecutor taskExecutor;
        private Clock clock = Clock.SYSTEM;
        private LDLogger logger = LDLogger.none();
        private boolean offline;

        private Builder(String name, Transmitter<T> transmitter) {
            this.name = name;
            this.transmitter = transmitter;
        }

        Builder<T> capacity(int capacity) {
            if (capacity < 1) {
                throw new IllegalArgumentException("capacity must be at least 1");
            }
            this.capacity = capacity;
            return this;
        }

        Builder<T> flushThreshold(int flushThreshold) {
            this.flushThreshold = Math.max(1, flushThreshold);
            return this;
        }

        Builder<T> batchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
            return this;
        }

        Builder<T> flushIntervalMs(long flushIntervalMs) {
            if (flushIntervalMs <= 0) {
                throw new IllegalArgumentException("flush interval must be positive");
            }
            this.flushIntervalMs = flushIntervalMs;
            return this;
        }

        Builder<T> maxItemAgeMs(long maxItemAgeMs) {
            this.maxItemAgeMs = Math.max(0, maxItemAgeMs);
            return this;
        }

        Builder<T> maxStoredItems(int maxStoredItems) {
            this.maxStoredItems = Math.max(1, maxStoredItems);
            return this;
        }

        Builder<T> overflowStrategy(OverflowStrategy overflowStrategy) {
            this.overflowStrategy = overflowStrategy;
            return this;
        }

        Builder<T> rules(ItemRules<T> rules) {
            this.rules = rules;
            return this;
        }

        Builder<T> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        Builder<T> precedingQueue(DeliveryQueue<?> precedingQueue) {
            this.precedingQueue = precedingQueue;
            return this;
        }

        Builder<T> connectionRecorder(ConnectionRecorder connectionRecorder) {
            this.connectionRecorder = connectionRecorder == null ? ConnectionRecorder.NONE : connectionRecorder;
            return this;
        }

        Builder<T> store(PersistentDataStoreWrapper store) {
            this.store = store;
            return this;
        }

        Builder<T> taskExecutor(TaskExecutor taskExecutor) {
            this.taskExecutor = taskExecutor;
            return this;
        }

        Builder<T> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        Builder<T> logger(LDLogger logger) {
            this.logger = logger;
            return this;
        }

        Builder<T> offline(boolean offline) {
            this.offline = offline;
            return this;
        }

        DeliveryQueue<T> build() {
            if (rules == null || store == null || taskExecutor == null) {
                throw new IllegalStateException("rules, store and taskExecutor are required");
            }
            return new DeliveryQueue<>(this);
        }
    }
}
