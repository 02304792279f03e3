package ai.customfit.sdk;

import com.launchdarkly.logging.LDLogger;

import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Standard implementation of {@link TaskExecutor}. Besides enforcing correct thread usage, this
 * class also ensures that any unchecked exceptions thrown by asynchronous tasks are caught and
 * logged.
 * <p>
 * Scheduled tasks run on a small scheduler pool only long enough to hand the real work to the
 * worker pool, so a task that blocks on the network never holds up other timers.
 */
final class DefaultTaskExecutor implements TaskExecutor {
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final ExecutorService callbacks;
    private final LDLogger logger;

    DefaultTaskExecutor(LDLogger logger) {
        this.logger = logger;
        this.scheduler = Executors.newScheduledThreadPool(1, threadFactory("CustomFit-Scheduler-%d"));
        this.workers = Executors.newCachedThreadPool(threadFactory("CustomFit-Worker-%d"));
        this.callbacks = Executors.newSingleThreadExecutor(threadFactory("CustomFit-Callback-%d"));
    }

    @Override
    public void executeCallback(Runnable action) {
        callbacks.execute(wrapActionWithErrorHandling(action));
    }

    @Override
    public <T> Future<T> submitTask(Callable<T> task) {
        return workers.submit(task);
    }

    @Override
    public ScheduledFuture<?> scheduleTask(Runnable action, long delayMillis) {
        return scheduler.schedule(handOffToWorkers(action), delayMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public ScheduledFuture<?> startRepeatingTask(Runnable action, long initialDelayMillis, long intervalMillis) {
        return scheduler.scheduleAtFixedRate(handOffToWorkers(action),
                initialDelayMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        workers.shutdownNow();
        callbacks.shutdown();
    }

    private Runnable handOffToWorkers(Runnable action) {
        Runnable wrapped = wrapActionWithErrorHandling(action);
        return () -> {
            if (!workers.isShutdown()) {
                workers.execute(wrapped);
            }
        };
    }

    private Runnable wrapActionWithErrorHandling(Runnable action) {
        return () -> callActionWithErrorHandling(action);
    }

    private void callActionWithErrorHandling(Runnable action) {
        try {
            if (action != null) {
                action.run();
            }
        } catch (RuntimeException e) {
            CFUtil.logExceptionAtErrorLevel(logger, e, "Unexpected exception from asynchronous task");
        }
    }

    private static ThreadFactory threadFactory(String nameFormat) {
        return new ThreadFactory() {
            final AtomicLong count = new AtomicLong(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = Executors.defaultThreadFactory().newThread(r);
                thread.setName(String.format(Locale.ROOT, nameFormat, count.getAndIncrement()));
                thread.setDaemon(true);
                return thread;
            }
        };
    }
}
