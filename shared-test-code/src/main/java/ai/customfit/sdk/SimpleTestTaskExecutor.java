package ai.customfit.sdk;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * An implementation of {@link TaskExecutor} for unit tests. Unlike {@link DefaultTaskExecutor} it
 * does not catch errors thrown by tasks, and it lets tests check which thread a callback ran on.
 */
public class SimpleTestTaskExecutor implements TaskExecutor {
    private static final ThreadLocal<Boolean> callbackThread = new ThreadLocal<>();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService workers = Executors.newCachedThreadPool();
    private final ExecutorService callbacks = Executors.newSingleThreadExecutor();

    @Override
    public void executeCallback(Runnable action) {
        callbacks.execute(() -> {
            callbackThread.set(true);
            action.run();
        });
    }

    @Override
    public <T> Future<T> submitTask(Callable<T> task) {
        return workers.submit(task);
    }

    @Override
    public ScheduledFuture<?> scheduleTask(Runnable action, long delayMillis) {
        return scheduler.schedule(() -> workers.execute(action), delayMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public ScheduledFuture<?> startRepeatingTask(Runnable action, long initialDelayMillis, long intervalMillis) {
        return scheduler.scheduleAtFixedRate(() -> workers.execute(action),
                initialDelayMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        workers.shutdownNow();
        callbacks.shutdownNow();
    }

    public boolean isThisTheCallbackThread() {
        return Boolean.TRUE.equals(callbackThread.get());
    }
}
