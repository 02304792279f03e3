package ai.customfit.sdk;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Internal abstraction for standardizing how asynchronous tasks are executed.
 */
interface TaskExecutor extends Closeable {
    /**
     * Causes an action to be performed on the callback thread. We use this when we are calling
     * application-provided listeners, so that listeners are never called while an SDK lock is
     * held and are called in the order in which notifications were generated.
     *
     * @param action the action to execute
     */
    void executeCallback(Runnable action);

    /**
     * Runs a task on a worker thread as soon as possible. Worker tasks may block on network I/O;
     * they never delay one another.
     *
     * @param task the task to execute
     * @param <T> the result type
     * @return a Future for the task's result
     */
    <T> Future<T> submitTask(Callable<T> task);

    /**
     * Schedules an action to be done asynchronously by a worker. It will not be done on the
     * callback thread. There are no guarantees as to ordering with other tasks.
     *
     * @param action the action to execute
     * @param delayMillis minimum milliseconds to wait before executing
     * @return a ScheduledFuture that can be used to cancel the task
     */
    ScheduledFuture<?> scheduleTask(Runnable action, long delayMillis);

    /**
     * Schedules an action to be run repeatedly at intervals. It will not be done on the callback
     * thread.
     *
     * @param action the action to execute at each interval
     * @param initialDelayMillis milliseconds to wait before the first execution
     * @param intervalMillis milliseconds between executions
     * @return a ScheduledFuture that can be used to cancel the task
     */
    ScheduledFuture<?> startRepeatingTask(Runnable action, long initialDelayMillis, long intervalMillis);
}
