package ai.customfit.sdk;

import ai.customfit.sdk.subsystems.Callback;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class AwaitableCallback<T> implements Callback<T> {
    private volatile Throwable errResult = null;
    private volatile T result = null;
    private final CountDownLatch signal = new CountDownLatch(1);

    @Override
    public void onSuccess(T result) {
        this.result = result;
        signal.countDown();
    }

    @Override
    public void onError(Throwable e) {
        errResult = e;
        signal.countDown();
    }

    public T await(long timeoutMillis) throws ExecutionException, TimeoutException {
        try {
            boolean completed = signal.await(timeoutMillis, TimeUnit.MILLISECONDS);
            if (!completed) {
                throw new TimeoutException();
            }
        } catch (InterruptedException e) {
            throw new ExecutionException(e);
        }
        if (errResult != null) {
            throw new ExecutionException(errResult);
        }
        return result;
    }
}
