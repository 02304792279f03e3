package ai.customfit.sdk;

import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link Clock} that only moves when a test tells it to.
 */
public class TestClock implements Clock {
    private final AtomicLong now;

    public TestClock(long start) {
        this.now = new AtomicLong(start);
    }

    @Override
    public long millis() {
        return now.get();
    }

    public void advance(long millis) {
        now.addAndGet(millis);
    }

    public void set(long millis) {
        now.set(millis);
    }
}
