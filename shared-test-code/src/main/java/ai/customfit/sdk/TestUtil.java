package ai.customfit.sdk;

import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import com.launchdarkly.logging.LDLogger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

public class TestUtil {
    public static final String CLIENT_KEY = "test-client-key";
    // a JWT whose payload carries dimension_id "dim-1"
    public static final String DIMENSION_CLIENT_KEY =
            "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9.eyJkaW1lbnNpb25faWQiOiJkaW0tMSIsImFjY291bnRfaWQiOiJhY2N0LTEifQ.sig";

    public static <T> T requireValue(BlockingQueue<T> queue, long timeout, TimeUnit timeoutUnit, String description) {
        try {
            T value = queue.poll(timeout, timeoutUnit);
            assertNotNull("timed out waiting for " + description, value);
            return value;
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

    public static <T> void requireNoMoreValues(BlockingQueue<T> queue, long timeout, TimeUnit timeoutUnit, String description) {
        try {
            T value = queue.poll(timeout, timeoutUnit);
            assertNull("received unexpected " + description, value);
        } catch (InterruptedException e) {
            throw new RuntimeException(e);
        }
    }

    public static PersistentDataStoreWrapper makeSimplePersistentDataStoreWrapper() {
        return new PersistentDataStoreWrapper(new InMemoryPersistentDataStore(), CLIENT_KEY, LDLogger.none());
    }

    /**
     * Polls a condition until it holds or the timeout passes.
     */
    public static boolean awaitCondition(BooleanSupplier condition, long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        }
        return condition.getAsBoolean();
    }
}
