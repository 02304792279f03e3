package ai.customfit.sdk;

import java.io.Closeable;

/**
 * A handle returned by every listener registration method. Closing it unregisters the listener;
 * closing it more than once has no further effect.
 */
@FunctionalInterface
public interface Subscription extends Closeable {
    /**
     * Unregisters the listener.
     */
    @Override
    void close();
}
