package ai.customfit.sdk;

import java.io.Closeable;

/**
 * The host signals that the SDK reacts to. None of them are owned by the SDK: the application
 * reports them, and the SDK only adjusts its scheduling in response.
 */
interface PlatformState extends Closeable {
    interface ConnectivityChangeListener {
        void onConnectivityChanged(boolean networkAvailable);
    }

    interface ForegroundChangeListener {
        void onForegroundChanged(boolean foreground);
    }

    interface BatteryChangeListener {
        void onBatteryChanged(boolean batteryLow);
    }

    /**
     * Returns true if (as far as the host knows) the network should be working.
     * @return true if the network should be available
     */
    boolean isNetworkAvailable();

    /**
     * Registers a listener to be called if the state of {@link #isNetworkAvailable()} changes.
     * @param listener a listener
     */
    void addConnectivityChangeListener(ConnectivityChangeListener listener);

    /**
     * Undoes the effect of {@link #addConnectivityChangeListener(ConnectivityChangeListener)}. Has
     * no effect if no such listener is registered.
     * @param listener a listener
     */
    void removeConnectivityChangeListener(ConnectivityChangeListener listener);

    /**
     * Returns true if we believe the application is in the foreground, false if we believe it is in
     * the background.
     * @return true if in the foreground
     */
    boolean isForeground();

    /**
     * Registers a listener to be called if the state of {@link #isForeground()} changes.
     * @param listener a listener
     */
    void addForegroundChangeListener(ForegroundChangeListener listener);

    /**
     * Undoes the effect of {@link #addForegroundChangeListener(ForegroundChangeListener)}.
     * @param listener a listener
     */
    void removeForegroundChangeListener(ForegroundChangeListener listener);

    /**
     * Returns true if the device reports a low battery and is not charging.
     * @return true if power should be conserved
     */
    boolean isBatteryLow();

    void addBatteryChangeListener(BatteryChangeListener listener);

    void removeBatteryChangeListener(BatteryChangeListener listener);
}
