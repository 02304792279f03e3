package ai.customfit.sdk;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link PlatformState} for a plain JVM host. There is no operating system lifecycle to observe,
 * so the application reports state changes through {@link CFClient#getPlatformSignals()}. The
 * initial state is: network available, in the foreground, battery not low.
 */
public final class DefaultPlatformState implements PlatformState {
    private final CopyOnWriteArrayList<ConnectivityChangeListener> connectivityChangeListeners =
            new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<ForegroundChangeListener> foregroundChangeListeners =
            new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<BatteryChangeListener> batteryChangeListeners =
            new CopyOnWriteArrayList<>();

    private volatile boolean networkAvailable = true;
    private volatile boolean foreground = true;
    private volatile boolean batteryLow = false;

    DefaultPlatformState() {
    }

    /**
     * Reports a change in network reachability.
     *
     * @param networkAvailable true if the network is reachable
     */
    public void setNetworkAvailable(boolean networkAvailable) {
        if (this.networkAvailable == networkAvailable) {
            return;
        }
        this.networkAvailable = networkAvailable;
        for (ConnectivityChangeListener listener: connectivityChangeListeners) {
            listener.onConnectivityChanged(networkAvailable);
        }
    }

    /**
     * Reports that the application moved to the foreground or the background.
     *
     * @param foreground true if the application is now in the foreground
     */
    public void setForeground(boolean foreground) {
        if (this.foreground == foreground) {
            return;
        }
        this.foreground = foreground;
        for (ForegroundChangeListener listener: foregroundChangeListeners) {
            listener.onForegroundChanged(foreground);
        }
    }

    /**
     * Reports a change in battery state.
     *
     * @param batteryLow true if the battery is low and not charging
     */
    public void setBatteryLow(boolean batteryLow) {
        if (this.batteryLow == batteryLow) {
            return;
        }
        this.batteryLow = batteryLow;
        for (BatteryChangeListener listener: batteryChangeListeners) {
            listener.onBatteryChanged(batteryLow);
        }
    }

    @Override
    public boolean isNetworkAvailable() {
        return networkAvailable;
    }

    @Override
    public void addConnectivityChangeListener(ConnectivityChangeListener listener) {
        connectivityChangeListeners.add(listener);
    }

    @Override
    public void removeConnectivityChangeListener(ConnectivityChangeListener listener) {
        connectivityChangeListeners.remove(listener);
    }

    @Override
    public boolean isForeground() {
        return foreground;
    }

    @Override
    public void addForegroundChangeListener(ForegroundChangeListener listener) {
        foregroundChangeListeners.add(listener);
    }

    @Override
    public void removeForegroundChangeListener(ForegroundChangeListener listener) {
        foregroundChangeListeners.remove(listener);
    }

    @Override
    public boolean isBatteryLow() {
        return batteryLow;
    }

    @Override
    public void addBatteryChangeListener(BatteryChangeListener listener) {
        batteryChangeListeners.add(listener);
    }

    @Override
    public void removeBatteryChangeListener(BatteryChangeListener listener) {
        batteryChangeListeners.remove(listener);
    }

    @Override
    public void close() {
        connectivityChangeListeners.clear();
        foregroundChangeListeners.clear();
        batteryChangeListeners.clear();
    }
}
