package ai.customfit.sdk;

/**
 * Source of the current time, injectable so that time-dependent logic can be tested
 * deterministically.
 */
interface Clock {
    Clock SYSTEM = System::currentTimeMillis;

    /**
     * @return current time in milliseconds since the epoch
     */
    long millis();
}
