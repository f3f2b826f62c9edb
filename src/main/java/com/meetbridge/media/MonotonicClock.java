package com.meetbridge.media;

/**
 * Monotonic time source. Only differences between readings are meaningful.
 */
@FunctionalInterface
public interface MonotonicClock {

    long nanos();

    default long millis() {
        return nanos() / 1_000_000L;
    }

    default long micros() {
        return nanos() / 1_000L;
    }

    static MonotonicClock system() {
        return System::nanoTime;
    }
}
