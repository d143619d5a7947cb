package com.repoharvest.extractor.concurrent;

import java.time.Duration;

/**
 * Pauses the calling worker. Implementations may wake early.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps for {@code duration}.
     *
     * @return {@code true} if the full duration elapsed, {@code false} if the
     *         sleep was cut short by cancellation or interruption
     */
    boolean sleep(Duration duration);

    /**
     * A plain {@link Thread#sleep} that restores the interrupt flag when interrupted.
     */
    static Sleeper threadSleeper() {
        return duration -> {
            if (duration.isZero() || duration.isNegative()) {
                return true;
            }
            try {
                Thread.sleep(duration.toMillis());
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        };
    }
}
