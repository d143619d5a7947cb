package com.repoharvest.extractor.concurrent;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Run-wide stop signal. Set once, either by the caller ({@link #cancel}) or by the
 * pipeline itself when it cannot continue ({@link #abort}). Sleeping through this
 * signal wakes up as soon as it is set.
 */
public class CancellationSignal implements Sleeper {

    public enum Kind { CANCELLED, ABORTED }

    public record Reason(Kind kind, String message) {}

    private final CountDownLatch latch = new CountDownLatch(1);
    private final AtomicReference<Reason> reason = new AtomicReference<>();

    public void cancel(String message) {
        signal(new Reason(Kind.CANCELLED, message));
    }

    public void abort(String message) {
        signal(new Reason(Kind.ABORTED, message));
    }

    private void signal(Reason value) {
        if (reason.compareAndSet(null, value)) {
            latch.countDown();
        }
    }

    public boolean isSet() {
        return reason.get() != null;
    }

    /**
     * @return the first reason the signal was set with, or {@code null} if not set
     */
    public Reason reason() {
        return reason.get();
    }

    @Override
    public boolean sleep(Duration duration) {
        if (isSet()) {
            return false;
        }
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            return !latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
