package me.christianrobert.pystyle.transformer.service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock timing of {@link TransformationService#transform} calls, cache hits and failures included.
 */
public class ConversionMetrics {

    private final AtomicLong conversions = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong totalNanos = new AtomicLong();
    private final AtomicLong lastNanos = new AtomicLong();

    void record(long elapsedNanos, boolean success) {
        conversions.incrementAndGet();
        if (!success) {
            failures.incrementAndGet();
        }
        totalNanos.addAndGet(elapsedNanos);
        lastNanos.set(elapsedNanos);
    }

    public long getConversions() {
        return conversions.get();
    }

    public long getFailures() {
        return failures.get();
    }

    public Duration getTotalTime() {
        return Duration.ofNanos(totalNanos.get());
    }

    /**
     * Mean time per conversion, zero before the first one.
     */
    public Duration getAverageTime() {
        long count = conversions.get();
        return count == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos.get() / count);
    }

    public Duration getLastTime() {
        return Duration.ofNanos(lastNanos.get());
    }

    public void reset() {
        conversions.set(0);
        failures.set(0);
        totalNanos.set(0);
        lastNanos.set(0);
    }

    @Override
    public String toString() {
        return String.format("ConversionMetrics{conversions=%d, failures=%d, totalMs=%.3f, averageMs=%.3f}",
                getConversions(), getFailures(), totalNanos.get() / 1_000_000.0,
                getAverageTime().toNanos() / 1_000_000.0);
    }
}
