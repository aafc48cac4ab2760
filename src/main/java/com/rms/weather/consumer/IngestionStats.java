package com.rms.weather.consumer;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide ingestion counters, shared by all partition loops.
 */
@Component
public class IngestionStats {

    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong decodeFailures = new AtomicLong();
    private final AtomicLong writeDeadLetters = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong unacked = new AtomicLong();
    private final AtomicLong deliveryDeadLetters = new AtomicLong();

    void applied() { applied.incrementAndGet(); }

    void decodeFailure() { decodeFailures.incrementAndGet(); }

    void writeDeadLetter() { writeDeadLetters.incrementAndGet(); }

    void retry() { retries.incrementAndGet(); }

    void unacked() { unacked.incrementAndGet(); }

    void deliveryDeadLetter() { deliveryDeadLetters.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(applied.get(), decodeFailures.get(), writeDeadLetters.get(), retries.get(), unacked.get(),
                deliveryDeadLetters.get());
    }

    public record Snapshot(long applied, long decodeFailures, long writeDeadLetters, long retries, long unacked,
            long deliveryDeadLetters) {
    }
}
