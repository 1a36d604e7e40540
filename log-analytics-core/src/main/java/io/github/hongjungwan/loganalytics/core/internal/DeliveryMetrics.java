package io.github.hongjungwan.loganalytics.core.internal;

import io.github.hongjungwan.loganalytics.api.LogShipper;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * 전송 메트릭 수집 (LongAdder 기반 lock-free). 클라이언트 인스턴스별.
 */
public final class DeliveryMetrics {

    private final Instant startTime = Instant.now();

    private final LongAdder batchesPosted = new LongAdder();
    private final LongAdder messagesPosted = new LongAdder();
    private final LongAdder transportFailures = new LongAdder();
    private final LongAdder httpFailures = new LongAdder();
    private final LongAdder retriesScheduled = new LongAdder();
    private final LongAdder retriesSucceeded = new LongAdder();
    private final LongAdder retriesExhausted = new LongAdder();
    private final LongAdder retriesDropped = new LongAdder();
    private final LongAdder postLatencyNanos = new LongAdder();

    public void recordPosted(int messageCount, long latencyNanos) {
        batchesPosted.increment();
        messagesPosted.add(messageCount);
        postLatencyNanos.add(latencyNanos);
    }

    public void recordTransportFailure() {
        transportFailures.increment();
    }

    public void recordHttpFailure() {
        httpFailures.increment();
    }

    public void recordRetryScheduled() {
        retriesScheduled.increment();
    }

    public void recordRetrySucceeded() {
        retriesSucceeded.increment();
    }

    public void recordRetryExhausted() {
        retriesExhausted.increment();
    }

    public void recordRetryDropped() {
        retriesDropped.increment();
    }

    public Snapshot getSnapshot() {
        long batches = batchesPosted.sum();
        return new Snapshot(
                Duration.between(startTime, Instant.now()),
                batches,
                messagesPosted.sum(),
                transportFailures.sum(),
                httpFailures.sum(),
                retriesScheduled.sum(),
                retriesSucceeded.sum(),
                retriesExhausted.sum(),
                retriesDropped.sum(),
                batches == 0 ? 0.0 : postLatencyNanos.sum() / (double) batches / 1_000_000.0
        );
    }

    /** 메트릭 스냅샷 */
    public record Snapshot(
            Duration uptime,
            long batchesPosted,
            long messagesPosted,
            long transportFailures,
            long httpFailures,
            long retriesScheduled,
            long retriesSucceeded,
            long retriesExhausted,
            long retriesDropped,
            double averagePostLatencyMs
    ) implements LogShipper.Metrics {

        @Override
        public String toString() {
            return String.format(
                    "DeliveryMetrics[uptime=%ds, batches=%d, messages=%d, transportFailures=%d, httpFailures=%d, " +
                            "retries(scheduled=%d, succeeded=%d, exhausted=%d, dropped=%d), avgLatency=%.2fms]",
                    uptime.toSeconds(), batchesPosted, messagesPosted, transportFailures, httpFailures,
                    retriesScheduled, retriesSucceeded, retriesExhausted, retriesDropped, averagePostLatencyMs);
        }
    }
}
