package io.github.hongjungwan.loganalytics.core.internal;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;

/**
 * 재시도 대기 중인 배치. 원래 메시지와 원래 타임스탬프를 그대로 다시 전송한다.
 */
final class RetryTask implements Delayed {

    private final List<String> messages;
    private final Instant timestamp;
    private final int retryNumber;
    private final long dueNanos;

    private RetryTask(List<String> messages, Instant timestamp, int retryNumber, long dueNanos) {
        this.messages = messages;
        this.timestamp = timestamp;
        this.retryNumber = retryNumber;
        this.dueNanos = dueNanos;
    }

    /** 첫 번째 재시도 */
    static RetryTask first(List<String> messages, Instant timestamp, Duration delay) {
        return new RetryTask(List.copyOf(messages), timestamp, 1, System.nanoTime() + delay.toNanos());
    }

    /** 다음 재시도 (같은 배치, 번호 증가) */
    RetryTask next(Duration delay) {
        return new RetryTask(messages, timestamp, retryNumber + 1, System.nanoTime() + delay.toNanos());
    }

    List<String> getMessages() {
        return messages;
    }

    Instant getTimestamp() {
        return timestamp;
    }

    int getRetryNumber() {
        return retryNumber;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(dueNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
        if (other instanceof RetryTask) {
            return Long.compare(dueNanos, ((RetryTask) other).dueNanos);
        }
        return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
    }
}
