package io.github.hongjungwan.loganalytics.core.internal;

import io.github.hongjungwan.loganalytics.api.exception.DeliveryException;
import io.github.hongjungwan.loganalytics.core.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 재시도 워커. DelayQueue 에 쌓인 배치를 전용 스레드 하나가 순서대로 재전송한다.
 *
 * 재시도 체인은 {@link RetryPolicy} 로 제한되며, 대기 큐 크기도 제한된다.
 * 종료 시 남은 배치는 설정에 따라 즉시 한 번 전송하거나 폐기한다.
 */
@Slf4j
public class RetryWorker {

    private static final AtomicInteger WORKER_IDS = new AtomicInteger();
    private static final long POLL_TIMEOUT_MS = 100;

    private final Delivery delivery;
    private final RetryPolicy policy;
    private final DeliveryMetrics metrics;
    private final int maxPendingRetries;
    private final boolean drainOnClose;

    private final DelayQueue<RetryTask> queue = new DelayQueue<>();
    private final ReentrantLock enqueueLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ExecutorService executor;

    /** 재전송 콜백 (재시도 예약 없이 한 번 전송) */
    @FunctionalInterface
    public interface Delivery {
        void deliver(List<String> messages, Instant timestamp);
    }

    public RetryWorker(Delivery delivery, RetryPolicy policy, DeliveryMetrics metrics,
                       int maxPendingRetries, boolean drainOnClose) {
        this.delivery = delivery;
        this.policy = policy;
        this.metrics = metrics;
        this.maxPendingRetries = maxPendingRetries;
        this.drainOnClose = drainOnClose;

        String threadName = "log-analytics-retry-" + WORKER_IDS.incrementAndGet();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("RetryWorker is closed");
        }
        if (running.compareAndSet(false, true)) {
            executor.submit(this::consumeLoop);
            log.debug("Retry worker started (maxRetries={}, maxPending={})",
                    policy.getMaxRetries(), maxPendingRetries);
        }
    }

    /**
     * 첫 전송 실패 후 재시도 예약.
     *
     * @return 예약 여부 (재시도 대상이 아니거나, 종료되었거나, 큐가 가득 찬 경우 false)
     */
    public boolean schedule(List<String> messages, Instant timestamp, DeliveryException failure) {
        if (!policy.isRetryable(failure) || !policy.canRetry(1)) {
            return false;
        }
        Duration delay = policy.calculateDelay(1);
        if (!enqueue(RetryTask.first(messages, timestamp, delay))) {
            return false;
        }
        log.warn("Retry #1 for {} messages scheduled in {}ms", messages.size(), delay.toMillis());
        return true;
    }

    private boolean enqueue(RetryTask task) {
        enqueueLock.lock();
        try {
            // 종료 후에는 큐에 넣지 않음
            if (closed.get()) {
                log.warn("Retry worker closed, dropping batch of {} messages", task.getMessages().size());
                metrics.recordRetryDropped();
                return false;
            }
            if (queue.size() >= maxPendingRetries) {
                log.warn("Retry queue full ({} pending), dropping batch of {} messages",
                        queue.size(), task.getMessages().size());
                metrics.recordRetryDropped();
                return false;
            }
            queue.offer(task);
            metrics.recordRetryScheduled();
            return true;
        } finally {
            enqueueLock.unlock();
        }
    }

    private void consumeLoop() {
        while (running.get()) {
            try {
                RetryTask task = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (task != null) {
                    process(task);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Unexpected error in retry worker", e);
            }
        }
    }

    /** 재전송 후 실패 시 다음 재시도 예약 또는 포기 */
    private void process(RetryTask task) {
        int count = task.getMessages().size();
        try {
            delivery.deliver(task.getMessages(), task.getTimestamp());
            metrics.recordRetrySucceeded();
            log.info("Retry #{} posted {} messages", task.getRetryNumber(), count);

        } catch (DeliveryException e) {
            if (closed.get()) {
                metrics.recordRetryDropped();
                log.warn("Retry #{} for {} messages interrupted by shutdown: {}",
                        task.getRetryNumber(), count, e.getMessage());
                return;
            }
            int next = task.getRetryNumber() + 1;
            if (policy.isRetryable(e) && policy.canRetry(next)) {
                Duration delay = policy.calculateDelay(next);
                if (enqueue(task.next(delay))) {
                    log.warn("Retry #{} failed ({}), retry #{} scheduled in {}ms",
                            task.getRetryNumber(), e.getMessage(), next, delay.toMillis());
                }
            } else {
                metrics.recordRetryExhausted();
                log.error("Giving up on {} messages after retry #{}: {}",
                        count, task.getRetryNumber(), e.getMessage());
            }
        }
    }

    /** 대기 중인 재시도 수 */
    public int pendingRetries() {
        return queue.size();
    }

    /**
     * 워커 종료. 진행 중인 재전송이 끝나길 기다린 뒤 남은 배치를 처리한다.
     */
    public void close(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        long deadline = System.nanoTime() + timeout.toNanos();

        running.set(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        RetryTask[] remaining;
        enqueueLock.lock();
        try {
            remaining = queue.toArray(new RetryTask[0]);
            queue.clear();
        } finally {
            enqueueLock.unlock();
        }
        if (remaining.length == 0) {
            return;
        }

        if (!drainOnClose) {
            log.warn("Retry worker closed with {} pending batches, dropping them", remaining.length);
            for (int i = 0; i < remaining.length; i++) {
                metrics.recordRetryDropped();
            }
            return;
        }

        log.info("Draining {} pending retries before shutdown", remaining.length);
        for (RetryTask task : remaining) {
            if (System.nanoTime() >= deadline || Thread.currentThread().isInterrupted()) {
                log.warn("Shutdown timeout reached, dropping batch of {} messages", task.getMessages().size());
                metrics.recordRetryDropped();
                continue;
            }
            drainOnce(task);
        }
    }

    private void drainOnce(RetryTask task) {
        try {
            delivery.deliver(task.getMessages(), task.getTimestamp());
            metrics.recordRetrySucceeded();
            log.info("Posted {} pending messages during shutdown", task.getMessages().size());
        } catch (DeliveryException e) {
            metrics.recordRetryDropped();
            log.warn("Final attempt for {} messages failed during shutdown: {}",
                    task.getMessages().size(), e.getMessage());
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
