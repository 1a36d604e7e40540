package io.github.hongjungwan.loganalytics.core.resilience;

import io.github.hongjungwan.loganalytics.api.config.LogAnalyticsConfig;
import io.github.hongjungwan.loganalytics.api.exception.DeliveryException;
import io.github.hongjungwan.loganalytics.api.exception.HttpStatusException;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 지수 백오프 재시도 정책. 최대 재시도 횟수로 재시도 체인 길이를 제한한다.
 *
 * n번째 재시도 대기 시간 = min(initialDelay * multiplier^(n-1), maxDelay)
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final long initialDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final Predicate<DeliveryException> retryPredicate;

    private RetryPolicy(Builder builder) {
        this.maxRetries = builder.maxRetries;
        this.initialDelayMs = builder.initialDelayMs;
        this.multiplier = builder.multiplier;
        this.maxDelayMs = Math.max(builder.maxDelayMs, builder.initialDelayMs);
        this.retryPredicate = builder.retryPredicate;
    }

    /**
     * n번째 재시도 가능 여부 (1부터 시작)
     */
    public boolean canRetry(int retryNumber) {
        return retryNumber >= 1 && retryNumber <= maxRetries;
    }

    /**
     * 재시도 대상 실패인지 확인
     */
    public boolean isRetryable(DeliveryException failure) {
        return retryPredicate.test(failure);
    }

    /**
     * n번째 재시도까지 대기 시간
     */
    public Duration calculateDelay(int retryNumber) {
        double delay = initialDelayMs * Math.pow(multiplier, Math.max(0, retryNumber - 1));
        if (Double.isInfinite(delay) || delay > maxDelayMs) {
            return Duration.ofMillis(maxDelayMs);
        }
        return Duration.ofMillis((long) delay);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * 기본 정책 (3회, 15초부터 2배씩, 최대 5분)
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * 재시도 없음
     */
    public static RetryPolicy none() {
        return builder().maxRetries(0).build();
    }

    /**
     * 클라이언트 설정에서 정책 생성
     */
    public static RetryPolicy from(LogAnalyticsConfig config) {
        return builder()
                .maxRetries(config.getMaxRetries())
                .initialDelay(config.getInitialRetryDelay())
                .multiplier(config.getRetryMultiplier())
                .maxDelay(config.getMaxRetryDelay())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = 3;
        private long initialDelayMs = 15_000;
        private double multiplier = 2.0;
        private long maxDelayMs = 300_000;
        private Predicate<DeliveryException> retryPredicate = HttpStatusException.class::isInstance;

        /**
         * 최대 재시도 횟수 (기본: 3)
         */
        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * 첫 재시도 대기 시간 (기본: 15초)
         */
        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must not be negative: " + initialDelay);
            }
            this.initialDelayMs = initialDelay.toMillis();
            return this;
        }

        /**
         * 대기 시간 배수 (기본: 2.0, 1.0이면 고정 간격)
         */
        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
            }
            this.multiplier = multiplier;
            return this;
        }

        /**
         * 대기 시간 상한 (기본: 5분)
         */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelayMs = maxDelay.toMillis();
            return this;
        }

        /**
         * 고정 간격
         */
        public Builder fixedDelay(Duration delay) {
            return initialDelay(delay).multiplier(1.0).maxDelay(delay);
        }

        /**
         * 재시도 조건 (기본: HttpStatusException 만)
         */
        public Builder retryOn(Predicate<DeliveryException> predicate) {
            this.retryPredicate = predicate;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
