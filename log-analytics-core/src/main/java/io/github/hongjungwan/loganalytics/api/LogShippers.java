package io.github.hongjungwan.loganalytics.api;

import io.github.hongjungwan.loganalytics.api.config.LogAnalyticsConfig;
import io.github.hongjungwan.loganalytics.core.internal.DefaultLogShipper;
import io.github.hongjungwan.loganalytics.core.resilience.RetryPolicy;
import io.github.hongjungwan.loganalytics.core.transport.JdkHttpIngestionTransport;
import io.github.hongjungwan.loganalytics.spi.IngestionTransport;

import java.time.Clock;
import java.util.Map;

/**
 * LogShipper 팩토리.
 */
public final class LogShippers {

    private LogShippers() {}

    /** 기본 설정으로 생성 (JDK HttpClient, 시스템 UTC 시계) */
    public static LogShipper create(String workspaceId, String workspaceSecret, String logType,
                                    Map<String, String> metadata) {
        return create(LogAnalyticsConfig.builder()
                .workspaceId(workspaceId)
                .workspaceSecret(workspaceSecret)
                .logType(logType)
                .metadata(metadata == null ? Map.of() : metadata)
                .build());
    }

    /** 설정 기반 생성 */
    public static LogShipper create(LogAnalyticsConfig config) {
        return builder(config).build();
    }

    public static Builder builder(LogAnalyticsConfig config) {
        return new Builder(config);
    }

    /** 전송, 시계, 재시도 정책 교체용 빌더 */
    public static final class Builder {
        private final LogAnalyticsConfig config;
        private IngestionTransport transport;
        private Clock clock = Clock.systemUTC();
        private RetryPolicy retryPolicy;

        private Builder(LogAnalyticsConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config must not be null");
            }
            this.config = config;
        }

        public Builder transport(IngestionTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** 지정하지 않으면 설정의 재시도 값 사용 */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public LogShipper build() {
            IngestionTransport effectiveTransport = transport != null ? transport : new JdkHttpIngestionTransport();
            RetryPolicy effectivePolicy = retryPolicy != null ? retryPolicy : RetryPolicy.from(config);
            return new DefaultLogShipper(config, effectiveTransport, clock, effectivePolicy);
        }
    }
}
