package io.github.hongjungwan.loganalytics.starter;

import io.github.hongjungwan.loganalytics.api.config.LogAnalyticsConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Log Analytics 클라이언트 설정 Properties (prefix: log-analytics).
 */
@Data
@ConfigurationProperties(prefix = "log-analytics")
public class LogAnalyticsProperties {

    /** 클라이언트 활성화 여부 */
    private boolean enabled = true;

    /** 워크스페이스 ID */
    private String workspaceId;

    /** 워크스페이스 공유 키 (Base64) */
    private String workspaceSecret;

    /** Log-Type 헤더 값 (영문자, 숫자, '_') */
    private String logType;

    /** 모든 레코드에 추가되는 정적 필드 */
    private Map<String, String> metadata = new LinkedHashMap<>();

    /** 수집 엔드포인트 도메인 */
    private String ingestionDomain = LogAnalyticsConfig.DEFAULT_INGESTION_DOMAIN;

    /** 재시도 설정 */
    private RetryProperties retry = new RetryProperties();

    /** 종료 시 대기 중인 재시도를 한 번 전송 */
    private boolean drainOnClose = true;

    private Duration shutdownTimeout = Duration.ofSeconds(10);

    @Data
    public static class RetryProperties {
        /** 최대 재시도 횟수 (0이면 비활성화) */
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(15);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofMinutes(5);

        /** 대기 중인 재시도 상한 */
        private int maxPending = 1000;
    }
}
