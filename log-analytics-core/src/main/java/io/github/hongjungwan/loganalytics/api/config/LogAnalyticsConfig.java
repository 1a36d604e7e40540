package io.github.hongjungwan.loganalytics.api.config;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.Map;

/**
 * 클라이언트 설정. 워크스페이스 식별 정보, 정적 메타데이터, 재시도 정책 포함.
 */
@Getter
@Builder
public class LogAnalyticsConfig {

    /** 워크스페이스 ID (URL 호스트 및 서명 키 식별자) */
    private final String workspaceId;

    /** 워크스페이스 공유 키 (Base64) */
    private final String workspaceSecret;

    /** Log-Type 헤더 값 */
    private final String logType;

    /** 모든 레코드에 병합되는 정적 메타데이터 */
    @Builder.Default
    private final Map<String, String> metadata = Map.of();

    /** 수집 엔드포인트 도메인 (워크스페이스 ID 뒤에 붙음) */
    @Builder.Default
    private final String ingestionDomain = DEFAULT_INGESTION_DOMAIN;

    /** 최대 재시도 횟수 (0이면 재시도 없음) */
    @Builder.Default
    private final int maxRetries = 3;

    /** 첫 재시도까지 대기 시간 */
    @Builder.Default
    private final Duration initialRetryDelay = Duration.ofSeconds(15);

    /** 재시도 간격 배수 */
    @Builder.Default
    private final double retryMultiplier = 2.0;

    /** 재시도 간격 상한 */
    @Builder.Default
    private final Duration maxRetryDelay = Duration.ofMinutes(5);

    /** 대기 중인 재시도 최대 개수 (초과 시 폐기) */
    @Builder.Default
    private final int maxPendingRetries = 1000;

    /** 종료 시 대기 중인 재시도를 즉시 한 번 전송 */
    @Builder.Default
    private final boolean drainOnClose = true;

    /** 종료 대기 시간 */
    @Builder.Default
    private final Duration shutdownTimeout = Duration.ofSeconds(10);

    public static final String DEFAULT_INGESTION_DOMAIN = "ods.opinsights.azure.com";

    /** 기본 설정 */
    public static LogAnalyticsConfig defaultConfig(String workspaceId, String workspaceSecret, String logType) {
        return LogAnalyticsConfig.builder()
                .workspaceId(workspaceId)
                .workspaceSecret(workspaceSecret)
                .logType(logType)
                .build();
    }
}
