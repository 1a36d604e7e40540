package io.github.hongjungwan.loganalytics.api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LogAnalyticsConfig 테스트")
class LogAnalyticsConfigTest {

    @Test
    @DisplayName("기본 설정값이 올바르게 설정되어야 한다")
    void shouldHaveDefaults() {
        LogAnalyticsConfig config = LogAnalyticsConfig.defaultConfig("ws", "SmVmZQ==", "AppLogs");

        assertThat(config.getWorkspaceId()).isEqualTo("ws");
        assertThat(config.getWorkspaceSecret()).isEqualTo("SmVmZQ==");
        assertThat(config.getLogType()).isEqualTo("AppLogs");
        assertThat(config.getMetadata()).isEmpty();
        assertThat(config.getIngestionDomain()).isEqualTo("ods.opinsights.azure.com");
        assertThat(config.getMaxRetries()).isEqualTo(3);
        assertThat(config.getInitialRetryDelay()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.getRetryMultiplier()).isEqualTo(2.0);
        assertThat(config.getMaxRetryDelay()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.getMaxPendingRetries()).isEqualTo(1000);
        assertThat(config.isDrainOnClose()).isTrue();
        assertThat(config.getShutdownTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("빌더로 값을 재정의할 수 있어야 한다")
    void shouldOverrideWithBuilder() {
        LogAnalyticsConfig config = LogAnalyticsConfig.builder()
                .workspaceId("ws")
                .workspaceSecret("SmVmZQ==")
                .logType("AppLogs")
                .metadata(Map.of("env", "prod"))
                .ingestionDomain("ods.opinsights.azure.us")
                .maxRetries(0)
                .drainOnClose(false)
                .build();

        assertThat(config.getMetadata()).containsEntry("env", "prod");
        assertThat(config.getIngestionDomain()).isEqualTo("ods.opinsights.azure.us");
        assertThat(config.getMaxRetries()).isZero();
        assertThat(config.isDrainOnClose()).isFalse();
    }
}
