package io.github.hongjungwan.loganalytics.starter;

import io.github.hongjungwan.loganalytics.api.LogShipper;
import io.github.hongjungwan.loganalytics.api.LogShippers;
import io.github.hongjungwan.loganalytics.api.config.LogAnalyticsConfig;
import io.github.hongjungwan.loganalytics.core.resilience.RetryPolicy;
import io.github.hongjungwan.loganalytics.core.transport.JdkHttpIngestionTransport;
import io.github.hongjungwan.loganalytics.spi.IngestionTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Log Analytics 클라이언트 Spring Boot 자동 설정.
 *
 * log-analytics.enabled=false 이면 비활성화된다.
 */
@AutoConfiguration
@EnableConfigurationProperties(LogAnalyticsProperties.class)
@ConditionalOnProperty(prefix = "log-analytics", name = "enabled", havingValue = "true", matchIfMissing = true)
@Import(LogAnalyticsAutoConfiguration.ClientConfiguration.class)
@Slf4j
public class LogAnalyticsAutoConfiguration {

    /**
     * 워크스페이스 ID 가 설정된 경우에만 클라이언트 빈 등록
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "log-analytics", name = "workspace-id")
    static class ClientConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public LogAnalyticsConfig logAnalyticsConfig(LogAnalyticsProperties properties) {
            LogAnalyticsProperties.RetryProperties retry = properties.getRetry();
            return LogAnalyticsConfig.builder()
                    .workspaceId(properties.getWorkspaceId())
                    .workspaceSecret(properties.getWorkspaceSecret())
                    .logType(properties.getLogType())
                    .metadata(properties.getMetadata())
                    .ingestionDomain(properties.getIngestionDomain())
                    .maxRetries(retry.getMaxRetries())
                    .initialRetryDelay(retry.getInitialDelay())
                    .retryMultiplier(retry.getMultiplier())
                    .maxRetryDelay(retry.getMaxDelay())
                    .maxPendingRetries(retry.getMaxPending())
                    .drainOnClose(properties.isDrainOnClose())
                    .shutdownTimeout(properties.getShutdownTimeout())
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean
        public IngestionTransport ingestionTransport() {
            return new JdkHttpIngestionTransport();
        }

        @Bean
        @ConditionalOnMissingBean
        public RetryPolicy logAnalyticsRetryPolicy(LogAnalyticsConfig config) {
            return RetryPolicy.from(config);
        }

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean
        public LogShipper logShipper(LogAnalyticsConfig config, IngestionTransport transport, RetryPolicy retryPolicy) {
            LogShipper shipper = LogShippers.builder(config)
                    .transport(transport)
                    .retryPolicy(retryPolicy)
                    .build();
            log.info("Log Analytics client configured (workspace: {}, Log-Type: {}, maxRetries: {})",
                    config.getWorkspaceId(), config.getLogType(), retryPolicy.getMaxRetries());
            return shipper;
        }
    }
}
