package io.github.hongjungwan.loganalytics.core.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import io.github.hongjungwan.loganalytics.api.LogShipper;
import io.github.hongjungwan.loganalytics.api.LogShippers;
import io.github.hongjungwan.loganalytics.api.config.LogAnalyticsConfig;
import io.github.hongjungwan.loganalytics.api.exception.DeliveryException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logback Appender. 이벤트마다 메시지 하나를 동기식으로 전송한다.
 *
 * <pre>{@code
 * <appender name="LOG_ANALYTICS" class="io.github.hongjungwan.loganalytics.core.logback.LogAnalyticsAppender">
 *   <workspaceId>...</workspaceId>
 *   <workspaceSecret>...</workspaceSecret>
 *   <logType>ApplicationLogs</logType>
 *   <metadata>service=payroll,env=prod</metadata>
 * </appender>
 * }</pre>
 *
 * 클라이언트 자신의 로그는 전송하지 않는다 (재귀 방지).
 */
public class LogAnalyticsAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    static final String LIBRARY_LOGGER_PREFIX = "io.github.hongjungwan.loganalytics.";

    private String workspaceId;
    private String workspaceSecret;
    private String logType;
    private String metadata;

    private LogShipper shipper;
    private boolean ownsShipper;

    public LogAnalyticsAppender() {
    }

    /** 외부에서 생성한 LogShipper 사용 (종료는 호출자 책임) */
    public LogAnalyticsAppender(LogShipper shipper) {
        this.shipper = shipper;
    }

    @Override
    public void start() {
        if (isStarted()) {
            return;
        }
        if (shipper == null) {
            try {
                shipper = LogShippers.create(LogAnalyticsConfig.builder()
                        .workspaceId(workspaceId)
                        .workspaceSecret(workspaceSecret)
                        .logType(logType)
                        .metadata(parseMetadata(metadata))
                        .build());
                ownsShipper = true;
            } catch (IllegalArgumentException e) {
                addError("Invalid Log Analytics configuration for appender [" + getName() + "]", e);
                return;
            }
        }
        super.start();
        addInfo("LogAnalyticsAppender started for workspace " + shipper.getWorkspaceId()
                + " (Log-Type: " + shipper.getLogType() + ")");
    }

    @Override
    public void stop() {
        if (!isStarted()) {
            return;
        }
        super.stop();
        if (ownsShipper) {
            shipper.close();
            shipper = null;
            ownsShipper = false;
        }
        addInfo("LogAnalyticsAppender stopped");
    }

    @Override
    protected void append(ILoggingEvent event) {
        String loggerName = event.getLoggerName();
        if (loggerName != null && loggerName.startsWith(LIBRARY_LOGGER_PREFIX)) {
            return;
        }

        try {
            shipper.postMessage(format(event), Instant.ofEpochMilli(event.getTimeStamp()));
        } catch (DeliveryException e) {
            addError("Failed to post log event to Log Analytics", e);
        } catch (IllegalStateException e) {
            addWarn("LogShipper is no longer available: " + e.getMessage());
        }
    }

    /** LEVEL [logger] message (+ 예외 요약) */
    static String format(ILoggingEvent event) {
        StringBuilder sb = new StringBuilder()
                .append(event.getLevel())
                .append(" [").append(event.getLoggerName()).append("] ")
                .append(event.getFormattedMessage());

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            sb.append(" | ").append(throwable.getClassName());
            if (throwable.getMessage() != null) {
                sb.append(": ").append(throwable.getMessage());
            }
        }
        return sb.toString();
    }

    /** "key=value,key2=value2" 파싱 */
    static Map<String, String> parseMetadata(String spec) {
        Map<String, String> result = new LinkedHashMap<>();
        if (spec == null || spec.isBlank()) {
            return result;
        }
        for (String pair : spec.split(",")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Invalid metadata entry (expected key=value): " + pair.trim());
            }
            result.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return result;
    }

    public void setWorkspaceId(String workspaceId) {
        this.workspaceId = workspaceId;
    }

    public void setWorkspaceSecret(String workspaceSecret) {
        this.workspaceSecret = workspaceSecret;
    }

    public void setLogType(String logType) {
        this.logType = logType;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }

    LogShipper getShipper() {
        return shipper;
    }
}
