package io.github.hongjungwan.loganalytics.core.internal;

import io.github.hongjungwan.loganalytics.api.LogShipper;
import io.github.hongjungwan.loganalytics.api.config.LogAnalyticsConfig;
import io.github.hongjungwan.loganalytics.api.domain.LogRecord;
import io.github.hongjungwan.loganalytics.api.exception.DeliveryException;
import io.github.hongjungwan.loganalytics.api.exception.HttpStatusException;
import io.github.hongjungwan.loganalytics.api.exception.TransportException;
import io.github.hongjungwan.loganalytics.core.resilience.RetryPolicy;
import io.github.hongjungwan.loganalytics.core.security.SignedRequest;
import io.github.hongjungwan.loganalytics.core.security.WorkspaceKey;
import io.github.hongjungwan.loganalytics.spi.IngestionRequest;
import io.github.hongjungwan.loganalytics.spi.IngestionResponse;
import io.github.hongjungwan.loganalytics.spi.IngestionTransport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * 기본 LogShipper 구현. 레코드 생성, JSON 직렬화, 공유 키 서명, POST, 실패 시 재시도 예약.
 *
 * 식별 정보와 키, 메타데이터는 생성 후 불변이므로 여러 스레드에서 동시에 호출해도 안전하다.
 */
@Slf4j
public class DefaultLogShipper implements LogShipper {

    public static final String API_VERSION = "2016-04-01";

    static final String AUTHORIZATION_HEADER = "Authorization";
    static final String CONTENT_TYPE_HEADER = "Content-Type";
    static final String LOG_TYPE_HEADER = "Log-Type";
    static final String TIME_GENERATED_FIELD_HEADER = "time-generated-field";

    private static final Pattern LOG_TYPE_PATTERN = Pattern.compile("[A-Za-z0-9_]{1,100}");

    private final String workspaceId;
    private final String logType;
    private final WorkspaceKey signingKey;
    private final Map<String, String> metadata;
    private final URI apiLogsUri;

    private final IngestionTransport transport;
    private final Clock clock;
    private final LogRecordSerializer serializer = new LogRecordSerializer();
    private final DeliveryMetrics metrics = new DeliveryMetrics();
    private final RetryWorker retryWorker;
    private final Duration shutdownTimeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DefaultLogShipper(LogAnalyticsConfig config, IngestionTransport transport, Clock clock, RetryPolicy retryPolicy) {
        this.workspaceId = requireNotBlank(config.getWorkspaceId(), "workspaceId");
        this.logType = validateLogType(config.getLogType());
        this.signingKey = WorkspaceKey.fromBase64(config.getWorkspaceSecret());
        this.metadata = copyMetadata(config.getMetadata());
        this.apiLogsUri = URI.create(String.format("https://%s.%s/api/logs?api-version=%s",
                workspaceId, requireNotBlank(config.getIngestionDomain(), "ingestionDomain"), API_VERSION));

        this.transport = transport;
        this.clock = clock;
        this.shutdownTimeout = config.getShutdownTimeout();
        this.retryWorker = new RetryWorker(this::deliver, retryPolicy, metrics,
                config.getMaxPendingRetries(), config.isDrainOnClose());
        this.retryWorker.start();

        log.info("LogShipper created for workspace {} (Log-Type: {}, {} metadata fields)",
                workspaceId, logType, metadata.size());
    }

    private static String requireNotBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value;
    }

    /** null 키/값은 허용하지 않음 */
    private static Map<String, String> copyMetadata(Map<String, String> metadata) {
        if (metadata == null) {
            return Map.of();
        }
        metadata.forEach((key, value) -> {
            if (key == null) {
                throw new IllegalArgumentException("metadata must not contain a null key");
            }
            if (value == null) {
                throw new IllegalArgumentException("metadata value must not be null: " + key);
            }
        });
        return Map.copyOf(metadata);
    }

    /** Log-Type 은 영문자, 숫자, '_' 만 허용 (최대 100자) */
    private static String validateLogType(String logType) {
        requireNotBlank(logType, "logType");
        if (!LOG_TYPE_PATTERN.matcher(logType).matches()) {
            throw new IllegalArgumentException(
                    "logType may contain only letters, digits and '_' (max 100 chars): " + logType);
        }
        return logType;
    }

    @Override
    public void postMessage(String message, Instant timestamp) {
        postMessages(List.of(requireMessage(message)), timestamp);
    }

    @Override
    public void postMessages(List<String> messages, Instant timestamp) {
        ensureOpen();
        if (messages == null) {
            throw new IllegalArgumentException("messages must not be null");
        }
        messages.forEach(DefaultLogShipper::requireMessage);

        if (messages.isEmpty()) {
            log.debug("No messages to post");
            return;
        }

        Instant resolved = resolveTimestamp(timestamp);
        try {
            deliver(messages, resolved);
        } catch (DeliveryException e) {
            retryWorker.schedule(messages, resolved, e);
            throw e;
        }
    }

    private static String requireMessage(String message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        return message;
    }

    /** null 또는 epoch 이면 현재 UTC 시각 */
    private Instant resolveTimestamp(Instant timestamp) {
        if (timestamp == null || Instant.EPOCH.equals(timestamp)) {
            return clock.instant();
        }
        return timestamp;
    }

    /**
     * 한 번 전송 (재시도 예약 없음). 재시도 워커도 이 경로를 사용한다.
     */
    void deliver(List<String> messages, Instant timestamp) {
        int count = messages.size();
        IngestionRequest request = buildRequest(messages, timestamp);

        long start = System.nanoTime();
        IngestionResponse response;
        try {
            response = transport.post(request);
        } catch (IOException e) {
            metrics.recordTransportFailure();
            throw new TransportException("Failed to post request: " + e.getMessage(), count, e);
        }

        if (!response.isSuccess()) {
            metrics.recordHttpFailure();
            throw new HttpStatusException(response.statusCode(), response.body(), count);
        }

        metrics.recordPosted(count, System.nanoTime() - start);
        log.info("Posted {} messages.", count);
    }

    /**
     * 서명된 요청 생성. 서명과 x-ms-date 헤더는 같은 날짜 문자열을 사용한다.
     */
    IngestionRequest buildRequest(List<String> messages, Instant timestamp) {
        List<LogRecord> records = messages.stream()
                .map(message -> LogRecord.of(metadata, message, timestamp))
                .toList();
        byte[] body = serializer.serialize(records);

        SignedRequest signed = SignedRequest.forLogs(body.length, clock.instant());

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(AUTHORIZATION_HEADER, signed.authorization(workspaceId, signingKey));
        headers.put(CONTENT_TYPE_HEADER, signed.contentType());
        headers.put(LOG_TYPE_HEADER, logType);
        headers.put(SignedRequest.DATE_HEADER, signed.date());
        headers.put(TIME_GENERATED_FIELD_HEADER, LogRecord.TIMESTAMP_FIELD);

        log.debug("Prepared {} records ({} bytes) for {}", records.size(), body.length, apiLogsUri);
        return new IngestionRequest(apiLogsUri, headers, body);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("LogShipper is closed");
        }
    }

    @Override
    public String getWorkspaceId() {
        return workspaceId;
    }

    @Override
    public String getLogType() {
        return logType;
    }

    public URI getApiLogsUri() {
        return apiLogsUri;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public int getPendingRetries() {
        return retryWorker.pendingRetries();
    }

    @Override
    public DeliveryMetrics.Snapshot getMetrics() {
        return metrics.getSnapshot();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        retryWorker.close(shutdownTimeout);
        transport.close();
        log.info("LogShipper for workspace {} closed: {}", workspaceId, metrics.getSnapshot());
    }
}
