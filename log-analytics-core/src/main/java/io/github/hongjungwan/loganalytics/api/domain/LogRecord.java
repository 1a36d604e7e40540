package io.github.hongjungwan.loganalytics.api.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 전송 단위 로그 레코드. 정적 메타데이터 + message + Timestamp 로 구성된 평면 문자열 맵.
 *
 * JSON 직렬화 시 맵 자체가 하나의 객체로 기록된다.
 */
public final class LogRecord {

    public static final String MESSAGE_FIELD = "message";
    public static final String TIMESTAMP_FIELD = "Timestamp";

    /** RFC3339 (초 단위, UTC는 'Z') */
    public static final DateTimeFormatter RFC3339 =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX").withZone(ZoneOffset.UTC);

    private final Map<String, String> fields;

    private LogRecord(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /** 메타데이터를 복사한 뒤 message, Timestamp 를 덮어쓴다 */
    public static LogRecord of(Map<String, String> metadata, String message, Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");

        Map<String, String> fields = new LinkedHashMap<>(metadata.size() + 2);
        fields.putAll(metadata);
        fields.put(MESSAGE_FIELD, message);
        fields.put(TIMESTAMP_FIELD, RFC3339.format(timestamp));
        return new LogRecord(fields);
    }

    public String getMessage() {
        return fields.get(MESSAGE_FIELD);
    }

    public String getTimestamp() {
        return fields.get(TIMESTAMP_FIELD);
    }

    public String get(String field) {
        return fields.get(field);
    }

    @JsonValue
    public Map<String, String> asMap() {
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogRecord)) return false;
        return fields.equals(((LogRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "LogRecord" + fields;
    }
}
