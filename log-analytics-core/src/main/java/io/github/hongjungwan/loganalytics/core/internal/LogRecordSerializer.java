package io.github.hongjungwan.loganalytics.core.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.loganalytics.api.domain.LogRecord;

import java.util.List;

/**
 * 레코드 배치를 JSON 배열로 직렬화. 요청 본문이 된다.
 */
public class LogRecordSerializer {

    private final ObjectMapper objectMapper;

    public LogRecordSerializer() {
        this.objectMapper = createObjectMapper();
    }

    private ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }

    /** JSON 배열 (UTF-8 바이트) */
    public byte[] serialize(List<LogRecord> records) {
        try {
            return objectMapper.writeValueAsBytes(records);
        } catch (JsonProcessingException e) {
            // 문자열 맵 직렬화 실패는 로직 오류
            throw new IllegalStateException("Failed to serialize log records", e);
        }
    }
}
