package io.github.hongjungwan.loganalytics.core.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.loganalytics.api.domain.LogRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LogRecordSerializer 테스트")
class LogRecordSerializerTest {

    private static final Instant TIMESTAMP = Instant.parse("2024-05-01T12:00:00Z");

    private final LogRecordSerializer serializer = new LogRecordSerializer();

    @Test
    @DisplayName("레코드 배치를 평면 객체의 JSON 배열로 직렬화해야 한다")
    void shouldSerializeAsArrayOfFlatObjects() throws IOException {
        List<LogRecord> records = List.of(
                LogRecord.of(Map.of("service", "payroll"), "first", TIMESTAMP),
                LogRecord.of(Map.of("service", "payroll"), "second", TIMESTAMP));

        JsonNode json = new ObjectMapper().readTree(serializer.serialize(records));

        assertThat(json.isArray()).isTrue();
        assertThat(json).hasSize(2);
        assertThat(json.get(1).get("message").asText()).isEqualTo("second");
        assertThat(json.get(0).get("service").asText()).isEqualTo("payroll");
        assertThat(json.get(0).get("Timestamp").asText()).isEqualTo("2024-05-01T12:00:00Z");
    }

    @Test
    @DisplayName("특수 문자와 비 ASCII 문자를 UTF-8 로 이스케이프해야 한다")
    void shouldEscapeSpecialCharacters() {
        List<LogRecord> records = List.of(LogRecord.of(Map.of(), "급여 \"완료\"\n", TIMESTAMP));

        String json = new String(serializer.serialize(records), StandardCharsets.UTF_8);

        assertThat(json).isEqualTo("[{\"message\":\"급여 \\\"완료\\\"\\n\",\"Timestamp\":\"2024-05-01T12:00:00Z\"}]");
    }

    @Test
    @DisplayName("빈 배치는 빈 배열이어야 한다")
    void shouldSerializeEmptyBatch() {
        assertThat(new String(serializer.serialize(List.of()), StandardCharsets.UTF_8)).isEqualTo("[]");
    }
}
