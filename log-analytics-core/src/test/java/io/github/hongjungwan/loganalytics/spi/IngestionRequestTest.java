package io.github.hongjungwan.loganalytics.spi;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IngestionRequest 테스트")
class IngestionRequestTest {

    private static final URI ENDPOINT = URI.create("https://ws.ods.opinsights.azure.com/api/logs?api-version=2016-04-01");
    private static final Map<String, String> HEADERS = Map.of("Log-Type", "AppLogs");

    @Test
    @DisplayName("같은 내용의 본문을 가진 요청은 동등해야 한다")
    void shouldBeEqualForSameBodyContent() {
        IngestionRequest first = new IngestionRequest(ENDPOINT, HEADERS, "[{}]".getBytes(StandardCharsets.UTF_8));
        IngestionRequest second = new IngestionRequest(ENDPOINT, HEADERS, "[{}]".getBytes(StandardCharsets.UTF_8));

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
        assertThat(first).isNotEqualTo(new IngestionRequest(ENDPOINT, HEADERS, "[]".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("원본 배열이나 반환된 본문을 수정해도 요청은 바뀌지 않아야 한다")
    void shouldNotExposeBody() {
        byte[] source = "[{}]".getBytes(StandardCharsets.UTF_8);
        IngestionRequest request = new IngestionRequest(ENDPOINT, HEADERS, source);

        source[0] = 'x';
        request.body()[1] = 'x';

        assertThat(request.bodyAsString()).isEqualTo("[{}]");
        assertThat(request.contentLength()).isEqualTo(4);
    }

    @Test
    @DisplayName("toString 에 헤더 값이 포함되지 않아야 한다")
    void shouldNotLeakHeaderValues() {
        IngestionRequest request = new IngestionRequest(ENDPOINT,
                Map.of("Authorization", "SharedKey ws:secret-signature"), new byte[0]);

        assertThat(request.toString()).doesNotContain("secret-signature");
    }
}
