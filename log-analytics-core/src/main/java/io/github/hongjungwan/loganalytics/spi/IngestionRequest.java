package io.github.hongjungwan.loganalytics.spi;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * 전송할 HTTP POST 요청. 헤더는 서명 시점에 확정된다.
 *
 * 본문은 생성 시 복사되며 {@link #body()} 도 사본을 반환한다. 동등성은 본문 내용으로 비교한다.
 *
 * @param uri     수집 엔드포인트
 * @param headers 요청 헤더 (Content-Length 제외)
 * @param body    JSON 본문 (UTF-8)
 */
public record IngestionRequest(URI uri, Map<String, String> headers, byte[] body) {

    public IngestionRequest {
        headers = Map.copyOf(headers);
        body = body.clone();
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    /** 본문 바이트 수 (서명의 Content-Length) */
    public int contentLength() {
        return body.length;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IngestionRequest)) return false;
        IngestionRequest other = (IngestionRequest) o;
        return Objects.equals(uri, other.uri)
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(uri, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "IngestionRequest[uri=" + uri + ", headers=" + headers.keySet() + ", body=" + body.length + " bytes]";
    }
}
