package io.github.hongjungwan.loganalytics.spi;

/**
 * 수집 엔드포인트 응답.
 *
 * @param statusCode HTTP 상태 코드
 * @param body       응답 본문 (없으면 빈 문자열)
 */
public record IngestionResponse(int statusCode, String body) {

    public static final int OK = 200;

    public IngestionResponse {
        body = body == null ? "" : body;
    }

    public static IngestionResponse ok() {
        return new IngestionResponse(OK, "");
    }

    public boolean isSuccess() {
        return statusCode == OK;
    }
}
