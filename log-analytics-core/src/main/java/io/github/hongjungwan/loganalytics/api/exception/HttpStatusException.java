package io.github.hongjungwan.loganalytics.api.exception;

/**
 * 200 이외의 HTTP 응답. 상태 코드와 응답 본문을 포함하며, 재시도 대상.
 */
public class HttpStatusException extends DeliveryException {

    private final int statusCode;
    private final String responseBody;

    public HttpStatusException(int statusCode, String responseBody, int messageCount) {
        super(String.format("Post log request failed with status: %d %s", statusCode, responseBody), messageCount);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
