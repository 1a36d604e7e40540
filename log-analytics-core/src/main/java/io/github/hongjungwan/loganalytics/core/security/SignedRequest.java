package io.github.hongjungwan.loganalytics.core.security;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 서명 대상 요청 속성. 서버는 동일한 순서로 문자열을 재구성해 서명을 검증한다.
 *
 * <pre>
 * POST\n{contentLength}\napplication/json\nx-ms-date:{date}\n/api/logs
 * </pre>
 *
 * @param method        HTTP 메서드
 * @param contentLength 본문 바이트 길이
 * @param contentType   Content-Type
 * @param date          x-ms-date 헤더 값 (RFC1123, GMT)
 * @param resource      리소스 경로 (쿼리 제외)
 */
public record SignedRequest(String method, long contentLength, String contentType, String date, String resource) {

    public static final String METHOD = "POST";
    public static final String CONTENT_TYPE = "application/json";
    public static final String RESOURCE = "/api/logs";
    public static final String DATE_HEADER = "x-ms-date";

    /** RFC1123 (예: Mon, 02 Jan 2006 15:04:05 GMT) */
    public static final DateTimeFormatter RFC1123 =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneId.of("GMT"));

    /** 로그 수집 API 요청 */
    public static SignedRequest forLogs(long contentLength, Instant now) {
        return new SignedRequest(METHOD, contentLength, CONTENT_TYPE, RFC1123.format(now), RESOURCE);
    }

    /** 서명할 문자열 */
    public String stringToSign() {
        return method + "\n"
                + contentLength + "\n"
                + contentType + "\n"
                + DATE_HEADER + ":" + date + "\n"
                + resource;
    }

    /** Authorization 헤더 값: SharedKey {workspaceId}:{signature} */
    public String authorization(String workspaceId, WorkspaceKey key) {
        return "SharedKey " + workspaceId + ":" + SharedKeySigner.sign(stringToSign(), key);
    }
}
