package io.github.hongjungwan.loganalytics.api.exception;

/**
 * 요청을 보내지 못했거나 응답을 받지 못한 경우 (연결 실패, 타임아웃). 재시도하지 않음.
 */
public class TransportException extends DeliveryException {

    public TransportException(String message, int messageCount, Throwable cause) {
        super(message, messageCount, cause);
    }
}
