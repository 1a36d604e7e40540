package io.github.hongjungwan.loganalytics.api.exception;

/**
 * 로그 전송 실패. 첫 시도 실패만 호출자에게 전달되고, 재시도 실패는 로그로만 남는다.
 */
public class DeliveryException extends RuntimeException {

    private final int messageCount;

    public DeliveryException(String message, int messageCount) {
        super(message);
        this.messageCount = messageCount;
    }

    public DeliveryException(String message, int messageCount, Throwable cause) {
        super(message, cause);
        this.messageCount = messageCount;
    }

    /** 실패한 배치의 메시지 수 */
    public int getMessageCount() {
        return messageCount;
    }
}
