package io.github.hongjungwan.loganalytics.api.exception;

/**
 * 워크스페이스 공유 키가 비어 있거나 Base64 디코딩에 실패한 경우. 생성 시점에 발생.
 */
public class SigningKeyException extends IllegalArgumentException {

    public SigningKeyException(String message) {
        super(message);
    }

    public SigningKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
