package io.github.hongjungwan.loganalytics.core.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * 공유 키 서명 (HMAC-SHA256). 서명할 문자열의 UTF-8 바이트에 대한 MAC 을 Base64 로 인코딩.
 *
 * 상태가 없으며 스레드 안전. 동일한 (문자열, 키) 입력은 항상 동일한 서명을 만든다.
 */
public final class SharedKeySigner {

    public static final String ALGORITHM = "HmacSHA256";

    private SharedKeySigner() {}

    /**
     * 서명 생성.
     *
     * @param stringToSign 정규화된 서명 대상 문자열
     * @param key          Base64 디코딩된 워크스페이스 키
     * @return Base64 서명
     */
    public static String sign(String stringToSign, byte[] key) {
        if (stringToSign == null) {
            throw new IllegalArgumentException("String to sign must not be null");
        }
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("Signing key must not be null or empty");
        }

        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            byte[] hash = mac.doFinal(stringToSign.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute " + ALGORITHM + " signature", e);
        }
    }

    /** WorkspaceKey 로 서명 */
    public static String sign(String stringToSign, WorkspaceKey key) {
        return sign(stringToSign, key.bytes());
    }
}
