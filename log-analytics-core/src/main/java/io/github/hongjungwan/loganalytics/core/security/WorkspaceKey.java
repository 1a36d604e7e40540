package io.github.hongjungwan.loganalytics.core.security;

import io.github.hongjungwan.loganalytics.api.exception.SigningKeyException;

import java.util.Base64;

/**
 * Base64 디코딩된 워크스페이스 서명 키. 생성 후 변경 불가.
 */
public final class WorkspaceKey {

    private final byte[] key;

    private WorkspaceKey(byte[] key) {
        this.key = key;
    }

    /**
     * Base64 공유 키 디코딩.
     *
     * @throws SigningKeyException 키가 비어 있거나 Base64 형식이 아닌 경우
     */
    public static WorkspaceKey fromBase64(String workspaceSecret) {
        if (workspaceSecret == null || workspaceSecret.isBlank()) {
            throw new SigningKeyException("Workspace secret must not be null or blank");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(workspaceSecret.trim());
        } catch (IllegalArgumentException e) {
            throw new SigningKeyException("Workspace secret is not valid Base64", e);
        }

        if (decoded.length == 0) {
            throw new SigningKeyException("Workspace secret decodes to an empty key");
        }
        return new WorkspaceKey(decoded);
    }

    /** 키 바이트 사본 */
    public byte[] bytes() {
        return key.clone();
    }

    public int length() {
        return key.length;
    }

    @Override
    public String toString() {
        return "WorkspaceKey[" + key.length + " bytes]";
    }
}
