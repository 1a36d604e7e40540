package io.github.hongjungwan.loganalytics.core.security;

import io.github.hongjungwan.loganalytics.api.exception.SigningKeyException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WorkspaceKey 테스트")
class WorkspaceKeyTest {

    @Test
    @DisplayName("Base64 공유 키를 디코딩해야 한다")
    void shouldDecodeBase64Secret() {
        WorkspaceKey key = WorkspaceKey.fromBase64("MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=");

        assertThat(key.bytes())
                .isEqualTo("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8));
        assertThat(key.length()).isEqualTo(32);
    }

    @Test
    @DisplayName("잘못된 Base64 는 생성 시점에 실패해야 한다")
    void shouldFailOnInvalidBase64() {
        assertThatThrownBy(() -> WorkspaceKey.fromBase64("not base64!!"))
                .isInstanceOf(SigningKeyException.class)
                .hasMessageContaining("not valid Base64")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("빈 공유 키는 거부해야 한다")
    void shouldRejectBlankSecret() {
        assertThatThrownBy(() -> WorkspaceKey.fromBase64("  "))
                .isInstanceOf(SigningKeyException.class);
        assertThatThrownBy(() -> WorkspaceKey.fromBase64(null))
                .isInstanceOf(SigningKeyException.class);
    }

    @Test
    @DisplayName("bytes() 는 내부 키를 노출하지 않아야 한다")
    void shouldReturnCopy() {
        WorkspaceKey key = WorkspaceKey.fromBase64("SmVmZQ==");

        key.bytes()[0] = 0;

        assertThat(key.bytes()).isEqualTo("Jefe".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("toString 에 키 내용이 포함되지 않아야 한다")
    void shouldNotLeakKeyInToString() {
        WorkspaceKey key = WorkspaceKey.fromBase64("SmVmZQ==");

        assertThat(key.toString()).isEqualTo("WorkspaceKey[4 bytes]");
    }
}
