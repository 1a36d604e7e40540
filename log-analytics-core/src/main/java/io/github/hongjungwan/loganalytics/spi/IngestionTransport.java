package io.github.hongjungwan.loganalytics.spi;

import java.io.IOException;

/**
 * 서명된 요청을 수집 엔드포인트로 보내는 전송 SPI. 기본 구현은 JDK HttpClient 기반.
 *
 * 구현체는 여러 스레드에서 동시에 호출될 수 있어야 한다.
 */
public interface IngestionTransport extends AutoCloseable {

    /**
     * 요청 전송.
     *
     * @return 수신한 응답 (상태 코드와 본문)
     * @throws IOException 요청을 보내지 못했거나 응답을 받지 못한 경우
     */
    IngestionResponse post(IngestionRequest request) throws IOException;

    /** 리소스 해제 (기본: 없음) */
    @Override
    default void close() {
    }
}
