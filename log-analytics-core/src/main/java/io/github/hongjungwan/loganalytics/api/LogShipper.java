package io.github.hongjungwan.loganalytics.api;

import io.github.hongjungwan.loganalytics.api.exception.DeliveryException;

import java.time.Instant;
import java.util.List;

/**
 * Log Analytics 워크스페이스로 로그 메시지를 전송하는 클라이언트.
 *
 * 각 요청은 워크스페이스 공유 키로 서명된다. 호출은 동기식이며, 200 이외의 응답을 받으면
 * 예외를 던지고 동일한 배치를 백그라운드 재시도 큐에 등록한다.
 */
public interface LogShipper extends AutoCloseable {

    /**
     * 단일 메시지 전송.
     *
     * @param message   로그 메시지
     * @param timestamp 레코드 시각 (null 또는 epoch 이면 현재 시각)
     * @throws DeliveryException 전송 실패 시
     */
    void postMessage(String message, Instant timestamp);

    /**
     * 메시지 배치 전송. 메시지마다 레코드 하나, 입력 순서 유지.
     *
     * @param messages  로그 메시지 목록
     * @param timestamp 모든 레코드에 적용할 시각 (null 또는 epoch 이면 현재 시각)
     * @throws DeliveryException 전송 실패 시
     */
    void postMessages(List<String> messages, Instant timestamp);

    String getWorkspaceId();

    String getLogType();

    /** 대기 중인 재시도 수 */
    int getPendingRetries();

    /** 전송 메트릭 */
    Metrics getMetrics();

    /** 재시도 워커 종료 (대기 중인 재시도 처리 포함) */
    @Override
    void close();

    /** 전송 메트릭 */
    interface Metrics {
        long batchesPosted();
        long messagesPosted();
        long transportFailures();
        long httpFailures();
        long retriesScheduled();
        long retriesSucceeded();
        long retriesExhausted();
        long retriesDropped();
    }
}
