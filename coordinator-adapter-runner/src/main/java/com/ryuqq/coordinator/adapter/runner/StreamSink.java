package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.core.model.EventBook;

/**
 * 클라이언트 event stream의 수신 측.
 *
 * <p>전송 계층(gRPC stream, SSE 등)이 구현합니다. 클라이언트 연결이 끊기면 {@link #isClosed()}가
 * true가 되고 등록된 close 콜백이 호출되어야 합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface StreamSink {

    /**
     * Event book 전달.
     *
     * @param book 전달할 book
     * @return 전달 성공 여부 (false면 stream이 닫힌 것으로 간주)
     */
    boolean offer(EventBook book);

    boolean isClosed();

    /**
     * Sink가 닫힐 때 호출할 콜백 등록. 이미 닫혀 있으면 즉시 호출합니다.
     *
     * @param callback close 콜백
     */
    void onClose(Runnable callback);
}
