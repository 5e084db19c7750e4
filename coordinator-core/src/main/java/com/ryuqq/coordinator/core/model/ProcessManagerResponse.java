package com.ryuqq.coordinator.core.model;

import java.util.List;

/**
 * Process manager 처리 결과.
 *
 * <p>다른 도메인으로 보낼 command와, process manager 자신의 도메인에 저장할
 * event를 분리합니다. 두 결과는 서로 다른 경로(발행 vs 저장)로 처리됩니다.</p>
 *
 * @param commands 다른 도메인으로 발행할 command 목록
 * @param processEvents 자신의 도메인에 저장할 event (없으면 null)
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record ProcessManagerResponse(List<CommandBook> commands, EventBook processEvents) {

    public ProcessManagerResponse {
        commands = commands == null ? List.of() : List.copyOf(commands);
    }

    public boolean hasProcessEvents() {
        return processEvents != null && !processEvents.isEmpty();
    }
}
