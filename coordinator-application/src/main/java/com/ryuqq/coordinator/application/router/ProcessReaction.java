package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.model.CommandBook;

import java.util.List;

/**
 * Process manager handler 결과.
 *
 * <p>다른 도메인으로 보낼 command와 자신의 도메인에 저장할 event 객체를 분리해서 담습니다.</p>
 *
 * @param commands 발행할 command 목록
 * @param events 저장할 process event 객체 목록
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record ProcessReaction(List<CommandBook> commands, List<?> events) {

    public ProcessReaction {
        commands = commands == null ? List.of() : List.copyOf(commands);
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static ProcessReaction none() {
        return new ProcessReaction(List.of(), List.of());
    }

    public static ProcessReaction of(List<CommandBook> commands, List<?> events) {
        return new ProcessReaction(commands, events);
    }
}
