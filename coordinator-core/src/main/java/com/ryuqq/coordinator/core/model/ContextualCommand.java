package com.ryuqq.coordinator.core.model;

/**
 * Business logic에 전달되는 입력.
 *
 * <p>Aggregate의 이전 이력과 처리할 command를 함께 담습니다.</p>
 *
 * @param events 이전 event 이력 (snapshot 포함 가능)
 * @param command 처리할 command book
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record ContextualCommand(EventBook events, CommandBook command) {

    public ContextualCommand {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
    }
}
