package com.ryuqq.coordinator.application.coordinator;

import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.outcome.CommandOutcome;

/**
 * Saga/process manager가 만든 command를 실행하는 포트.
 *
 * <p>예외를 던지지 않고 {@link CommandOutcome}으로 결과를 돌려줍니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandExecutor {

    CommandOutcome execute(CommandBook command);
}
