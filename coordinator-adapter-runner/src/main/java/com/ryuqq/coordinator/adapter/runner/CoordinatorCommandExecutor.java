package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.coordinator.CommandCoordinator;
import com.ryuqq.coordinator.application.coordinator.CommandExecutor;
import com.ryuqq.coordinator.core.dlq.DeadLetter;
import com.ryuqq.coordinator.core.error.CoordinatorException;
import com.ryuqq.coordinator.core.error.ErrorKind;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.outcome.Accepted;
import com.ryuqq.coordinator.core.outcome.CommandOutcome;
import com.ryuqq.coordinator.core.outcome.Rejected;
import com.ryuqq.coordinator.core.outcome.Retryable;

/**
 * In-process CommandExecutor.
 *
 * <p>CommandCoordinator 예외를 Outcome으로 변환합니다.</p>
 * <ul>
 *   <li>성공 → Accepted</li>
 *   <li>재시도 가능한 오류 (SequenceConflict, TransientInfra) → Retryable</li>
 *   <li>그 밖의 CoordinatorException → Rejected</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class CoordinatorCommandExecutor implements CommandExecutor {

    private final CommandCoordinator coordinator;

    public CoordinatorCommandExecutor(CommandCoordinator coordinator) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        this.coordinator = coordinator;
    }

    @Override
    public CommandOutcome execute(CommandBook command) {
        try {
            return new Accepted(coordinator.handle(command));
        } catch (CoordinatorException e) {
            if (e.isRetryable()) {
                return new Retryable(DeadLetter.describe(e), null);
            }
            return new Rejected(e.getKind(), DeadLetter.describe(e));
        } catch (IllegalArgumentException e) {
            return new Rejected(ErrorKind.VALIDATION_REJECTED, DeadLetter.describe(e));
        }
    }
}
