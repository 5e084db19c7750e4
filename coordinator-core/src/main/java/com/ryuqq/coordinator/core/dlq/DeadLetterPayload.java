package com.ryuqq.coordinator.core.dlq;

import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.EventBook;

/**
 * Dead letter로 보내진 실패 payload.
 *
 * <ul>
 *   <li>{@link RejectedCommand}: 처리되지 못한 command book</li>
 *   <li>{@link RejectedEvents}: 저장 또는 발행되지 못한 event book</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public sealed interface DeadLetterPayload permits DeadLetterPayload.RejectedCommand, DeadLetterPayload.RejectedEvents {

    /**
     * 거부된 command.
     *
     * @param command command book
     */
    record RejectedCommand(CommandBook command) implements DeadLetterPayload {

        public RejectedCommand {
            if (command == null) {
                throw new IllegalArgumentException("command cannot be null");
            }
        }
    }

    /**
     * 처리되지 못한 event.
     *
     * @param events event book
     */
    record RejectedEvents(EventBook events) implements DeadLetterPayload {

        public RejectedEvents {
            if (events == null) {
                throw new IllegalArgumentException("events cannot be null");
            }
        }
    }
}
