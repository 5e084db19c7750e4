package com.ryuqq.coordinator.core.outcome;

import com.ryuqq.coordinator.core.model.BusinessResponse;

/**
 * 성공적으로 처리된 command.
 *
 * @param response coordinator 응답
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record Accepted(BusinessResponse response) implements CommandOutcome {

    public Accepted {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }
}
