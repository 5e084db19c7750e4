package com.ryuqq.coordinator.core.outcome;

import com.ryuqq.coordinator.core.error.ErrorKind;

/**
 * 재시도 불가능한 거부.
 *
 * @param kind 오류 분류
 * @param reason 사람이 읽을 수 있는 사유
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record Rejected(ErrorKind kind, String reason) implements CommandOutcome {

    public Rejected {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }
}
