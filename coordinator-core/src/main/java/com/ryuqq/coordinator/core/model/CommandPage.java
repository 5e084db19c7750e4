package com.ryuqq.coordinator.core.model;

/**
 * 하나의 command page.
 *
 * @param command 판별 payload (command 메시지)
 * @param sequence 호출자가 기대하는 sequence (선택, null이면 지정하지 않음)
 * @param mergeStrategy 충돌 해결 전략
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record CommandPage(
    TypedPayload command,
    Long sequence,
    MergeStrategy mergeStrategy
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException command가 null이거나 sequence가 음수인 경우
     */
    public CommandPage {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (sequence != null && sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
        if (mergeStrategy == null) {
            mergeStrategy = MergeStrategy.EXPLICIT;
        }
    }

    /**
     * EXPLICIT 전략 page 생성.
     *
     * @param command command payload
     * @param sequence 기대 sequence
     * @return CommandPage 인스턴스
     */
    public static CommandPage explicit(TypedPayload command, long sequence) {
        return new CommandPage(command, sequence, MergeStrategy.EXPLICIT);
    }

    /**
     * AUTO_RESEQUENCE 전략 page 생성.
     *
     * @param command command payload
     * @param staleSequence 호출자가 알고 있던 sequence (무시됨, null 가능)
     * @return CommandPage 인스턴스
     */
    public static CommandPage autoResequence(TypedPayload command, Long staleSequence) {
        return new CommandPage(command, staleSequence, MergeStrategy.AUTO_RESEQUENCE);
    }

    /**
     * FORCE 전략 page 생성.
     *
     * @param command command payload
     * @param sequence 기록할 sequence (null이면 현재 tip)
     * @return CommandPage 인스턴스
     */
    public static CommandPage force(TypedPayload command, Long sequence) {
        return new CommandPage(command, sequence, MergeStrategy.FORCE);
    }

    public boolean hasSequence() {
        return sequence != null;
    }
}
