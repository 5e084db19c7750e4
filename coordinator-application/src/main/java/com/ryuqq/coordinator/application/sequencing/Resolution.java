package com.ryuqq.coordinator.application.sequencing;

/**
 * Sequence 확정 방식.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public enum Resolution {

    /** 기대 sequence가 tip과 일치하여 그대로 추가 */
    DIRECT,

    /** 기대 sequence가 오래되었지만 변경 필드가 겹치지 않아 tip으로 재지정 */
    MERGED,

    /** AutoResequence: 호출자의 이력이 오래되었거나 충돌하여 최신 이력으로 handler를 다시 실행하여 추가 */
    RESEQUENCED,

    /** Force: sequence 검증 없이 기록 */
    FORCED,

    /** Handler가 event를 만들지 않아 기록할 것이 없음 */
    NO_EVENTS
}
