package com.ryuqq.coordinator.core.model;

/**
 * Command page별 sequence 충돌 해결 전략.
 *
 * <ul>
 *   <li>{@link #EXPLICIT}: 호출자가 지정한 sequence를 검증. 불일치 시 변경 필드가 겹치지 않으면 병합</li>
 *   <li>{@link #AUTO_RESEQUENCE}: 지정된 sequence 무시, 항상 현재 tip에 추가 (재시도 루프)</li>
 *   <li>{@link #FORCE}: sequence 검증 생략. 연속성 불변식이 의도적으로 완화됨</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public enum MergeStrategy {

    EXPLICIT,

    AUTO_RESEQUENCE,

    /**
     * Out-of-band 사실 정정용 강제 기록.
     *
     * <p>Forced page는 저장소에 forced 표시와 함께 기록되며, 해당 root의
     * sequence 연속성(0부터 빈틈/중복 없음)이 보장되지 않습니다. 하위 reader는
     * {@link EventPage#forced()}를 확인해야 합니다.</p>
     */
    FORCE
}
