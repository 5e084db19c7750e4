package com.ryuqq.coordinator.application.router;

import com.ryuqq.coordinator.core.model.CommandPage;

import java.util.List;

/**
 * Aggregate command handler.
 *
 * <p>Handler는 입력만으로 결과가 결정되는 순수 함수여야 합니다 (숨겨진 I/O 금지).
 * AutoResequence 재시도 시 같은 command로 여러 번 호출될 수 있기 때문입니다.</p>
 *
 * <p><strong>결과:</strong></p>
 * <ul>
 *   <li>성공: 생성할 event 객체 목록 (순서대로 nextSequence부터 번호가 매겨짐)</li>
 *   <li>거부: {@code ValidationRejectedException} throw</li>
 * </ul>
 *
 * @param <S> aggregate state 타입
 * @param <C> command 타입
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandHandler<S, C> {

    /**
     * Command 처리.
     *
     * @param page 원본 command page
     * @param command decode된 command
     * @param state 재구성된 현재 state
     * @param nextSequence 첫 번째 event가 사용할 sequence
     * @return 생성할 event 목록 (비어 있을 수 있음)
     */
    List<?> handle(CommandPage page, C command, S state, long nextSequence);
}
