package com.ryuqq.coordinator.application.coordinator;

import com.ryuqq.coordinator.core.model.BusinessResponse;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.EventBook;

/**
 * Command 처리 진입점.
 *
 * <p>이전 이력을 읽고, business logic으로 후보 event를 계산하고, sequence를 확정하여
 * 저장/발행한 뒤 호출자 응답을 만듭니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CommandBook command = CommandBook.of(
 *     Cover.of("customer", RootId.random()),
 *     CommandPage.explicit(codec.pack(new CreateCustomer("Ann", "a@x.com")), 0));
 *
 * BusinessResponse response = coordinator.handle(command);
 * EventBook committed = response.events();   // sequence 0, CustomerCreated
 * </pre>
 *
 * <p><strong>오류:</strong></p>
 * <ul>
 *   <li>ValidationRejectedException: 비즈니스 거부 (사유 그대로 전달)</li>
 *   <li>SequenceConflictException: 해결되지 않은 충돌</li>
 *   <li>UnknownHandlerException: 처리할 수 없는 command 타입 또는 도메인</li>
 *   <li>DecodeFailureException: 잘못된 command 또는 후보 event payload</li>
 *   <li>TransientInfraException: 재시도 예산을 소진한 저장소 장애</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public interface CommandCoordinator {

    /**
     * Command 처리.
     *
     * @param priorEvents 호출자가 가진 이전 이력 (null이면 저장소에서 조회)
     * @param command 처리할 command book
     * @return commit된 event와 동기 projection
     */
    BusinessResponse handle(EventBook priorEvents, CommandBook command);

    /**
     * 저장소에서 이력을 조회하여 command 처리.
     *
     * @param command 처리할 command book
     * @return commit된 event와 동기 projection
     */
    default BusinessResponse handle(CommandBook command) {
        return handle(null, command);
    }

    /**
     * 특정 시점의 state에 대해 command를 시험 실행.
     *
     * <p>아무것도 저장하거나 발행하지 않습니다.</p>
     *
     * @param command 시험할 command book
     * @param asOfSequence 포함할 마지막 sequence (음수면 현재 이력 전체)
     * @return 예상 event (저장되지 않음)
     */
    BusinessResponse dryRun(CommandBook command, long asOfSequence);
}
