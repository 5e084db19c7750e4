package com.ryuqq.coordinator.core.model;

/**
 * Handler 컴포넌트 종류.
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public enum ComponentKind {

    /** Command를 받아 event를 생성하는 aggregate */
    AGGREGATE,

    /** 한 도메인의 event에 반응하여 다른 도메인으로 command를 발행 */
    SAGA,

    /** Event로부터 read model을 만드는 projector */
    PROJECTOR,

    /** 자체 state를 가진 saga */
    PROCESS_MANAGER
}
