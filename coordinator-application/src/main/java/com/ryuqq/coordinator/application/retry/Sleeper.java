package com.ryuqq.coordinator.application.retry;

/**
 * 재시도 대기 추상화.
 *
 * <p>테스트에서는 실제로 잠들지 않는 구현으로 교체합니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /** Thread.sleep 기반 기본 구현. */
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
