package com.ryuqq.coordinator.adapter.runner;

/**
 * EventDispatchRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: saga/process manager 처리 스레드 수 (기본 4)</li>
 *   <li>dedupCapacity: 중복 수신 판별용으로 기억하는 최근 book 수 (기본 10000)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중 작업 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>높은 처리량: concurrency 증가</li>
 *   <li>재전달이 잦은 버스: dedupCapacity 증가</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 * @param concurrency 처리 스레드 수 (1 이상)
 * @param dedupCapacity 중복 판별 용량 (1 이상)
 * @param shutdownTimeoutMs 종료 대기 (밀리초, 양수)
 */
public record DispatchConfig(int concurrency, int dedupCapacity, long shutdownTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, dedupCapacity=10000, shutdownTimeoutMs=30000ms</p>
     */
    public DispatchConfig() {
        this(4, 10_000, 30_000);
    }

    public DispatchConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (dedupCapacity <= 0) {
            throw new IllegalArgumentException(
                "dedupCapacity must be positive (current: " + dedupCapacity + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public DispatchConfig withConcurrency(int concurrency) {
        return new DispatchConfig(concurrency, dedupCapacity, shutdownTimeoutMs);
    }

    public DispatchConfig withDedupCapacity(int dedupCapacity) {
        return new DispatchConfig(concurrency, dedupCapacity, shutdownTimeoutMs);
    }

    public DispatchConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new DispatchConfig(concurrency, dedupCapacity, shutdownTimeoutMs);
    }
}
