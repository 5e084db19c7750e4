package com.ryuqq.coordinator.adapter.runner;

/**
 * SagaOrchestrator / ProcessManagerOrchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: Retryable 결과와 계획 단계 일시 장애에 대한 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelayMs / maxDelayMs: 재시도 backoff (기본 10ms / 500ms)</li>
 *   <li>fetchTimeoutMs: 대상 이력 병렬 조회 제한 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 대기 (밀리초, 양수)
 * @param maxDelayMs 대기 상한 (밀리초, baseDelayMs 이상)
 * @param fetchTimeoutMs 조회 제한 시간 (밀리초, 양수)
 */
public record SagaConfig(int maxAttempts, long baseDelayMs, long maxDelayMs, long fetchTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelayMs=10ms, maxDelayMs=500ms, fetchTimeoutMs=5000ms</p>
     */
    public SagaConfig() {
        this(3, 10, 500, 5000);
    }

    public SagaConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (current: " + maxDelayMs + " < " + baseDelayMs + ")"
            );
        }
        if (fetchTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "fetchTimeoutMs must be positive (current: " + fetchTimeoutMs + ")"
            );
        }
    }

    /**
     * 계획 단계(prepare/조회/dispatch)의 일시 장애 재시도 설정.
     *
     * @return 같은 시도 횟수와 backoff를 쓰는 RetryConfig
     */
    public RetryConfig retryConfig() {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, 0.5);
    }

    public SagaConfig withMaxAttempts(int maxAttempts) {
        return new SagaConfig(maxAttempts, baseDelayMs, maxDelayMs, fetchTimeoutMs);
    }

    public SagaConfig withBaseDelayMs(long baseDelayMs) {
        return new SagaConfig(maxAttempts, baseDelayMs, maxDelayMs, fetchTimeoutMs);
    }

    public SagaConfig withMaxDelayMs(long maxDelayMs) {
        return new SagaConfig(maxAttempts, baseDelayMs, maxDelayMs, fetchTimeoutMs);
    }

    public SagaConfig withFetchTimeoutMs(long fetchTimeoutMs) {
        return new SagaConfig(maxAttempts, baseDelayMs, maxDelayMs, fetchTimeoutMs);
    }
}
