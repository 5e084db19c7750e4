package com.ryuqq.coordinator.adapter.runner;

/**
 * TransientRetrier 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelayMs: 첫 재시도 전 기본 대기 (기본 20ms)</li>
 *   <li>maxDelayMs: 대기 상한 (기본 1000ms)</li>
 *   <li>jitterFactor: 지터 비율 0.0~1.0 (기본 0.5)</li>
 * </ul>
 *
 * <p>저장소/버스의 일시 장애(TransientInfra)에만 적용됩니다. 비즈니스 거부는 재시도하지 않습니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 대기 (밀리초, 양수)
 * @param maxDelayMs 대기 상한 (밀리초, baseDelayMs 이상)
 * @param jitterFactor 지터 비율
 */
public record RetryConfig(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterFactor) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelayMs=20ms, maxDelayMs=1000ms, jitterFactor=0.5</p>
     */
    public RetryConfig() {
        this(3, 20, 1000, 0.5);
    }

    public RetryConfig {
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
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryConfig withBaseDelayMs(long baseDelayMs) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryConfig withMaxDelayMs(long maxDelayMs) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public RetryConfig withJitterFactor(double jitterFactor) {
        return new RetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
