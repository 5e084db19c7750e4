package com.ryuqq.coordinator.application.sequencing;

/**
 * SequencingEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: compare-and-append 최대 시도 횟수 (기본 8)</li>
 *   <li>baseDelayMs: 충돌 후 첫 대기 시간 (기본 5ms)</li>
 *   <li>maxDelayMs: 대기 시간 상한 (기본 200ms)</li>
 *   <li>jitterFactor: jitter 비율 (기본 0.5)</li>
 * </ul>
 *
 * <p>maxAttempts는 AutoResequence 루프와 Explicit 병합 경로의 경쟁(race) 재시도에 모두 적용됩니다.
 * 상한에 도달하면 무한히 반복하지 않고 충돌을 호출자에게 보고합니다.</p>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param baseDelayMs 기본 대기 시간 (밀리초, 양수)
 * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record SequencingConfig(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterFactor) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=8, baseDelayMs=5, maxDelayMs=200, jitterFactor=0.5</p>
     */
    public SequencingConfig() {
        this(8, 5, 200, 0.5);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SequencingConfig {
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
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    public SequencingConfig withMaxAttempts(int maxAttempts) {
        return new SequencingConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public SequencingConfig withBaseDelayMs(long baseDelayMs) {
        return new SequencingConfig(maxAttempts, baseDelayMs, Math.max(maxDelayMs, baseDelayMs), jitterFactor);
    }

    public SequencingConfig withMaxDelayMs(long maxDelayMs) {
        return new SequencingConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    public SequencingConfig withJitterFactor(double jitterFactor) {
        return new SequencingConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }
}
