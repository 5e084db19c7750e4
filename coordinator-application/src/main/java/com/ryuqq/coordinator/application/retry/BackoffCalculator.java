package com.ryuqq.coordinator.application.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 충돌/일시 장애 재시도 간격 계산기.
 *
 * <p>실패할 때마다 대기 시간을 두 배로 늘리고 상한에서 멈춥니다. 같은 root에서
 * 충돌한 writer들이 같은 순간에 다시 부딪히지 않도록 상향 jitter를 더합니다.</p>
 *
 * <pre>
 * ceiling(n) = min(base * 2^(n-1), max)
 * delay(n)   = min(ceiling(n) * (1 + jitterFactor * r), max),  r ∈ [0, 1)
 * </pre>
 *
 * <p>기본값(10ms, 1000ms, 0.5)이면 1회차 10~15ms, 2회차 20~30ms, 7회차부터 1000ms입니다.</p>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    public BackoffCalculator() {
        this(10, 1000, 0.5);
    }

    /**
     * @param baseDelayMs 첫 실패 후 대기 시간 (양수)
     * @param maxDelayMs 대기 시간 상한 (baseDelayMs 이상)
     * @param jitterFactor 상향 jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (current: " + maxDelayMs + " < " + baseDelayMs + ")");
        }
        if (!(jitterFactor >= 0.0 && jitterFactor <= 1.0)) {
            throw new IllegalArgumentException("jitterFactor must be within [0.0, 1.0] (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * n번째 실패 후 대기할 시간.
     *
     * @param attempt 실패한 시도 번호 (1부터)
     * @return 대기 시간 (밀리초, maxDelayMs 이하)
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        long ceiling = ceiling(attempt);
        if (jitterFactor == 0.0 || ceiling == maxDelayMs) {
            return ceiling;
        }
        double jittered = ceiling * (1.0 + jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min((long) jittered, maxDelayMs);
    }

    private long ceiling(int attempt) {
        long delay = baseDelayMs;
        for (int doublings = attempt - 1; doublings > 0; doublings--) {
            if (delay > maxDelayMs - delay) {
                return maxDelayMs;
            }
            delay <<= 1;
        }
        return Math.min(delay, maxDelayMs);
    }
}
