package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.retry.BackoffCalculator;
import com.ryuqq.coordinator.application.retry.Sleeper;
import com.ryuqq.coordinator.core.error.TransientInfraException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 일시 장애(TransientInfra) 재시도기.
 *
 * <p>{@link TransientInfraException}만 재시도하며, 그 밖의 예외(비즈니스 거부, sequence 충돌 등)는
 * 즉시 전파합니다. 재시도 사이에는 {@link BackoffCalculator}의 지수 backoff + jitter만큼 대기합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * attempt 1..maxAttempts:
 *   action 실행 → 성공 시 반환
 *   TransientInfraException → 마지막 시도면 전파, 아니면 backoff 대기 후 재시도
 * </pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class TransientRetrier {

    private static final Logger log = LoggerFactory.getLogger(TransientRetrier.class);

    private final RetryConfig config;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    public TransientRetrier(RetryConfig config) {
        this(config, Sleeper.THREAD);
    }

    /**
     * 생성자.
     *
     * @param config 재시도 설정
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TransientRetrier(RetryConfig config, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.backoff = new BackoffCalculator(config.baseDelayMs(), config.maxDelayMs(), config.jitterFactor());
        this.sleeper = sleeper;
    }

    /**
     * 결과를 반환하는 작업 실행.
     *
     * @param operation 로그용 작업 이름
     * @param action 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws TransientInfraException 모든 시도가 일시 장애로 실패한 경우 (마지막 예외)
     */
    public <T> T call(String operation, Supplier<T> action) {
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (TransientInfraException e) {
                if (attempt >= config.maxAttempts()) {
                    log.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long delay = backoff.calculate(attempt);
                log.debug("{} failed (attempt {}/{}), retrying in {}ms: {}",
                    operation, attempt, config.maxAttempts(), delay, e.getMessage());
                pause(operation, delay, e);
            }
        }
    }

    /**
     * 결과가 없는 작업 실행.
     *
     * @param operation 로그용 작업 이름
     * @param action 실행할 작업
     * @throws TransientInfraException 모든 시도가 일시 장애로 실패한 경우
     */
    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public int maxAttempts() {
        return config.maxAttempts();
    }

    private void pause(String operation, long delay, TransientInfraException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            TransientInfraException interrupted = new TransientInfraException(operation + " interrupted while retrying", e);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }
}
