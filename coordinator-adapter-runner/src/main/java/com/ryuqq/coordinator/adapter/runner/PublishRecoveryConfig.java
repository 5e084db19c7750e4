package com.ryuqq.coordinator.adapter.runner;

/**
 * PublishRecoverer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 5000ms), 스케줄러가 참조</li>
 *   <li>batchSize: 한 번의 scan에서 재발행할 최대 book 수 (기본 100)</li>
 *   <li>maxAttempts: DLQ로 보내기 전 재발행 시도 횟수 (기본 5)</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수)
 * @param batchSize 배치 크기 (1 이상)
 * @param maxAttempts 최대 재발행 시도 횟수 (1 이상)
 */
public record PublishRecoveryConfig(long scanIntervalMs, int batchSize, int maxAttempts) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=5000ms, batchSize=100, maxAttempts=5</p>
     */
    public PublishRecoveryConfig() {
        this(5000, 100, 5);
    }

    public PublishRecoveryConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
    }

    public PublishRecoveryConfig withScanIntervalMs(long scanIntervalMs) {
        return new PublishRecoveryConfig(scanIntervalMs, batchSize, maxAttempts);
    }

    public PublishRecoveryConfig withBatchSize(int batchSize) {
        return new PublishRecoveryConfig(scanIntervalMs, batchSize, maxAttempts);
    }

    public PublishRecoveryConfig withMaxAttempts(int maxAttempts) {
        return new PublishRecoveryConfig(scanIntervalMs, batchSize, maxAttempts);
    }
}
