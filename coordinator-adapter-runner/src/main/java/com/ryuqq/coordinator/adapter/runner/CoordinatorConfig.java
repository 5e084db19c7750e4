package com.ryuqq.coordinator.adapter.runner;

/**
 * DefaultCommandCoordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>snapshotWriteEnabled: commit 후 snapshot 저장 여부 (기본 false)</li>
 *   <li>snapshotEvery: snapshot 간격, commit이 이 배수 경계를 넘을 때 저장 (기본 1 = 매 commit)</li>
 *   <li>syncProjectionEnabled: 동기 projector 실행 여부 (기본 true)</li>
 * </ul>
 *
 * @author Coordinator Team
 * @since 1.0.0
 * @param snapshotWriteEnabled snapshot 저장 여부
 * @param snapshotEvery snapshot 간격 (1 이상)
 * @param syncProjectionEnabled 동기 projector 실행 여부
 */
public record CoordinatorConfig(boolean snapshotWriteEnabled, int snapshotEvery, boolean syncProjectionEnabled) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: snapshotWriteEnabled=false, snapshotEvery=1, syncProjectionEnabled=true</p>
     */
    public CoordinatorConfig() {
        this(false, 1, true);
    }

    public CoordinatorConfig {
        if (snapshotEvery <= 0) {
            throw new IllegalArgumentException(
                "snapshotEvery must be positive (current: " + snapshotEvery + ")"
            );
        }
    }

    public CoordinatorConfig withSnapshotWriteEnabled(boolean snapshotWriteEnabled) {
        return new CoordinatorConfig(snapshotWriteEnabled, snapshotEvery, syncProjectionEnabled);
    }

    public CoordinatorConfig withSnapshotEvery(int snapshotEvery) {
        return new CoordinatorConfig(snapshotWriteEnabled, snapshotEvery, syncProjectionEnabled);
    }

    public CoordinatorConfig withSyncProjectionEnabled(boolean syncProjectionEnabled) {
        return new CoordinatorConfig(snapshotWriteEnabled, snapshotEvery, syncProjectionEnabled);
    }
}
