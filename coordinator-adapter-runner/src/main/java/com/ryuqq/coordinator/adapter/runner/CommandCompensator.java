package com.ryuqq.coordinator.adapter.runner;

import com.ryuqq.coordinator.application.coordinator.CommandExecutor;
import com.ryuqq.coordinator.core.codec.PayloadCodec;
import com.ryuqq.coordinator.core.codec.TypeRegistry;
import com.ryuqq.coordinator.core.model.CommandBook;
import com.ryuqq.coordinator.core.model.CommandOrigin;
import com.ryuqq.coordinator.core.model.CommandPage;
import com.ryuqq.coordinator.core.model.Cover;
import com.ryuqq.coordinator.core.model.RevokeEventCommand;
import com.ryuqq.coordinator.core.outcome.Accepted;
import com.ryuqq.coordinator.core.outcome.CommandOutcome;
import com.ryuqq.coordinator.core.outcome.Rejected;
import com.ryuqq.coordinator.core.outcome.Retryable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 거부된 saga/process manager command의 보상기.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * compensate(rejectedCommand, reason)
 *   1. origin.triggeringCover 없음 → 보상 불가
 *   2. RevokeEventCommand를 AutoResequence page로 원인 aggregate에 전송
 *   3. Accepted → 보상 완료 / 그 외 → 보상 실패 사유 반환 (호출자가 DLQ로 기록)
 * </pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public final class CommandCompensator {

    private static final Logger log = LoggerFactory.getLogger(CommandCompensator.class);

    private static final PayloadCodec REVOKE_CODEC = new PayloadCodec(TypeRegistry.builder()
        .register(RevokeEventCommand.TYPE_NAME, RevokeEventCommand.class)
        .build());

    private final CommandExecutor executor;

    public CommandCompensator(CommandExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.executor = executor;
    }

    /**
     * 원인 aggregate에 revoke command를 보내 보상 시도.
     *
     * @param rejected 거부된 command
     * @param reason 거부 사유
     * @return 보상에 실패한 경우 그 사유, 보상이 완료되면 빈 값
     */
    public Optional<String> compensate(CommandBook rejected, String reason) {
        Optional<CommandBook> revoke = revokeCommand(rejected, reason);
        if (revoke.isEmpty()) {
            return Optional.of("no triggering aggregate to compensate");
        }
        Cover target = revoke.get().cover();
        CommandOutcome outcome = executor.execute(revoke.get());
        if (outcome instanceof Accepted) {
            log.info("Compensated rejected command to {} on {}", rejected.cover().cacheKey(), target.cacheKey());
            return Optional.empty();
        }
        String failure = outcome instanceof Rejected refused ? refused.reason() : ((Retryable) outcome).reason();
        log.warn("Compensation of rejected command to {} on {} failed: {}",
            rejected.cover().cacheKey(), target.cacheKey(), failure);
        return Optional.of(failure);
    }

    /**
     * 원인 aggregate로 보낼 revoke command 생성.
     *
     * @param rejected 거부된 command
     * @param reason 거부 사유
     * @return revoke command (출처 정보가 없으면 빈 값)
     */
    Optional<CommandBook> revokeCommand(CommandBook rejected, String reason) {
        CommandOrigin origin = rejected.origin();
        if (origin == null || !origin.canCompensate()) {
            return Optional.empty();
        }
        Cover target = origin.triggeringCover();
        if (!target.hasCorrelationId() && rejected.cover().hasCorrelationId()) {
            target = target.withCorrelationId(rejected.cover().correlationId());
        }
        RevokeEventCommand revoke = new RevokeEventCommand(
            origin.componentName(),
            origin.componentKind(),
            origin.triggeringSequence(),
            reason,
            rejected.cover().domain(),
            rejected.primaryPage().command().getTypeUrl()
        );
        return Optional.of(CommandBook.of(target, CommandPage.autoResequence(REVOKE_CODEC.pack(revoke), null)));
    }
}
