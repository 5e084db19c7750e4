/**
 * Runner Adapter Layer - runtime 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coordinator.adapter.runner.DefaultCommandCoordinator} - command 처리 파이프라인</li>
 *   <li>{@link com.ryuqq.coordinator.adapter.runner.SagaOrchestrator} - saga 두 단계 실행</li>
 *   <li>{@link com.ryuqq.coordinator.adapter.runner.ProcessManagerOrchestrator} - process manager 실행</li>
 *   <li>{@link com.ryuqq.coordinator.adapter.runner.EventDispatchRunner} - 버스 구독 및 worker pool 분배</li>
 *   <li>{@link com.ryuqq.coordinator.adapter.runner.PublishRecoverer} - 발행 실패 복구</li>
 *   <li>{@link com.ryuqq.coordinator.adapter.runner.EventStreamService} - 클라이언트 event stream</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (DefaultCommandCoordinator, orchestrators)
 *   ↓ implements
 * application (CommandCoordinator, CommandExecutor, routers, SequencingEngine)
 *   ↓ depends on
 * core (model, codec, StateReconstructor, MergeAnalyzer, SPI)
 * </pre>
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
package com.ryuqq.coordinator.adapter.runner;
