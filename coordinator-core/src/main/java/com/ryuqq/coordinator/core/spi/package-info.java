/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Storage, bus, business logic and dead-letter transports are external collaborators.
 * Adapter modules (e.g., coordinator-adapter-inmemory) implement these interfaces.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coordinator.core.spi.EventStore} - Append-only event log with atomic compare-and-append</li>
 *   <li>{@link com.ryuqq.coordinator.core.spi.SnapshotStore} - Latest snapshot per root</li>
 *   <li>{@link com.ryuqq.coordinator.core.spi.EventBus} - At-least-once publication of committed books</li>
 *   <li>{@link com.ryuqq.coordinator.core.spi.BusinessLogicClient} - Computes candidate events per domain</li>
 *   <li>{@link com.ryuqq.coordinator.core.spi.DeadLetterSink} - Receives commands and events that could not be processed</li>
 *   <li>{@link com.ryuqq.coordinator.core.spi.SyncProjector} - Projection computed inside the command request</li>
 * </ul>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Concurrency Control:</strong> EventStore.add must validate and write atomically per root</li>
 *   <li><strong>Errors:</strong> throw SequenceConflictException for conflicts, StorageException/PublishException otherwise</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Coordinator Team
 */
package com.ryuqq.coordinator.core.spi;
