/**
 * Core domain model package: covers, command/event books and component descriptors.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coordinator.core.model.RootId} - Opaque aggregate root identifier</li>
 *   <li>{@link com.ryuqq.coordinator.core.model.Cover} - (domain, root, correlation id) header</li>
 *   <li>{@link com.ryuqq.coordinator.core.model.TypedPayload} - Schema-typed discriminated message</li>
 * </ul>
 *
 * <h2>Books</h2>
 * <ul>
 *   <li>{@link com.ryuqq.coordinator.core.model.CommandBook} - Ordered command pages with a merge strategy</li>
 *   <li>{@link com.ryuqq.coordinator.core.model.EventBook} - Snapshot plus ordered event pages for one root</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> records with defensive copies of lists and byte arrays</li>
 *   <li><strong>Validation:</strong> compact constructors reject null and negative values</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Coordinator Team
 */
package com.ryuqq.coordinator.core.model;
