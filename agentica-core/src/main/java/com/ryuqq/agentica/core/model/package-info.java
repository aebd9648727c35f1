/**
 * Core model package: value types passed between patterns, the agent runtime and the
 * observability sink.
 *
 * <ul>
 *   <li>{@link com.ryuqq.agentica.core.model.AgentSpec} - premise, model and tool binding of one agent</li>
 *   <li>{@link com.ryuqq.agentica.core.model.ResultShape} - expected result type descriptor</li>
 *   <li>{@link com.ryuqq.agentica.core.model.SpawnContext} - pattern/role correlation for each spawn</li>
 *   <li>{@link com.ryuqq.agentica.core.model.PatternType} - pattern identifiers</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> records with defensive copies</li>
 *   <li><strong>Validation:</strong> compact constructors reject invalid values eagerly</li>
 *   <li><strong>No ambient state:</strong> correlation data is passed explicitly</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Agentica Team
 */
package com.ryuqq.agentica.core.model;
