/**
 * In-memory observability adapter package.
 *
 * <p>{@link com.ryuqq.agentica.adapter.inmemory.tracker.InMemoryAgentTracker} is a reference
 * implementation of {@link com.ryuqq.agentica.core.spi.AgentTracker} that records which agent
 * was created for which pattern and role.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Unbounded: call {@code clear()} between runs</li>
 * </ul>
 *
 * @see com.ryuqq.agentica.core.spi.AgentTracker
 * @author Agentica Team
 * @since 1.0.0
 */
package com.ryuqq.agentica.adapter.inmemory.tracker;
