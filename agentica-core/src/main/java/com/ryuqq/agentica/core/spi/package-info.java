/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented outside the core to plug in an LLM backend and an
 * observability sink.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.agentica.core.spi.AgentRuntime} - creates agent handles</li>
 *   <li>{@link com.ryuqq.agentica.core.spi.AgentHandle} - invokes a single agent</li>
 *   <li>{@link com.ryuqq.agentica.core.spi.AgentTracker} - observes every spawn</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g. agentica-adapter-inmemory) and the testkit's scripted runtime
 * provide concrete implementations.</p>
 *
 * @since 1.0.0
 * @author Agentica Team
 */
package com.ryuqq.agentica.core.spi;
