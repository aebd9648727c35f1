/**
 * Handoff package: structured state passed between sequential agents.
 *
 * <p>{@link com.ryuqq.agentica.core.handoff.HandoffState} is consumed by Pipeline stages and the
 * generator/critic loop.</p>
 *
 * @since 1.0.0
 * @author Agentica Team
 */
package com.ryuqq.agentica.core.handoff;
