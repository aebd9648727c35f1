/**
 * 가중 합의 패키지.
 *
 * <p>{@link com.ryuqq.agentica.core.consensus.Consensus}는 Jury 패턴의 결정 규칙이며,
 * 단독으로도 사용할 수 있습니다.</p>
 *
 * @since 1.0.0
 * @author Agentica Team
 */
package com.ryuqq.agentica.core.consensus;
