/**
 * Hierarchical 패턴 (coordinator / specialist).
 *
 * <p>분해 결과는 {@link com.ryuqq.agentica.pattern.hierarchical.Subtask} 또는
 * {@code specialist}/{@code task} 키를 가진 Map으로 받습니다.</p>
 */
package com.ryuqq.agentica.pattern.hierarchical;
