/**
 * GeneratorCritic 패턴: HandoffState 기반 생성/비평 반복.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
package com.ryuqq.agentica.pattern.generatorcritic;
