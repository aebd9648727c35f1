/**
 * Swarm 패턴: 관점별 병렬 실행 후 집계.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
package com.ryuqq.agentica.pattern.swarm;
