/**
 * 결과 집계 패키지.
 *
 * @since 1.0.0
 * @author Agentica Team
 */
package com.ryuqq.agentica.core.aggregate;
