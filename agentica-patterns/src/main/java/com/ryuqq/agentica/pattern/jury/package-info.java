/**
 * Jury 패턴: 배심원 투표와 합의.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
package com.ryuqq.agentica.pattern.jury;
