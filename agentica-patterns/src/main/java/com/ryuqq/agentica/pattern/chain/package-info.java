/**
 * ChainOfResponsibility 패턴.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
package com.ryuqq.agentica.pattern.chain;
