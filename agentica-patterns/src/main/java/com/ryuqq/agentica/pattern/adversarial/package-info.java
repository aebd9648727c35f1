/**
 * Adversarial 패턴: advocate / adversary 토론과 선택적 판정.
 */
package com.ryuqq.agentica.pattern.adversarial;
