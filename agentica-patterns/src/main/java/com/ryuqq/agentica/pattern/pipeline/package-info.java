/**
 * Pipeline 패턴.
 *
 * <p>단계는 {@link com.ryuqq.agentica.pattern.pipeline.Stage} 람다 또는
 * 에이전트 기반 {@link com.ryuqq.agentica.pattern.pipeline.AgentStage}입니다.</p>
 */
package com.ryuqq.agentica.pattern.pipeline;
