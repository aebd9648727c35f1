/**
 * 에이전트 생성 보조 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.agentica.core.agent.AgentFactory} - 런타임 + 트래커 결합</li>
 *   <li>{@link com.ryuqq.agentica.core.agent.PremiseBuilder} - 섹션형 premise 렌더링</li>
 *   <li>{@link com.ryuqq.agentica.core.agent.PatternIds} - 패턴 인스턴스 ID</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Agentica Team
 */
package com.ryuqq.agentica.core.agent;
