/**
 * 동시 실행 패키지.
 *
 * <p>{@link com.ryuqq.agentica.core.concurrent.TaskGroup}은 fail-fast와 partial-results 두 모드를
 * 하나의 구현으로 제공합니다. JDK 17에는 구조화된 동시성 API가 없으므로 ExecutorService와
 * 인터럽트 기반 협조적 취소로 구성합니다.</p>
 *
 * @since 1.0.0
 * @author Agentica Team
 */
package com.ryuqq.agentica.core.concurrent;
