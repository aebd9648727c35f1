package com.ryuqq.agentica.core.concurrent;

/**
 * 동시 실행 묶음의 실패 처리 방식.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public enum FailureMode {

    /**
     * 첫 실패 시 나머지 작업을 인터럽트로 취소하고, 그때까지 관측된 실패를 묶어서 던집니다.
     */
    FAIL_FAST,

    /**
     * 모든 작업을 끝까지 실행하고, 실패는 결과 리스트의 값({@link TaskResult.Failed})으로 반환합니다.
     */
    PARTIAL
}
