/**
 * 패턴 실행 예외 계층.
 *
 * <p>분류:</p>
 * <ul>
 *   <li><strong>생성 오류:</strong> {@link java.lang.IllegalArgumentException} (생성자에서 즉시)</li>
 *   <li><strong>합의 실패:</strong> 호출자가 복구 가능 (다른 모드로 재판정 등)</li>
 *   <li><strong>라우트 없음:</strong> 설정 버그, 재시도 불가</li>
 *   <li><strong>참여자 실패:</strong> fail-fast는 즉시 전파, partial은 값으로 흡수</li>
 *   <li><strong>집계/타입 오류:</strong> 데이터 버그</li>
 * </ul>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
package com.ryuqq.agentica.core.exception;
