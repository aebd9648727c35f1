package com.ryuqq.agentica.pattern.blackboard;

/**
 * 블랙보드 쓰기 이력 항목.
 *
 * @param key 키
 * @param value 기록된 값
 * @param writer 기록 주체 (specialist premise 또는 "query")
 */
public record BlackboardChange(String key, Object value, String writer) {
}
