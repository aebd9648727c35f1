package com.ryuqq.agentica.core.agent;

import java.util.UUID;

/**
 * 패턴 인스턴스 ID 생성기.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class PatternIds {

    private static final int LENGTH = 12;

    private PatternIds() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * 새 ID 생성.
     *
     * @return 12자리 소문자 16진수 문자열
     */
    public static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, LENGTH);
    }
}
