package com.ryuqq.agentica.pattern.adversarial;

/**
 * 토론 참가자 역할.
 */
public enum DebateRole {
    ADVOCATE("advocate"),
    ADVERSARY("adversary");

    private final String value;

    DebateRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
