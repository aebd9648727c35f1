package com.ryuqq.agentica.core.agent;

import java.util.ArrayList;
import java.util.List;

/**
 * 구조화된 premise 문자열 빌더.
 *
 * <p>역할, 과제, 해야 할 일, 하지 말아야 할 일, 예시를 일정한 섹션 형식으로 렌더링합니다.
 * 항목은 trim되고, 줄바꿈은 공백으로 치환되며, 빈 항목은 버려집니다.</p>
 *
 * <p><strong>출력 형식:</strong></p>
 * <pre>
 * ROLE: Security reviewer
 *
 * TASK: Find injection flaws
 *
 * DO:
 * - Cite line numbers
 *
 * DON'T:
 * - Rewrite the code
 * </pre>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class PremiseBuilder {

    private String role;
    private String task;
    private final List<String> dos = new ArrayList<>();
    private final List<String> donts = new ArrayList<>();
    private final List<String> examples = new ArrayList<>();

    private PremiseBuilder() {
    }

    public static PremiseBuilder builder() {
        return new PremiseBuilder();
    }

    /**
     * 한 번에 premise 렌더링.
     *
     * @param role 역할 (필수)
     * @param task 과제 (필수)
     * @param dos 해야 할 일 (null 허용)
     * @param donts 하지 말아야 할 일 (null 허용)
     * @param examples 예시 (null 허용)
     * @return 섹션 형식 문자열
     */
    public static String build(String role, String task, List<String> dos, List<String> donts,
                               List<String> examples) {
        return builder()
            .role(role)
            .task(task)
            .doing(toArray(dos))
            .avoiding(toArray(donts))
            .example(toArray(examples))
            .build();
    }

    private static String[] toArray(List<String> items) {
        return items == null ? null : items.toArray(new String[0]);
    }

    public PremiseBuilder role(String role) {
        this.role = role;
        return this;
    }

    public PremiseBuilder task(String task) {
        this.task = task;
        return this;
    }

    public PremiseBuilder doing(String... items) {
        addAll(dos, items);
        return this;
    }

    public PremiseBuilder avoiding(String... items) {
        addAll(donts, items);
        return this;
    }

    public PremiseBuilder example(String... items) {
        addAll(examples, items);
        return this;
    }

    /**
     * premise 렌더링.
     *
     * @return 섹션 형식 문자열
     * @throws IllegalArgumentException role 또는 task가 비어 있는 경우
     */
    public String build() {
        String cleanRole = sanitize(role);
        String cleanTask = sanitize(task);
        if (cleanRole == null) {
            throw new IllegalArgumentException("role cannot be null or blank");
        }
        if (cleanTask == null) {
            throw new IllegalArgumentException("task cannot be null or blank");
        }

        StringBuilder sb = new StringBuilder();
        sb.append("ROLE: ").append(cleanRole);
        sb.append("\n\nTASK: ").append(cleanTask);
        appendSection(sb, "DO", dos);
        appendSection(sb, "DON'T", donts);
        appendSection(sb, "EXAMPLES", examples);
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String title, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("\n\n").append(title).append(':');
        for (String item : items) {
            sb.append("\n- ").append(item);
        }
    }

    private static void addAll(List<String> target, String[] items) {
        if (items == null) {
            return;
        }
        for (String item : items) {
            String clean = sanitize(item);
            if (clean != null) {
                target.add(clean);
            }
        }
    }

    private static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        String flattened = value.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').trim();
        return flattened.isEmpty() ? null : flattened;
    }
}
