package com.ryuqq.agentica.core.agent;

import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import com.ryuqq.agentica.core.spi.AgentRuntime;
import com.ryuqq.agentica.core.spi.AgentTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 패턴이 에이전트를 생성하는 단일 진입점.
 *
 * <p>{@link AgentRuntime}으로 핸들을 만들고, 설정된 경우 {@link AgentTracker}에
 * {@link SpawnContext}와 함께 기록합니다. 트래커 실패는 경고 로그만 남기고
 * 원래 핸들을 그대로 반환하므로 관측 계층 장애가 패턴 실행을 깨뜨리지 않습니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
public final class AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentFactory.class);

    private final AgentRuntime runtime;
    private final AgentTracker tracker;

    /**
     * 트래커 없이 생성.
     *
     * @param runtime 에이전트 런타임
     */
    public AgentFactory(AgentRuntime runtime) {
        this(runtime, null);
    }

    /**
     * @param runtime 에이전트 런타임 (필수)
     * @param tracker 관측 싱크 (null이면 기록하지 않음)
     * @throws IllegalArgumentException runtime이 null인 경우
     */
    public AgentFactory(AgentRuntime runtime, AgentTracker tracker) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        this.runtime = runtime;
        this.tracker = tracker;
    }

    /**
     * 에이전트 생성.
     *
     * @param spec 에이전트 명세
     * @param context 생성 컨텍스트
     * @return 에이전트 핸들 (트래커가 감싼 핸들일 수 있음)
     * @throws IllegalArgumentException spec 또는 context가 null인 경우
     */
    public AgentHandle spawn(AgentSpec spec, SpawnContext context) {
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        AgentHandle handle = runtime.create(spec);
        log.debug("Spawned {} for {} {} as {}",
            handle.agentId(), context.patternType().value(), context.patternId(), context.role());

        if (tracker == null) {
            return handle;
        }
        try {
            AgentHandle tracked = tracker.record(context, spec, handle);
            return tracked != null ? tracked : handle;
        } catch (RuntimeException e) {
            log.warn("Agent tracker failed for {} in {} {}, continuing untracked",
                handle.agentId(), context.patternType().value(), context.patternId(), e);
            return handle;
        }
    }

    /**
     * premise만으로 에이전트 생성.
     *
     * @param premise 역할 설명
     * @param context 생성 컨텍스트
     * @return 에이전트 핸들
     */
    public AgentHandle spawn(String premise, SpawnContext context) {
        return spawn(AgentSpec.of(premise), context);
    }

    public AgentRuntime runtime() {
        return runtime;
    }

    public boolean isTracked() {
        return tracker != null;
    }
}
