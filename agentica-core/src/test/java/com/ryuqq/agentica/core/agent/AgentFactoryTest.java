package com.ryuqq.agentica.core.agent;

import com.ryuqq.agentica.core.model.AgentSpec;
import com.ryuqq.agentica.core.model.PatternType;
import com.ryuqq.agentica.core.model.SpawnContext;
import com.ryuqq.agentica.core.spi.AgentHandle;
import com.ryuqq.agentica.core.spi.AgentRuntime;
import com.ryuqq.agentica.core.spi.AgentTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * AgentFactory 유닛 테스트.
 *
 * <p>트래커 유무, 트래커 래핑, 트래커 실패 시 원래 핸들로 계속 진행하는지 검증합니다.</p>
 *
 * @author Agentica Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AgentFactoryTest {

    @Mock
    private AgentRuntime runtime;

    @Mock
    private AgentTracker tracker;

    @Mock
    private AgentHandle handle;

    @Mock
    private AgentHandle wrapped;

    private AgentSpec spec;
    private SpawnContext context;

    @BeforeEach
    void setUp() {
        spec = AgentSpec.of("You are a juror.");
        context = SpawnContext.of(PatternType.JURY, "abc123def456", "juror").with("juror_index", 0);
    }

    @Test
    void spawn_트래커가_없으면_런타임_핸들을_그대로_반환() {
        // given
        when(runtime.create(spec)).thenReturn(handle);
        AgentFactory factory = new AgentFactory(runtime);

        // when
        AgentHandle result = factory.spawn(spec, context);

        // then
        assertThat(result).isSameAs(handle);
        assertThat(factory.isTracked()).isFalse();
    }

    @Test
    void spawn_트래커가_감싼_핸들을_반환() {
        // given
        when(runtime.create(spec)).thenReturn(handle);
        when(tracker.record(context, spec, handle)).thenReturn(wrapped);
        AgentFactory factory = new AgentFactory(runtime, tracker);

        // when
        AgentHandle result = factory.spawn(spec, context);

        // then
        assertThat(result).isSameAs(wrapped);
        verify(tracker).record(context, spec, handle);
    }

    @Test
    void spawn_트래커가_실패해도_원래_핸들로_계속() {
        // given
        when(runtime.create(spec)).thenReturn(handle);
        when(tracker.record(any(), any(), any())).thenThrow(new IllegalStateException("sink down"));
        AgentFactory factory = new AgentFactory(runtime, tracker);

        // when
        AgentHandle result = factory.spawn(spec, context);

        // then
        assertThat(result).isSameAs(handle);
    }

    @Test
    void spawn_트래커가_null을_반환하면_원래_핸들() {
        when(runtime.create(spec)).thenReturn(handle);
        when(tracker.record(context, spec, handle)).thenReturn(null);

        AgentHandle result = new AgentFactory(runtime, tracker).spawn(spec, context);

        assertThat(result).isSameAs(handle);
    }

    @Test
    void spawn_런타임_예외는_그대로_전파() {
        when(runtime.create(spec)).thenThrow(new IllegalStateException("backend down"));
        AgentFactory factory = new AgentFactory(runtime, tracker);

        assertThatThrownBy(() -> factory.spawn(spec, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("backend down");
        verifyNoInteractions(tracker);
    }

    @Test
    void 생성_runtime이_null이면_예외() {
        assertThatThrownBy(() -> new AgentFactory(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("runtime cannot be null");
    }
}
