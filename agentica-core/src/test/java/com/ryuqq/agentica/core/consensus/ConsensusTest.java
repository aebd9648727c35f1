package com.ryuqq.agentica.core.consensus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Consensus 유닛 테스트.
 *
 * @author Agentica Team
 * @since 1.0.0
 */
@DisplayName("Consensus 테스트")
class ConsensusTest {

    // ============================================================
    // 1. 생성 검증
    // ============================================================

    @Test
    void 생성_THRESHOLD_모드에_임계값이_없으면_예외() {
        assertThatThrownBy(() -> new Consensus(ConsensusMode.THRESHOLD, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("threshold");
    }

    @Test
    void 생성_임계값이_범위를_벗어나면_예외() {
        assertThatThrownBy(() -> Consensus.threshold(1.2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("current: 1.2");
        assertThatThrownBy(() -> Consensus.threshold(-0.1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 생성_MAJORITY_모드는_임계값을_무시() {
        Consensus consensus = new Consensus(ConsensusMode.MAJORITY, 5.0);

        assertThat(consensus.threshold()).isNull();
    }

    @Test
    void validate_생성자와_같은_규칙으로_검증() {
        assertThatThrownBy(() -> Consensus.validate(null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("mode cannot be null");
        assertThatThrownBy(() -> Consensus.validate(ConsensusMode.THRESHOLD, Double.NaN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("threshold must be between 0 and 1 (current: NaN)");
        assertThatCode(() -> Consensus.validate(ConsensusMode.UNANIMOUS, null)).doesNotThrowAnyException();
    }

    // ============================================================
    // 2. 입력 검증
    // ============================================================

    @Test
    void decide_빈_투표는_예외() {
        assertThatThrownBy(() -> Consensus.majority().decide(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decide_가중치_길이가_다르면_예외() {
        assertThatThrownBy(() -> Consensus.majority().decide(List.of("a", "b"), List.of(1.0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("votes: 2, weights: 1");
    }

    @Test
    void decide_음수_또는_무한대_가중치는_예외() {
        assertThatThrownBy(() -> Consensus.majority().decide(List.of("a", "b"), List.of(1.0, -1.0)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index: 1");
        assertThatThrownBy(() -> Consensus.majority().decide(List.of("a"), List.of(Double.POSITIVE_INFINITY)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Consensus.majority().decide(List.of("a"), Arrays.asList((Double) null)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 3. MAJORITY
    // ============================================================

    @Test
    void majority_최다_득표_반환() {
        Boolean result = Consensus.majority().decide(List.of(false, false, true));

        assertThat(result).isFalse();
    }

    @Test
    void majority_가중치가_득표수보다_우선() {
        Boolean result = Consensus.majority().decide(List.of(true, false, false), List.of(10.0, 1.0, 1.0));

        assertThat(result).isTrue();
    }

    @Test
    void majority_동률이면_먼저_등장한_키() {
        String result = Consensus.majority().decide(List.of("b", "a", "a", "b"));

        assertThat(result).isEqualTo("b");
    }

    @Test
    void majority_모든_가중치가_0이면_첫_투표() {
        String result = Consensus.majority().decide(List.of("x", "y"), List.of(0.0, 0.0));

        assertThat(result).isEqualTo("x");
    }

    @Test
    void majority_key_함수를_쓰면_원래_투표_객체를_반환() {
        // given
        Map<String, Object> first = Map.of("verdict", "approve", "reason", "clean");
        Map<String, Object> second = Map.of("verdict", "reject", "reason", "bug");
        Map<String, Object> third = Map.of("verdict", "approve", "reason", "tests pass");

        // when
        Map<String, Object> winner = Consensus.majority()
            .decide(List.of(first, second, third), null, vote -> vote.get("verdict"));

        // then
        assertThat(winner).isSameAs(first);
    }

    // ============================================================
    // 4. UNANIMOUS
    // ============================================================

    @Test
    void unanimous_모두_같으면_승리() {
        assertThat(Consensus.unanimous().decide(List.of("yes", "yes", "yes"))).isEqualTo("yes");
    }

    @Test
    void unanimous_서로_다른_키가_있으면_실패() {
        assertThatThrownBy(() -> Consensus.unanimous().decide(List.of("yes", "no", "yes")))
            .isInstanceOf(ConsensusNotReachedException.class)
            .satisfies(e -> {
                ConsensusNotReachedException ex = (ConsensusNotReachedException) e;
                assertThat(ex.getMode()).isEqualTo(ConsensusMode.UNANIMOUS);
                assertThat(ex.getTally().distinctKeys()).isEqualTo(2);
            });
    }

    // ============================================================
    // 5. THRESHOLD
    // ============================================================

    @Test
    void threshold_경계값과_같으면_승리() {
        String result = Consensus.threshold(0.5).decide(List.of("a", "a", "b", "c"));

        assertThat(result).isEqualTo("a");
    }

    @Test
    void threshold_미달이면_실패하고_비율을_보고() {
        assertThatThrownBy(() -> Consensus.threshold(0.75).decide(List.of("a", "a", "b", "c")))
            .isInstanceOf(ConsensusNotReachedException.class)
            .satisfies(e -> {
                ConsensusNotReachedException ex = (ConsensusNotReachedException) e;
                assertThat(ex.getThreshold()).isEqualTo(0.75);
                assertThat(ex.getWinningShare()).isEqualTo(0.5);
            });
    }

    @Test
    void threshold_전체_가중치가_0이면_비율_0() {
        assertThatThrownBy(() -> Consensus.threshold(0.1).decide(List.of("a"), List.of(0.0)))
            .isInstanceOf(ConsensusNotReachedException.class);
        assertThat(Consensus.threshold(0.0).decide(List.of("a"), List.of(0.0))).isEqualTo("a");
    }

    @Test
    void tally_키별_가중치를_처음_등장_순서로_반환() {
        VoteTally tally = Consensus.majority().tally(List.of("b", "a", "b"), List.of(1.0, 2.5, 0.5), null);

        assertThat(tally.weightsByKey()).containsExactly(Map.entry("b", 1.5), Map.entry("a", 2.5));
        assertThat(tally.totalWeight()).isEqualTo(4.0);
        assertThat(tally.leader().key()).isEqualTo("a");
        assertThat(tally.leader().firstIndex()).isEqualTo(1);
    }
}
