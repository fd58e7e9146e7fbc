package net.cratedigger.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import net.cratedigger.domain.recommendation.BackfillStrategy;
import net.cratedigger.domain.recommendation.RecommendationMode;
import org.junit.jupiter.api.Test;

class TopUpPlannerTest {

    private final TopUpPlanner planner = new TopUpPlanner();

    private static PipelineRequest request(BackfillStrategy strategy) {
        return new PipelineRequest(10, RecommendationMode.ALBUMS, strategy, 3, List.of(), false);
    }

    @Test
    void should_TopUp_When_ShortBatchHasSurvivors() {
        assertThat(planner.shouldTopUp(4, request(BackfillStrategy.STANDARD))).isTrue();
    }

    @Test
    void should_NotTopUp_When_NothingSurvivedOrBatchFullOrOff() {
        assertThat(planner.shouldTopUp(0, request(BackfillStrategy.AGGRESSIVE))).isFalse();
        assertThat(planner.shouldTopUp(10, request(BackfillStrategy.STANDARD))).isFalse();
        assertThat(planner.shouldTopUp(4, request(BackfillStrategy.OFF))).isFalse();
    }

    @Test
    void should_DoubleRoundsAndOverfetch_When_Aggressive() {
        assertThat(planner.maxRounds(request(BackfillStrategy.STANDARD))).isEqualTo(3);
        assertThat(planner.maxRounds(request(BackfillStrategy.AGGRESSIVE))).isEqualTo(6);
        assertThat(planner.requestSize(4, BackfillStrategy.STANDARD)).isEqualTo(6);
        assertThat(planner.requestSize(4, BackfillStrategy.AGGRESSIVE)).isEqualTo(8);
        assertThat(planner.requestSize(0, BackfillStrategy.STANDARD)).isZero();
    }
}
