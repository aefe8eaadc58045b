package org.newslens.qa.routing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.newslens.model.Intent;
import org.newslens.model.QueryAnalysis;
import org.newslens.model.RetrievalStrategy;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyRouterTest {

    private final StrategyRouter router = new StrategyRouter();

    @ParameterizedTest
    @EnumSource(Intent.class)
    void everyIntentHasAStrategyAndDescription(Intent intent) {
        RetrievalStrategy strategy = router.route(analysis(intent));

        assertThat(strategy).isNotNull();
        assertThat(router.describe(strategy)).isNotBlank();
    }

    @Test
    void mapsIntentsToStrategies() {
        assertThat(router.route(analysis(Intent.FACTOID))).isEqualTo(RetrievalStrategy.SIMPLE_SEARCH);
        assertThat(router.route(analysis(Intent.STATISTICS))).isEqualTo(RetrievalStrategy.STATISTICS_QUERY);
        assertThat(router.route(analysis(Intent.PREDICTION))).isEqualTo(RetrievalStrategy.PREDICTION_QUERY);
        assertThat(router.route(analysis(Intent.TALK))).isEqualTo(RetrievalStrategy.STATIC_RESPONSE);
        assertThat(router.route(analysis(Intent.ATTACKING))).isEqualTo(RetrievalStrategy.REJECT);
        assertThat(router.route(analysis(Intent.ANALYTICAL))).isEqualTo(RetrievalStrategy.HYBRID_SEARCH);
        assertThat(router.route(analysis(Intent.UNKNOWN))).isEqualTo(RetrievalStrategy.HYBRID_SEARCH);
    }

    @Test
    void missingAnalysisFallsBackToHybridSearch() {
        assertThat(router.route(null)).isEqualTo(RetrievalStrategy.HYBRID_SEARCH);
    }

    private static QueryAnalysis analysis(Intent intent) {
        return new QueryAnalysis(intent, List.of(), 0.9, List.of(), Map.of());
    }
}
