package org.newslens.qa.routing;

import org.newslens.model.Intent;
import org.newslens.model.QueryAnalysis;
import org.newslens.model.RetrievalStrategy;
import org.springframework.stereotype.Component;

/**
 * Maps an intent to exactly one retrieval strategy. Pure and total: every intent,
 * including a missing one, has a strategy.
 */
@Component
public class StrategyRouter {

    public RetrievalStrategy route(QueryAnalysis analysis) {
        Intent intent = analysis != null ? analysis.intent() : null;
        if (intent == null) {
            return RetrievalStrategy.HYBRID_SEARCH;
        }
        return switch (intent) {
            case FACTOID -> RetrievalStrategy.SIMPLE_SEARCH;
            case STATISTICS -> RetrievalStrategy.STATISTICS_QUERY;
            case PREDICTION -> RetrievalStrategy.PREDICTION_QUERY;
            case TALK -> RetrievalStrategy.STATIC_RESPONSE;
            case ATTACKING -> RetrievalStrategy.REJECT;
            case ANALYTICAL, UNKNOWN -> RetrievalStrategy.HYBRID_SEARCH;
        };
    }

    /**
     * Human-readable description for log lines.
     */
    public String describe(RetrievalStrategy strategy) {
        if (strategy == null) {
            return "no strategy";
        }
        return switch (strategy) {
            case SIMPLE_SEARCH -> "vector similarity search on the pivot-language question";
            case STATISTICS_QUERY -> "generated read-only SQL over the news archive";
            case PREDICTION_QUERY -> "static redirect to historical statistics";
            case STATIC_RESPONSE -> "static greeting and help";
            case REJECT -> "security rejection, no backend access";
            case HYBRID_SEARCH -> "fallback similarity search for ambiguous questions";
        };
    }
}
