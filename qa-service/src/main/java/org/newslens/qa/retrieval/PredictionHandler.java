package org.newslens.qa.retrieval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.newslens.model.Entity;
import org.newslens.model.RetrievalStrategy;
import org.newslens.model.SearchResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Forecasting is not supported; redirects the user to statistics-style questions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PredictionHandler implements RetrievalHandler {

    public static final String NAME = "PredictionHandler";

    private final HandlerMessages messages;

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.PREDICTION_QUERY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<SearchResult> retrieve(String query, List<Entity> entities, int topK, String language) {
        log.info("Prediction question redirected to statistics");
        return List.of(SearchResult.directAnswer("prediction_info", "prediction",
                messages.get(MessageKey.PREDICTION, language)));
    }
}
