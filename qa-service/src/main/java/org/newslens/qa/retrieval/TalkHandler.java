package org.newslens.qa.retrieval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.newslens.model.Entity;
import org.newslens.model.RetrievalStrategy;
import org.newslens.model.SearchResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Greetings and small talk. No backend access.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TalkHandler implements RetrievalHandler {

    public static final String NAME = "TalkHandler";

    private final HandlerMessages messages;

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.STATIC_RESPONSE;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<SearchResult> retrieve(String query, List<Entity> entities, int topK, String language) {
        log.debug("Answering small talk in {}", language);
        return List.of(SearchResult.directAnswer("greeting", "talk", messages.get(MessageKey.TALK, language)));
    }
}
