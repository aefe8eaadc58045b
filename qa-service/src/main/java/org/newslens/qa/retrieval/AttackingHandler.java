package org.newslens.qa.retrieval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.newslens.model.Entity;
import org.newslens.model.FailureKind;
import org.newslens.model.RetrievalStrategy;
import org.newslens.model.SearchResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rejects prompt injection and exfiltration attempts.
 *
 * <p>This handler has no backend collaborators at all; selecting it is what keeps
 * attacking questions away from the vector and relational stores. Every invocation
 * is written to the audit log at WARN.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttackingHandler implements RetrievalHandler {

    public static final String NAME = "AttackingHandler";

    private static final int AUDIT_QUERY_LENGTH = 100;

    private final HandlerMessages messages;

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.REJECT;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<SearchResult> retrieve(String query, List<Entity> entities, int topK, String language) {
        String sample = query.length() > AUDIT_QUERY_LENGTH ? query.substring(0, AUDIT_QUERY_LENGTH) + "..." : query;
        log.warn("SECURITY: attacking query rejected: \"{}\" (language: {})", sample, messages.resolveLanguage(language));

        return List.of(SearchResult.failure("security_warning", "attacking", FailureKind.SECURITY_REJECTION,
                messages.get(MessageKey.ATTACKING, language)));
    }
}
