package org.newslens.qa.retrieval;

import lombok.extern.slf4j.Slf4j;
import org.newslens.model.RetrievalStrategy;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed dispatch table from strategy to handler.
 *
 * <p>Built once from every {@link RetrievalHandler} bean. Construction fails when a
 * strategy has no handler or when two handlers claim the same strategy, so a
 * running service always has exactly one handler per strategy.</p>
 */
@Slf4j
@Component
public class RetrievalDispatcher {

    private final Map<RetrievalStrategy, RetrievalHandler> handlers;

    public RetrievalDispatcher(List<RetrievalHandler> handlers) {
        Map<RetrievalStrategy, RetrievalHandler> table = new EnumMap<>(RetrievalStrategy.class);
        for (RetrievalHandler handler : handlers) {
            RetrievalHandler previous = table.putIfAbsent(handler.strategy(), handler);
            if (previous != null) {
                throw new IllegalStateException("Strategy " + handler.strategy() + " is claimed by both "
                        + previous.name() + " and " + handler.name());
            }
        }

        Set<RetrievalStrategy> missing = EnumSet.allOf(RetrievalStrategy.class);
        missing.removeAll(table.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No retrieval handler for strategies " + missing);
        }

        this.handlers = table;
        log.info("RetrievalDispatcher initialized: {}", table.values().stream().map(RetrievalHandler::name).toList());
    }

    public RetrievalHandler handlerFor(RetrievalStrategy strategy) {
        return handlers.get(strategy);
    }
}
