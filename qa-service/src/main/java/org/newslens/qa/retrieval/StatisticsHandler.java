package org.newslens.qa.retrieval;

import lombok.extern.slf4j.Slf4j;
import org.newslens.client.CompletionClient;
import org.newslens.client.NewsDatabaseClient;
import org.newslens.exception.UpstreamException;
import org.newslens.model.Entity;
import org.newslens.model.FailureKind;
import org.newslens.model.RetrievalStrategy;
import org.newslens.model.SearchResult;
import org.newslens.qa.config.QaProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Answers counting and ranking questions with generated SQL.
 *
 * <p>Two phases: the completion model writes one PostgreSQL statement from the table
 * schema and a few example shapes, then the statement is validated by
 * {@link SqlStatementGuard} and executed once on the read-only connection. Rejected
 * statements are never sent to the database.</p>
 */
@Slf4j
@Component
public class StatisticsHandler implements RetrievalHandler {

    public static final String NAME = "StatisticsHandler";

    private static final String RESULT_TYPE = "statistics";
    private static final String CODE_FENCE = "```";

    private final CompletionClient completionClient;
    private final NewsDatabaseClient databaseClient;
    private final SqlStatementGuard sqlGuard;
    private final HandlerMessages messages;
    private final List<String> schemaTables;

    public StatisticsHandler(CompletionClient completionClient,
                             NewsDatabaseClient databaseClient,
                             SqlStatementGuard sqlGuard,
                             HandlerMessages messages,
                             QaProperties properties) {
        this.completionClient = completionClient;
        this.databaseClient = databaseClient;
        this.sqlGuard = sqlGuard;
        this.messages = messages;
        this.schemaTables = List.copyOf(properties.getStatistics().getAllowedTables());
    }

    @Override
    public RetrievalStrategy strategy() {
        return RetrievalStrategy.STATISTICS_QUERY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<SearchResult> retrieve(String query, List<Entity> entities, int topK, String language) {
        log.info("Statistics query: \"{}\"", VectorSearchHandler.truncate(query));

        String sql;
        try {
            String schema = databaseClient.describeSchema(schemaTables);
            String output = completionClient.complete(StatisticsPrompts.SYSTEM,
                    StatisticsPrompts.USER.formatted(schema, query, StatisticsPrompts.EXAMPLES), false);
            sql = cleanSql(output);
        } catch (UpstreamException e) {
            log.warn("SQL generation failed ({}): {}", e.getFailureKind().tag(), e.getMessage());
            return error(e.getFailureKind(), language);
        }

        SqlStatementGuard.Verdict verdict = sqlGuard.check(sql);
        if (!verdict.accepted()) {
            log.warn("SECURITY: generated SQL rejected ({}): {}", verdict.reason(), sql);
            return List.of(SearchResult.failure("unsafe_query", RESULT_TYPE, FailureKind.UNSAFE_SQL,
                    messages.get(MessageKey.UNSAFE_QUERY, language)));
        }
        log.info("Generated SQL: {}", verdict.sql());

        String rows;
        try {
            rows = databaseClient.run(verdict.sql());
        } catch (UpstreamException e) {
            log.error("Statistics query failed ({}): {}", e.getFailureKind().tag(), e.getMessage());
            return error(e.getFailureKind(), language);
        }

        if (isNoRows(rows)) {
            log.info("Statistics query returned no rows");
            return List.of(SearchResult.failure("no_results", RESULT_TYPE, FailureKind.NOT_FOUND,
                    messages.get(MessageKey.NO_RESULTS, language)));
        }

        return List.of(SearchResult.builder()
                .docId("statistics_result")
                .content(rows)
                .score(1.0)
                .metadata(Map.of(
                        SearchResult.META_SOURCE, "sql_query",
                        SearchResult.META_TYPE, RESULT_TYPE,
                        "query", verdict.sql()))
                .build());
    }

    private List<SearchResult> error(FailureKind kind, String language) {
        return List.of(SearchResult.failure("error", RESULT_TYPE, kind,
                messages.get(MessageKey.STATISTICS_ERROR, language)));
    }

    /**
     * Strips markdown code fences, stray backticks and a leading {@code sql} language tag.
     */
    static String cleanSql(String output) {
        String sql = output.trim();
        int fence = sql.indexOf(CODE_FENCE);
        if (fence >= 0) {
            int close = sql.indexOf(CODE_FENCE, fence + CODE_FENCE.length());
            sql = close > 0 ? sql.substring(fence + CODE_FENCE.length(), close) : sql.substring(fence);
        }
        sql = stripBackticks(sql.trim()).trim();
        if (sql.toLowerCase(Locale.ROOT).startsWith("sql")
                && (sql.length() == 3 || Character.isWhitespace(sql.charAt(3)))) {
            sql = sql.substring(3).trim();
        }
        return sql;
    }

    private static String stripBackticks(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '`') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '`') {
            end--;
        }
        return text.substring(start, end);
    }

    static boolean isNoRows(String rows) {
        if (rows == null || rows.isBlank()) {
            return true;
        }
        String trimmed = rows.trim();
        return trimmed.toLowerCase(Locale.ROOT).contains("no rows") || "[]".equals(trimmed);
    }
}
