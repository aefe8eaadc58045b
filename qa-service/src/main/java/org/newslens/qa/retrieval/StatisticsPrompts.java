package org.newslens.qa.retrieval;

/**
 * Prompts for turning a statistics question into one PostgreSQL query.
 */
final class StatisticsPrompts {

    private StatisticsPrompts() {
    }

    static final String SYSTEM = """
            You are an expert data analyst for an Azerbaijani news database.
            You write exactly ONE read-only PostgreSQL SELECT statement and nothing else:
            no explanation, no markdown, no data modification, no DDL.
            Use aggregations (COUNT, AVG, MAX, MIN) when appropriate.
            For important news use ORDER BY importance DESC LIMIT 30.""";

    /**
     * {@code %1$s} schema, {@code %2$s} question, {@code %3$s} examples.
     */
    static final String USER = """
            Database schema:
            %1$s

            User question: %2$s

            Focus on the news_articles table (date, category, importance, sentiment, sentiment_score, summary).

            Example queries:
            %3$s

            SQL query (PostgreSQL):""";

    static final String EXAMPLES = """
            -- Most important news in 2025
            SELECT summary, date, category, importance
            FROM news_articles
            WHERE EXTRACT(YEAR FROM date) = 2025 AND importance >= 7
            ORDER BY importance DESC
            LIMIT 30;

            -- News count by category in the last 30 days
            SELECT category, COUNT(*) AS count
            FROM news_articles
            WHERE date >= CURRENT_DATE - INTERVAL '30 days'
            GROUP BY category
            ORDER BY count DESC;

            -- Top positive news this week
            SELECT summary, date, importance, sentiment_score
            FROM news_articles
            WHERE date >= CURRENT_DATE - INTERVAL '7 days' AND sentiment = 'positive'
            ORDER BY importance DESC, sentiment_score DESC
            LIMIT 30;""";
}
