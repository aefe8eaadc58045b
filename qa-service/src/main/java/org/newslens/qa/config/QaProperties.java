package org.newslens.qa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for question answering.
 *
 * <p>Bound from {@code qa.*} in {@code application.yml}.</p>
 */
@Data
@Component
@ConfigurationProperties(prefix = "qa")
public class QaProperties {

    /** Number of documents retrieved when the caller does not ask for a specific amount. */
    private int defaultTopK = 5;

    /** Upper bound applied to any requested top-k. */
    private int maxTopK = 20;

    /** Language queries are translated into for retrieval. */
    private String pivotLanguage = "az";

    /** Language used for handler messages when the caller's language has no translation. */
    private String fallbackLanguage = "en";

    /** Minimum similarity score passed to the vector store. */
    private double minScore = 0.0;

    private Timeouts timeouts = new Timeouts();

    private Statistics statistics = new Statistics();

    private Cache cache = new Cache();

    private Security security = new Security();

    private Batch batch = new Batch();

    /**
     * Per-backend deadlines applied by the upstream call executor.
     */
    @Data
    public static class Timeouts {
        private Duration completion = Duration.ofSeconds(30);
        private Duration vectorSearch = Duration.ofSeconds(10);
        private Duration database = Duration.ofSeconds(15);

        /** Threads available for in-flight upstream calls across all requests. */
        private int poolSize = 16;

        /** Calls waiting for a thread before new ones are rejected as unavailable. */
        private int queueCapacity = 200;
    }

    @Data
    public static class Statistics {

        /** Tables the generated SQL may read. The first one is described to the model. */
        private List<String> allowedTables = new ArrayList<>(List.of("news_articles"));

        /** Row cap applied to every generated statement. */
        private int maxRows = 100;

        /** How long the described schema is reused. */
        private Duration schemaCacheTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class Cache {
        private boolean enabled = true;

        /** {@code redis} or {@code memory}. */
        private String type = "redis";

        private Duration ttl = Duration.ofHours(1);

        private String prefix = "qa";
    }

    /**
     * Pool used by batch questions. Its size bounds how many pipeline runs of one
     * batch hit the completion backend at the same time.
     */
    @Data
    public static class Batch {
        private int poolSize = 4;

        /** Queued questions before submissions are rejected. */
        private int queueCapacity = 200;

        private Duration awaitTermination = Duration.ofSeconds(30);
    }

    @Data
    public static class Security {

        /**
         * Case-insensitive regular expressions evaluated on the raw question. A match
         * routes the question to the rejection handler whatever the model answered.
         */
        private List<String> injectionPatterns = new ArrayList<>(List.of(
                "ignore\\s+(all\\s+)?(the\\s+)?(previous|prior|above)\\s+(instructions|prompts?|rules)",
                "disregard\\s+(all\\s+)?(previous|prior|above)\\s+instructions",
                "(reveal|show|print|repeat)\\s+(me\\s+)?(your|the)\\s+system\\s+prompt",
                "\\b(show|give|reveal|print|tell|send|list|dump)\\s+(me\\s+)?(the\\s+|your\\s+|all\\s+)?"
                        + "(admin\\s+|root\\s+|database\\s+|db\\s+)?"
                        + "(passwords?|api[\\s_-]?keys?|access\\s+tokens?|secret\\s+keys?|credentials)",
                "\\bwhat\\s+(is|are)\\s+(the\\s+|your\\s+)(admin\\s+|root\\s+|database\\s+|db\\s+)?"
                        + "(passwords?|api[\\s_-]?keys?|access\\s+tokens?|secret\\s+keys?|credentials)",
                "drop\\s+table",
                "(əvvəlki|öncəki)\\s+(təlimatları|göstərişləri)\\s+(unut|nəzərə\\s+alma)",
                "игнорируй\\s+(все\\s+)?(предыдущие|прошлые)\\s+инструкции"
        ));
    }
}
