package org.newslens.client;

import lombok.extern.slf4j.Slf4j;
import org.newslens.exception.UpstreamMalformedResponseException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only access to the relational news archive.
 *
 * <p>{@link #describeSchema(List)} renders {@code CREATE TABLE} style text from JDBC
 * metadata and caches it per table list. {@link #run(String)} executes one query
 * and renders the rows as text, one row per line, values separated by {@code " | "},
 * preceded by a header line with the column labels. No rows render as an empty
 * string.</p>
 *
 * <p>The pool behind the {@link JdbcTemplate} is expected to hand out read-only
 * connections; statements additionally carry a query timeout and a row cap.</p>
 */
@Slf4j
public class NewsDatabaseClient {

    public static final String BACKEND = "database";

    private static final Duration DEFAULT_SCHEMA_CACHE_TTL = Duration.ofMinutes(10);

    private final JdbcTemplate jdbcTemplate;
    private final UpstreamCallExecutor callExecutor;
    private final Duration timeout;
    private final Duration schemaCacheTtl;
    private final Clock clock;

    private final Map<String, CachedSchema> schemaCache = new ConcurrentHashMap<>();

    public NewsDatabaseClient(JdbcTemplate jdbcTemplate, UpstreamCallExecutor callExecutor,
                              Duration timeout, int maxRows) {
        this(jdbcTemplate, callExecutor, timeout, maxRows, DEFAULT_SCHEMA_CACHE_TTL, Clock.systemUTC());
    }

    public NewsDatabaseClient(JdbcTemplate jdbcTemplate, UpstreamCallExecutor callExecutor,
                              Duration timeout, int maxRows, Duration schemaCacheTtl, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.callExecutor = callExecutor;
        this.timeout = timeout;
        this.schemaCacheTtl = schemaCacheTtl;
        this.clock = clock;

        this.jdbcTemplate.setMaxRows(maxRows);
        this.jdbcTemplate.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));

        log.info("NewsDatabaseClient initialized: timeout={}ms, maxRows={}, schemaCacheTtl={}",
                timeout.toMillis(), maxRows, schemaCacheTtl);
    }

    /**
     * Describes the given tables as {@code CREATE TABLE} statements.
     */
    public String describeSchema(List<String> tables) {
        String cacheKey = String.join(",", tables);
        Instant now = clock.instant();

        CachedSchema cached = schemaCache.get(cacheKey);
        if (cached != null && Duration.between(cached.fetchedAt(), now).compareTo(schemaCacheTtl) < 0) {
            return cached.text();
        }

        String text = callExecutor.call(BACKEND, timeout,
                () -> jdbcTemplate.execute((ConnectionCallback<String>) connection ->
                        renderSchema(connection.getMetaData(), tables)));

        schemaCache.put(cacheKey, new CachedSchema(text, now));
        log.debug("Schema described for tables {}", tables);
        return text;
    }

    /**
     * Executes a read-only query.
     *
     * @return rows rendered as text, or an empty string when there are none
     * @throws UpstreamMalformedResponseException if the database rejects the statement
     */
    public String run(String sql) {
        long start = System.currentTimeMillis();
        String rows = callExecutor.call(BACKEND, timeout, () -> {
            try {
                return jdbcTemplate.query(sql, (ResultSetExtractor<String>) NewsDatabaseClient::renderRows);
            } catch (BadSqlGrammarException e) {
                throw new UpstreamMalformedResponseException("Statement rejected by the database: "
                        + e.getSQLException().getMessage(), e);
            } catch (DataAccessException e) {
                log.warn("Query failed: {}", e.getMessage());
                throw e;
            }
        });
        log.debug("Query returned {} chars in {}ms", rows != null ? rows.length() : 0,
                System.currentTimeMillis() - start);
        return rows != null ? rows : "";
    }

    static String renderRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<String> lines = new ArrayList<>();

        while (rs.next()) {
            if (lines.isEmpty()) {
                List<String> header = new ArrayList<>(columns);
                for (int i = 1; i <= columns; i++) {
                    header.add(meta.getColumnLabel(i));
                }
                lines.add(String.join(" | ", header));
            }
            List<String> values = new ArrayList<>(columns);
            for (int i = 1; i <= columns; i++) {
                Object value = rs.getObject(i);
                values.add(value != null ? value.toString() : "NULL");
            }
            lines.add(String.join(" | ", values));
        }
        return String.join("\n", lines);
    }

    private static String renderSchema(DatabaseMetaData metaData, List<String> tables) throws SQLException {
        StringBuilder sb = new StringBuilder();
        for (String table : tables) {
            List<String> columns = new ArrayList<>();
            try (ResultSet rs = metaData.getColumns(null, null, table, null)) {
                while (rs.next()) {
                    String nullable = rs.getInt("NULLABLE") == DatabaseMetaData.columnNoNulls ? " NOT NULL" : "";
                    columns.add("    " + rs.getString("COLUMN_NAME") + " " + rs.getString("TYPE_NAME") + nullable);
                }
            }
            if (columns.isEmpty()) {
                log.warn("Table {} has no visible columns", table);
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append("CREATE TABLE ").append(table).append(" (\n")
                    .append(String.join(",\n", columns))
                    .append("\n)");
        }
        return sb.toString();
    }

    private record CachedSchema(String text, Instant fetchedAt) {
    }
}
