package org.newslens.qa.retrieval;

import lombok.extern.slf4j.Slf4j;
import org.newslens.qa.config.QaProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static validation of model-generated SQL before it reaches the database.
 *
 * <p>A statement is accepted only when it is a single {@code SELECT} or {@code WITH}
 * query, contains none of the data-modifying, DDL, privilege or session keywords,
 * calls none of the server-side functions that reach beyond the query text, and
 * reads only allow-listed tables (or CTEs it defines itself). String literals and
 * comments are ignored while checking.</p>
 */
@Slf4j
@Component
public class SqlStatementGuard {

    private static final Set<String> FORBIDDEN_WORDS = Set.of(
            "insert", "update", "delete", "merge", "upsert", "drop", "alter", "create", "truncate",
            "grant", "revoke", "copy", "call", "execute", "exec", "do", "set", "reset", "lock",
            "vacuum", "reindex", "cluster", "comment", "listen", "notify", "refresh", "prepare",
            "deallocate", "discard", "begin", "commit", "rollback", "savepoint", "into", "load",
            "pg_sleep", "pg_read_file", "pg_read_binary_file", "pg_ls_dir", "pg_terminate_backend",
            "pg_cancel_backend", "set_config", "lo_import", "lo_export", "dblink", "dblink_exec");

    /**
     * Server-side functions that run SQL given as text, read tables named in a string
     * literal, or expose server files and settings. Matched on the unqualified name.
     */
    private static final List<String> FORBIDDEN_PREFIXES = List.of(
            "pg_", "lo_", "dblink", "query_to_xml", "table_to_xml", "cursor_to_xml", "database_to_xml",
            "schema_to_xml", "xpath", "ts_stat", "current_setting", "set_config");

    private static final Set<String> CLAUSE_WORDS = Set.of(
            "where", "join", "inner", "left", "right", "full", "outer", "cross", "natural", "on", "using",
            "group", "order", "limit", "offset", "having", "window", "union", "intersect", "except",
            "fetch", "lateral", "tablesample");

    private final Set<String> allowedTables;

    public SqlStatementGuard(QaProperties properties) {
        this.allowedTables = properties.getStatistics().getAllowedTables().stream()
                .map(t -> t.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Outcome of a check. {@code sql} is the statement without trailing semicolons.
     */
    public record Verdict(boolean accepted, String sql, String reason) {

        static Verdict accept(String sql) {
            return new Verdict(true, sql, null);
        }

        static Verdict reject(String sql, String reason) {
            return new Verdict(false, sql, reason);
        }
    }

    public Verdict check(String sql) {
        if (sql == null || sql.isBlank()) {
            return Verdict.reject(sql, "empty statement");
        }

        List<String> tokens;
        try {
            tokens = tokenize(sql);
        } catch (IllegalArgumentException e) {
            return Verdict.reject(sql, e.getMessage());
        }

        while (!tokens.isEmpty() && ";".equals(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        String statement = stripTrailingSemicolons(sql);

        if (tokens.isEmpty()) {
            return Verdict.reject(statement, "empty statement");
        }
        if (tokens.contains(";")) {
            return Verdict.reject(statement, "multiple statements");
        }
        String first = tokens.get(0);
        if (!"select".equals(first) && !"with".equals(first)) {
            return Verdict.reject(statement, "statement must start with SELECT or WITH");
        }
        for (String token : tokens) {
            if (FORBIDDEN_WORDS.contains(token)) {
                return Verdict.reject(statement, "forbidden keyword: " + token);
            }
            if (isForbiddenFunction(token)) {
                return Verdict.reject(statement, "forbidden function: " + token);
            }
        }

        Set<String> cteNames = cteNames(tokens);
        List<String> tables;
        try {
            tables = referencedTables(tokens);
        } catch (IllegalArgumentException e) {
            return Verdict.reject(statement, e.getMessage());
        }
        for (String table : tables) {
            if (!cteNames.contains(table) && !isAllowed(table)) {
                return Verdict.reject(statement, "table not allowed: " + table);
            }
        }

        log.debug("SQL accepted, tables={}", tables);
        return Verdict.accept(statement);
    }

    private static boolean isForbiddenFunction(String token) {
        String name = token.substring(token.lastIndexOf('.') + 1);
        for (String prefix : FORBIDDEN_PREFIXES) {
            if (token.startsWith(prefix) || name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private boolean isAllowed(String table) {
        int dot = table.lastIndexOf('.');
        if (dot < 0) {
            return allowedTables.contains(table);
        }
        String schema = table.substring(0, dot);
        return "public".equals(schema) && allowedTables.contains(table.substring(dot + 1));
    }

    // ---------------------------------------------------------------
    // Structure
    // ---------------------------------------------------------------

    /**
     * Names defined as {@code name AS (SELECT ...)}.
     */
    private static Set<String> cteNames(List<String> tokens) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i + 3 < tokens.size(); i++) {
            if (isWord(tokens.get(i)) && "as".equals(tokens.get(i + 1)) && "(".equals(tokens.get(i + 2))
                    && ("select".equals(tokens.get(i + 3)) || "with".equals(tokens.get(i + 3)))) {
                names.add(tokens.get(i));
            }
        }
        return names;
    }

    /**
     * Tables named after FROM or JOIN, including comma-separated FROM lists.
     * FROM inside function calls such as {@code EXTRACT(YEAR FROM date)} is not a table reference.
     */
    private static List<String> referencedTables(List<String> tokens) {
        List<String> tables = new ArrayList<>();
        Deque<Boolean> functionGroups = new ArrayDeque<>();

        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if ("(".equals(token)) {
                String next = i + 1 < tokens.size() ? tokens.get(i + 1) : "";
                boolean functionCall = i > 0 && isWord(tokens.get(i - 1))
                        && !"select".equals(next) && !"with".equals(next);
                functionGroups.push(functionCall);
            } else if (")".equals(token)) {
                if (functionGroups.isEmpty()) {
                    throw new IllegalArgumentException("unbalanced parentheses");
                }
                functionGroups.pop();
            } else if (("from".equals(token) || "join".equals(token))
                    && !Boolean.TRUE.equals(functionGroups.peek())
                    && !(i > 0 && "distinct".equals(tokens.get(i - 1)))) {
                i = collectTables(tokens, i + 1, "from".equals(token), tables);
            }
        }
        if (!functionGroups.isEmpty()) {
            throw new IllegalArgumentException("unbalanced parentheses");
        }
        return tables;
    }

    /**
     * Reads one table reference (or a comma list of them after FROM) starting at {@code i}.
     * Returns the index of the last consumed token.
     */
    private static int collectTables(List<String> tokens, int i, boolean allowList, List<String> tables) {
        while (i < tokens.size()) {
            String token = tokens.get(i);
            if ("(".equals(token)) {
                return i - 1;
            }
            if ("lateral".equals(token) || "only".equals(token)) {
                i++;
                continue;
            }
            if (!isWord(token)) {
                throw new IllegalArgumentException("unexpected token after FROM: " + token);
            }
            tables.add(token);
            i++;
            if (i < tokens.size() && "as".equals(tokens.get(i))) {
                i++;
            }
            if (i < tokens.size() && isWord(tokens.get(i)) && !CLAUSE_WORDS.contains(tokens.get(i))) {
                i++;
            }
            if (allowList && i + 1 < tokens.size() && ",".equals(tokens.get(i))) {
                i++;
                continue;
            }
            return i - 1;
        }
        return i - 1;
    }

    private static boolean isWord(String token) {
        if (token.isEmpty()) {
            return false;
        }
        char c = token.charAt(0);
        return Character.isLetter(c) || c == '_';
    }

    // ---------------------------------------------------------------
    // Lexing
    // ---------------------------------------------------------------

    /**
     * Lowercased word, punctuation and quoted-identifier tokens. Literals, numbers,
     * operators and comments are dropped.
     */
    static List<String> tokenize(String sql) {
        List<String> tokens = new ArrayList<>();
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                while (i < n && sql.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new IllegalArgumentException("unterminated comment");
                }
                i = end + 2;
            } else if (c == '\'') {
                i = skipQuoted(sql, i, '\'');
            } else if (c == '$' && i + 1 < n && sql.charAt(i + 1) == '$') {
                throw new IllegalArgumentException("dollar-quoted strings are not allowed");
            } else if (c == '"') {
                int end = skipQuoted(sql, i, '"');
                tokens.add(sql.substring(i + 1, end - 1).replace("\"\"", "\"").toLowerCase(Locale.ROOT));
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_'
                        || sql.charAt(i) == '$' || sql.charAt(i) == '.')) {
                    i++;
                }
                tokens.add(sql.substring(start, i).toLowerCase(Locale.ROOT));
            } else if (c == '(' || c == ')' || c == ',' || c == ';') {
                tokens.add(String.valueOf(c));
                i++;
            } else {
                i++;
            }
        }
        return tokens;
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw new IllegalArgumentException("unterminated quoted text");
    }

    private static String stripTrailingSemicolons(String sql) {
        String trimmed = sql.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
