package com.flexboard.agent.connector.sql;

import com.flexboard.agent.error.PermanentBackendException;
import com.flexboard.agent.error.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Guards what a dashboard query may run: a single statement and, unless the backend allows
 * administrative statements, no DDL or DCL.
 *
 * <p>Every keyword of the statement is inspected, not only the leading one. Backends that accept
 * statement batches without separators (SQL Server) additionally get procedure calls and a second
 * top-level statement rejected.
 */
public final class SqlStatementPolicy {

    private static final Set<String> ADMINISTRATIVE = Set.of(
            "CREATE", "ALTER", "DROP", "TRUNCATE", "RENAME", "GRANT", "REVOKE", "DENY", "COMMENT"
    );

    // COMMENT and RENAME are common column names; they only count as the leading keyword.
    private static final Set<String> ADMINISTRATIVE_ANYWHERE = Set.of(
            "CREATE", "ALTER", "DROP", "TRUNCATE", "GRANT", "REVOKE", "DENY"
    );

    private static final Set<String> PROCEDURE_CALLS = Set.of("EXEC", "EXECUTE");

    private static final Set<String> STATEMENT_STARTS = Set.of(
            "SELECT", "INSERT", "UPDATE", "DELETE", "MERGE", "DECLARE", "USE", "WAITFOR",
            "DBCC", "BACKUP", "RESTORE", "KILL", "SHUTDOWN", "RECONFIGURE", "BULK"
    );

    /** Keywords after which a statement keyword continues the current statement. */
    private static final Set<String> CONTINUATIONS = Set.of(
            "UNION", "ALL", "EXCEPT", "INTERSECT", "THEN", "FOR", "DO"
    );

    private final boolean allowAdministrative;
    private final boolean separatorlessBatches;

    public SqlStatementPolicy(boolean allowAdministrative) {
        this(allowAdministrative, false);
    }

    /**
     * @param allowAdministrative whether DDL and DCL may run
     * @param separatorlessBatches whether the backend runs several statements without {@code ;}
     */
    public SqlStatementPolicy(boolean allowAdministrative, boolean separatorlessBatches) {
        this.allowAdministrative = allowAdministrative;
        this.separatorlessBatches = separatorlessBatches;
    }

    /**
     * Check a statement before it touches the connection.
     *
     * @param sql statement text
     * @throws ValidationException when the text holds no statement at all
     * @throws PermanentBackendException when the statement is not allowed
     */
    public void check(String sql) {
        String masked = SqlText.mask(sql);
        if (masked.isBlank()) {
            throw new ValidationException("Query contains no SQL statement");
        }
        if (allowAdministrative) {
            return;
        }

        int semicolon = masked.indexOf(';');
        if (semicolon != -1 && !masked.substring(semicolon + 1).replace(";", "").isBlank()) {
            throw multipleStatements();
        }

        List<Keyword> keywords = keywords(masked);
        if (keywords.isEmpty()) {
            return;
        }
        String leading = keywords.get(0).word();
        if (ADMINISTRATIVE.contains(leading)) {
            throw notAllowed(leading);
        }
        for (Keyword keyword : keywords) {
            if (ADMINISTRATIVE_ANYWHERE.contains(keyword.word())) {
                throw notAllowed(keyword.word());
            }
        }
        if (separatorlessBatches) {
            checkBatch(keywords);
        }
    }

    private static void checkBatch(List<Keyword> keywords) {
        for (Keyword keyword : keywords) {
            if (PROCEDURE_CALLS.contains(keyword.word())) {
                throw PermanentBackendException.policyViolation("Procedure calls are not allowed for this data source");
            }
        }

        String first = null;
        boolean insertSourceSeen = false;
        String previous = "";
        for (Keyword keyword : keywords) {
            String word = keyword.word();
            boolean starts = keyword.depth() == 0
                    && STATEMENT_STARTS.contains(word)
                    && !CONTINUATIONS.contains(previous);
            previous = word;
            if (!starts) {
                continue;
            }
            if (first == null) {
                first = word;
            } else if ("INSERT".equals(first) && "SELECT".equals(word) && !insertSourceSeen) {
                insertSourceSeen = true;
            } else {
                throw multipleStatements();
            }
        }
    }

    /**
     * Words of the masked text in order, upper-cased, with their parenthesis depth. Qualified
     * names ({@code t.drop}) and bracketed identifiers ({@code [drop]}) are not keywords.
     */
    static List<Keyword> keywords(String masked) {
        List<Keyword> words = new ArrayList<>();
        int depth = 0;
        int i = 0;
        int n = masked.length();
        while (i < n) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
                i++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
                i++;
            } else if (c == '[') {
                int close = masked.indexOf(']', i + 1);
                i = close == -1 ? n : close + 1;
            } else if (SqlText.isIdentifierStart(c)) {
                int start = i;
                while (i < n && SqlText.isIdentifierPart(masked.charAt(i))) {
                    i++;
                }
                if (!qualified(masked, start)) {
                    words.add(new Keyword(masked.substring(start, i).toUpperCase(Locale.ROOT), depth));
                }
            } else if (Character.isDigit(c) || c == '@' || c == '#' || c == '$') {
                // numbers, variables and temp-table names are not keywords
                i++;
                while (i < n && SqlText.isIdentifierPart(masked.charAt(i))) {
                    i++;
                }
            } else {
                i++;
            }
        }
        return words;
    }

    private static boolean qualified(String masked, int start) {
        int j = start - 1;
        while (j >= 0 && Character.isWhitespace(masked.charAt(j))) {
            j--;
        }
        return j >= 0 && masked.charAt(j) == '.';
    }

    private static PermanentBackendException multipleStatements() {
        return PermanentBackendException.policyViolation("Multiple statements are not allowed");
    }

    private static PermanentBackendException notAllowed(String keyword) {
        return PermanentBackendException.policyViolation("Statement type " + keyword + " is not allowed for this data source");
    }

    record Keyword(String word, int depth) {
    }
}
