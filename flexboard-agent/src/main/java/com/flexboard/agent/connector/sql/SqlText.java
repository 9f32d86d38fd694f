package com.flexboard.agent.connector.sql;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical helpers shared by placeholder parsing and statement checks.
 */
final class SqlText {

    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)?\\$");

    private SqlText() {
    }

    /**
     * Blank out everything that is not SQL code: string literals, quoted identifiers, line and
     * block comments and dollar-quoted bodies. The result has the same length as the input, so
     * offsets found in the masked text apply to the original.
     *
     * @param sql statement text
     * @return masked text
     */
    static String mask(String sql) {
        char[] out = sql.toCharArray();
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : '\0';
            if (c == '\'' || c == '"' || c == '`') {
                int end = closingQuote(sql, i, c);
                blank(out, i, end);
                i = end;
            } else if (c == '-' && next == '-') {
                int end = sql.indexOf('\n', i);
                end = end == -1 ? n : end;
                blank(out, i, end);
                i = end;
            } else if (c == '/' && next == '*') {
                int end = sql.indexOf("*/", i + 2);
                end = end == -1 ? n : end + 2;
                blank(out, i, end);
                i = end;
            } else if (c == '$' && (i == 0 || !isIdentifierPart(sql.charAt(i - 1)))) {
                int end = dollarQuoteEnd(sql, i);
                if (end > i) {
                    blank(out, i, end);
                    i = end;
                } else {
                    i++;
                }
            } else {
                i++;
            }
        }
        return new String(out);
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int closingQuote(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    /**
     * @return end offset (exclusive) of a dollar-quoted body starting at {@code start}, or
     *         {@code start} when no dollar quote opens there
     */
    private static int dollarQuoteEnd(String sql, int start) {
        Matcher m = DOLLAR_TAG.matcher(sql);
        if (!m.find(start) || m.start() != start) {
            return start;
        }
        String tag = m.group();
        int close = sql.indexOf(tag, m.end());
        return close == -1 ? sql.length() : close + tag.length();
    }

    private static void blank(char[] out, int from, int to) {
        for (int i = from; i < to && i < out.length; i++) {
            if (out[i] != '\n') {
                out[i] = ' ';
            }
        }
    }
}
