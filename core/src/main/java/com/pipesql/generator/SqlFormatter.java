package com.pipesql.generator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Lays out single-line SQL from {@link SQLGenerator} for reading.
 *
 * <p>Each top-level clause starts a line, clause bodies are indented below
 * their keyword and select-list items go one per line. Subqueries are
 * indented one level deeper than their enclosing clause. Quoted text is
 * copied verbatim.
 */
public final class SqlFormatter {

    private static final String INDENT = "  ";

    /** Clauses whose body goes on the following lines. */
    private static final Set<String> BLOCK_CLAUSES = Set.of("SELECT", "FROM", "WHERE", "GROUP", "HAVING", "ORDER");

    /** Clauses that stay on one line. */
    private static final Set<String> LINE_CLAUSES = Set.of(
        "WITH", "JOIN", "LEFT", "RIGHT", "FULL", "INNER", "LIMIT", "OFFSET", "FETCH", "UNION");

    /** Clauses whose body is a comma separated list printed one item per line. */
    private static final Set<String> LIST_CLAUSES = Set.of("SELECT", "GROUP", "ORDER");

    private SqlFormatter() {
        // Utility class - prevent instantiation
    }

    private enum TokenType {
        WORD, QUOTED, OPEN, CLOSE, COMMA
    }

    private record Token(TokenType type, String text, boolean spaceBefore) {
    }

    /** One parenthesis level; query levels hold a statement. */
    private static final class Level {
        final boolean query;
        final int depth;
        String clause;

        Level(boolean query, int depth) {
            this.query = query;
            this.depth = depth;
        }
    }

    /**
     * Formats SQL text.
     *
     * @param sql single-line SQL
     * @return the formatted SQL, ending with a newline
     */
    public static String format(String sql) {
        List<Token> tokens = tokenize(sql);
        StringBuilder out = new StringBuilder();
        Deque<Level> levels = new ArrayDeque<>();
        levels.push(new Level(true, 0));
        boolean bodyPending = false;
        String previous = null;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Level level = levels.peek();
            String word = token.type() == TokenType.WORD ? token.text() : null;

            if (level.query && word != null && isClause(word, previous)) {
                newLine(out, level.depth);
                out.append(word);
                level.clause = word;
                bodyPending = BLOCK_CLAUSES.contains(word);
                previous = word;
                // GROUP BY, ORDER BY and UNION ALL keep their second keyword on the same line
                if (i + 1 < tokens.size() && isSecondKeyword(word, tokens.get(i + 1).text())) {
                    out.append(' ').append(tokens.get(++i).text());
                    previous = tokens.get(i).text();
                }
                continue;
            }

            switch (token.type()) {
                case OPEN: {
                    startBody(out, level, bodyPending, token);
                    bodyPending = false;
                    boolean subquery = i + 1 < tokens.size()
                        && (tokens.get(i + 1).text().equals("SELECT") || tokens.get(i + 1).text().equals("WITH"));
                    out.append('(');
                    levels.push(new Level(subquery, subquery ? bodyDepth(level) : level.depth));
                    break;
                }
                case CLOSE: {
                    Level closed = levels.size() > 1 ? levels.pop() : level;
                    if (closed.query) {
                        newLine(out, closed.depth - 1);
                    }
                    out.append(')');
                    break;
                }
                case COMMA:
                    out.append(',');
                    if (level.query && LIST_CLAUSES.contains(level.clause)) {
                        newLine(out, level.depth + 1);
                    } else if (level.query && "WITH".equals(level.clause)) {
                        newLine(out, level.depth);
                    }
                    break;
                default:
                    startBody(out, level, bodyPending, token);
                    bodyPending = false;
                    out.append(token.text());
                    break;
            }
            previous = token.text();
        }
        return out.toString().stripTrailing() + "\n";
    }

    private static void startBody(StringBuilder out, Level level, boolean bodyPending, Token token) {
        if (bodyPending) {
            newLine(out, level.depth + 1);
        } else if (token.spaceBefore() && !endsWithIndent(out)) {
            out.append(' ');
        }
    }

    private static int bodyDepth(Level level) {
        return level.clause == null || LINE_CLAUSES.contains(level.clause) ? level.depth + 1 : level.depth + 2;
    }

    private static boolean isClause(String word, String previous) {
        if (!BLOCK_CLAUSES.contains(word) && !LINE_CLAUSES.contains(word)) {
            return false;
        }
        if (word.equals("JOIN")) {
            return !("LEFT".equals(previous) || "RIGHT".equals(previous)
                || "FULL".equals(previous) || "INNER".equals(previous));
        }
        // FETCH FIRST follows OFFSET m ROWS on the same line
        return !(word.equals("FETCH") && "ROWS".equals(previous));
    }

    private static boolean isSecondKeyword(String clause, String next) {
        return (clause.equals("GROUP") || clause.equals("ORDER")) && next.equals("BY")
            || clause.equals("UNION") && next.equals("ALL");
    }

    private static void newLine(StringBuilder out, int depth) {
        if (out.length() == 0) {
            out.append(INDENT.repeat(Math.max(depth, 0)));
            return;
        }
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == ' ') {
            end--;
        }
        out.setLength(end);
        out.append('\n').append(INDENT.repeat(Math.max(depth, 0)));
    }

    private static boolean endsWithIndent(StringBuilder out) {
        if (out.length() == 0) {
            return true;
        }
        char last = out.charAt(out.length() - 1);
        return last == '\n' || last == '(' || (last == ' ' && onlySpacesSinceNewline(out));
    }

    private static boolean onlySpacesSinceNewline(StringBuilder out) {
        for (int i = out.length() - 1; i >= 0; i--) {
            char c = out.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ') {
                return false;
            }
        }
        return true;
    }

    private static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = sql.length();
        boolean space = false;
        while (i < length) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                space = true;
                i++;
                continue;
            }
            if (c == '\'' || c == '"' || c == '`' || c == '[') {
                char close = c == '[' ? ']' : c;
                int start = i++;
                while (i < length) {
                    if (sql.charAt(i) == close) {
                        // doubled quote characters escape themselves
                        if (i + 1 < length && sql.charAt(i + 1) == close) {
                            i += 2;
                            continue;
                        }
                        break;
                    }
                    i++;
                }
                i = Math.min(i + 1, length);
                tokens.add(new Token(TokenType.QUOTED, sql.substring(start, i), space));
            } else if (c == '(') {
                tokens.add(new Token(TokenType.OPEN, "(", space));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(TokenType.CLOSE, ")", space));
                i++;
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", space));
                i++;
            } else {
                int start = i;
                while (i < length && !Character.isWhitespace(sql.charAt(i)) && "()',\"`[".indexOf(sql.charAt(i)) < 0) {
                    i++;
                }
                tokens.add(new Token(TokenType.WORD, sql.substring(start, i), space));
            }
            space = false;
        }
        return tokens;
    }
}
