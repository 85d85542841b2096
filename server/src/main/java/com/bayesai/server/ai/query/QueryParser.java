package com.bayesai.server.ai.query;

import com.bayesai.server.ai.exception.QuerySyntaxException;
import com.bayesai.server.ai.exception.QuerySyntaxException.Reason;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses query strings of the form {@code A, B=b | C=c, D=d}.
 * <p>
 * Grammar:
 * <pre>
 *   query    := terms ('|' evidence)?
 *   terms    := target (',' target)*
 *   target   := NAME ('=' VALUE)?
 *   evidence := NAME '=' VALUE (',' NAME '=' VALUE)*
 * </pre>
 * NAME and VALUE are runs of letters, digits and underscores; whitespace between tokens is
 * ignored. Only syntax is checked here.
 */
public final class QueryParser {

    private final String input;
    private int pos;

    private QueryParser(String input) {
        this.input = input;
    }

    public static ProbabilityQuery parse(String query) {
        if (query == null || query.trim().isEmpty()) {
            throw new QuerySyntaxException(String.valueOf(query), Reason.EMPTY_QUERY, 0);
        }
        return new QueryParser(query).parseQuery();
    }

    private ProbabilityQuery parseQuery() {
        List<QueryVariable> targets = parseTerms(false);
        List<QueryVariable> evidence = new ArrayList<>();
        skipWhitespace();
        if (peek() == '|') {
            pos++;
            evidence = parseTerms(true);
            skipWhitespace();
        }
        if (pos < input.length()) {
            throw error(Reason.UNEXPECTED_CHARACTER);
        }
        return new ProbabilityQuery(targets, evidence);
    }

    private List<QueryVariable> parseTerms(boolean valueRequired) {
        List<QueryVariable> terms = new ArrayList<>();
        terms.add(parseTerm(valueRequired));
        skipWhitespace();
        while (peek() == ',') {
            pos++;
            terms.add(parseTerm(valueRequired));
            skipWhitespace();
        }
        return terms;
    }

    private QueryVariable parseTerm(boolean valueRequired) {
        skipWhitespace();
        String name = readWord();
        if (name.isEmpty()) {
            throw error(Reason.EXPECTED_NAME);
        }
        skipWhitespace();
        if (peek() != '=') {
            if (valueRequired) {
                throw error(Reason.UNVALUED_EVIDENCE);
            }
            return QueryVariable.of(name);
        }
        pos++;
        skipWhitespace();
        String value = readWord();
        if (value.isEmpty()) {
            throw error(Reason.EXPECTED_VALUE);
        }
        return QueryVariable.of(name, value);
    }

    private String readWord() {
        int start = pos;
        while (pos < input.length() && isWordChar(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private char peek() {
        return pos < input.length() ? input.charAt(pos) : '\0';
    }

    private QuerySyntaxException error(Reason reason) {
        return new QuerySyntaxException(input, reason, pos);
    }
}
