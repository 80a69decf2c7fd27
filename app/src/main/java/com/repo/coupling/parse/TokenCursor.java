package com.repo.coupling.parse;

import java.util.List;
import java.util.StringJoiner;

/**
 * The only way the parser moves through a record's tokens.
 */
final class TokenCursor {

    private static final int CONTEXT_RADIUS = 2;
    private static final int CONTEXT_TOKEN_LIMIT = 60;

    private final List<String> tokens;
    private final long basePosition;
    private int index = -1;

    TokenCursor(List<String> tokens, long basePosition) {
        this.tokens = tokens;
        this.basePosition = basePosition;
    }

    boolean hasNext() {
        return index + 1 < tokens.size();
    }

    String advance() {
        index++;
        return tokens.get(index);
    }

    /**
     * Stream-wide position of the current token. Past the end once the record is exhausted.
     */
    long position() {
        return basePosition + Math.max(index, 0);
    }

    /**
     * Stream-wide position of an already visited token.
     */
    long positionOf(int tokenIndex) {
        return basePosition + tokenIndex;
    }

    long endPosition() {
        return basePosition + tokens.size();
    }

    /**
     * Tokens around the current one, the current token in brackets.
     */
    String context() {
        return contextAt(index);
    }

    String contextAt(int at) {
        StringJoiner joiner = new StringJoiner(" | ");
        int from = Math.max(0, at - CONTEXT_RADIUS);
        int to = Math.min(tokens.size() - 1, at + CONTEXT_RADIUS);
        for (int i = from; i <= to; i++) {
            String shown = printable(tokens.get(i));
            joiner.add(i == at ? "[" + shown + "]" : shown);
        }
        return joiner.toString();
    }

    static String printable(String token) {
        String shown = token.length() > CONTEXT_TOKEN_LIMIT
                ? token.substring(0, CONTEXT_TOKEN_LIMIT) + "..."
                : token;
        StringBuilder sb = new StringBuilder(shown.length());
        for (char c : shown.toCharArray()) {
            if (c == '\n') {
                sb.append("\\n");
            } else if (c < 0x20) {
                sb.append(String.format("\\x%02x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
