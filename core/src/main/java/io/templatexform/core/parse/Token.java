package io.templatexform.core.parse;

import java.util.List;

/**
 * A lexical token.
 *
 * @param text          source text of the token
 * @param value         cooked value for strings, {@code null} otherwise
 * @param newlineBefore a line terminator separates this token from the previous one
 * @param quasis        cooked template chunks, for {@link TokenType#TEMPLATE} only
 * @param spans         source ranges of template substitutions, for {@link TokenType#TEMPLATE} only
 */
record Token(
        TokenType type,
        String text,
        String value,
        int start,
        int end,
        boolean newlineBefore,
        List<String> quasis,
        List<Span> spans) {

    /** A half-open source range. */
    record Span(int start, int end) {}

    static Token simple(TokenType type, String text, int start, int end, boolean newlineBefore) {
        return new Token(type, text, null, start, end, newlineBefore, List.of(), List.of());
    }

    boolean is(String punctuatorOrName) {
        return (type == TokenType.PUNCTUATOR || type == TokenType.IDENTIFIER) && text.equals(punctuatorOrName);
    }

    boolean isIdentifier() {
        return type == TokenType.IDENTIFIER;
    }

    boolean isEof() {
        return type == TokenType.EOF;
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
