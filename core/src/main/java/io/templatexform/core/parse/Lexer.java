package io.templatexform.core.parse;

import io.templatexform.core.error.SourceParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * On-demand lexer for the TypeScript/JSX subset. Tokens are produced one at a time from the
 * current position, which the parser may {@link #reset(int)} to switch between token scanning
 * and the character-level scanning that JSX text requires.
 *
 * <p>Regular expression literals are context dependent; the parser asks for them explicitly via
 * {@link #rescanRegex(Token)} when a {@code /} appears where an operand is expected.
 */
final class Lexer {

    /** Punctuators, longest first so that greedy matching picks the right one. */
    private static final String[] PUNCTUATORS = {
        ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=",
        "=>", "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=", "%=",
        "&=", "|=", "^=", "<<", ">>", "**",
        "{", "}", "(", ")", "[", "]", ";", ",", "<", ">", "+", "-", "*", "/", "%", "&", "|", "^", "!", "~",
        "?", ":", "=", ".", "@"
    };

    private final String source;
    private final String sourceFile;
    private final int limit;
    private final LineMap lineMap;
    private int pos;

    Lexer(String source, String sourceFile, LineMap lineMap, int start, int limit) {
        this.source = source;
        this.sourceFile = sourceFile;
        this.lineMap = lineMap;
        this.pos = start;
        this.limit = limit;
    }

    int position() {
        return pos;
    }

    int limit() {
        return limit;
    }

    void reset(int position) {
        this.pos = position;
    }

    SourceParseException error(String message, int offset) {
        int at = Math.min(offset, source.length());
        return new SourceParseException(message, sourceFile, lineMap.line(at), lineMap.column(at), at);
    }

    /** Scans the next token from the current position. */
    Token next() {
        boolean newline = skipTrivia();
        if (pos >= limit) {
            return Token.simple(TokenType.EOF, "", limit, limit, newline);
        }
        int start = pos;
        char c = source.charAt(pos);

        if (isIdentifierStart(c) || (c == '#' && pos + 1 < limit && isIdentifierStart(source.charAt(pos + 1)))) {
            pos++;
            while (pos < limit && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            return Token.simple(TokenType.IDENTIFIER, source.substring(start, pos), start, pos, newline);
        }
        if (isDigit(c) || (c == '.' && pos + 1 < limit && isDigit(source.charAt(pos + 1)))) {
            return scanNumber(start, newline);
        }
        if (c == '"' || c == '\'') {
            return scanString(c, start, newline);
        }
        if (c == '`') {
            return scanTemplate(start, newline);
        }
        for (String punctuator : PUNCTUATORS) {
            if (source.startsWith(punctuator, pos) && pos + punctuator.length() <= limit) {
                // "?." followed by a digit is a conditional operator and a number
                if (punctuator.equals("?.") && pos + 2 < limit && isDigit(source.charAt(pos + 2))) {
                    continue;
                }
                pos += punctuator.length();
                return Token.simple(TokenType.PUNCTUATOR, punctuator, start, pos, newline);
            }
        }
        throw error("Unexpected character '" + c + "'", start);
    }

    /** Re-reads a {@code /} or {@code /=} token as a regular expression literal. */
    Token rescanRegex(Token slash) {
        pos = slash.start() + 1;
        boolean inClass = false;
        while (true) {
            if (pos >= limit || source.charAt(pos) == '\n') {
                throw error("Unterminated regular expression", slash.start());
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                pos += 2;
                continue;
            }
            if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                pos++;
                break;
            }
            pos++;
        }
        while (pos < limit && isIdentifierPart(source.charAt(pos))) {
            pos++;
        }
        return Token.simple(TokenType.REGEX, source.substring(slash.start(), pos), slash.start(), pos, slash.newlineBefore());
    }

    /** Skips whitespace and comments; returns {@code true} if a line terminator was crossed. */
    private boolean skipTrivia() {
        boolean newline = false;
        while (pos < limit) {
            char c = source.charAt(pos);
            if (c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029') {
                newline = true;
                pos++;
            } else if (Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF') {
                pos++;
            } else if (c == '/' && pos + 1 < limit && source.charAt(pos + 1) == '/') {
                while (pos < limit && source.charAt(pos) != '\n' && source.charAt(pos) != '\r') {
                    pos++;
                }
            } else if (c == '/' && pos + 1 < limit && source.charAt(pos + 1) == '*') {
                int end = source.indexOf("*/", pos + 2);
                if (end < 0 || end + 2 > limit) {
                    throw error("Unterminated comment", pos);
                }
                if (source.substring(pos, end).indexOf('\n') >= 0) {
                    newline = true;
                }
                pos = end + 2;
            } else {
                break;
            }
        }
        return newline;
    }

    private Token scanNumber(int start, boolean newline) {
        if (source.charAt(pos) == '0' && pos + 1 < limit && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < limit && (Character.digit(source.charAt(pos), 16) >= 0 || source.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            while (pos < limit && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            if (pos < limit && source.charAt(pos) == '.') {
                pos++;
                while (pos < limit && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                    pos++;
                }
            }
            if (pos < limit && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < limit && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < limit && isDigit(source.charAt(pos))) {
                    while (pos < limit && isDigit(source.charAt(pos))) {
                        pos++;
                    }
                } else {
                    pos = mark;
                }
            }
        }
        if (pos < limit && source.charAt(pos) == 'n') {
            pos++;
        }
        if (pos < limit && isIdentifierStart(source.charAt(pos))) {
            throw error("Identifier directly after number", pos);
        }
        return Token.simple(TokenType.NUMBER, source.substring(start, pos), start, pos, newline);
    }

    private Token scanString(char quote, int start, boolean newline) {
        pos++;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= limit) {
                throw error("Unterminated string literal", start);
            }
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                break;
            }
            if (c == '\n' || c == '\r') {
                throw error("Unterminated string literal", start);
            }
            if (c == '\\') {
                readEscape(value);
            } else {
                value.append(c);
                pos++;
            }
        }
        return new Token(
                TokenType.STRING,
                source.substring(start, pos),
                value.toString(),
                start,
                pos,
                newline,
                List.of(),
                List.of());
    }

    private Token scanTemplate(int start, boolean newline) {
        pos++;
        List<String> quasis = new ArrayList<>();
        List<Token.Span> spans = new ArrayList<>();
        StringBuilder chunk = new StringBuilder();
        while (true) {
            if (pos >= limit) {
                throw error("Unterminated template literal", start);
            }
            char c = source.charAt(pos);
            if (c == '`') {
                pos++;
                quasis.add(chunk.toString());
                break;
            }
            if (c == '\\') {
                readEscape(chunk);
            } else if (c == '$' && pos + 1 < limit && source.charAt(pos + 1) == '{') {
                quasis.add(chunk.toString());
                chunk.setLength(0);
                pos += 2;
                int exprStart = pos;
                spans.add(new Token.Span(exprStart, skipSubstitution(start)));
            } else {
                chunk.append(c);
                pos++;
            }
        }
        return new Token(
                TokenType.TEMPLATE, source.substring(start, pos), null, start, pos, newline, quasis, spans);
    }

    /** Scans tokens up to the {@code }} closing a template substitution; returns its offset. */
    private int skipSubstitution(int templateStart) {
        int depth = 0;
        while (true) {
            Token token = next();
            if (token.isEof()) {
                throw error("Unterminated template literal", templateStart);
            }
            if (token.is("{")) {
                depth++;
            } else if (token.is("}")) {
                if (depth == 0) {
                    return token.start();
                }
                depth--;
            }
        }
    }

    private void readEscape(StringBuilder out) {
        int escapeStart = pos;
        pos++;
        if (pos >= limit) {
            throw error("Unterminated escape sequence", escapeStart);
        }
        char c = source.charAt(pos++);
        switch (c) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case 'b' -> out.append('\b');
            case 'f' -> out.append('\f');
            case 'v' -> out.append('\u000B');
            case '0' -> out.append('\0');
            case '\r' -> {
                if (pos < limit && source.charAt(pos) == '\n') {
                    pos++;
                }
            }
            case '\n', '\u2028', '\u2029' -> {
                // line continuation
            }
            case 'x' -> out.append((char) readHex(2, escapeStart));
            case 'u' -> {
                if (pos < limit && source.charAt(pos) == '{') {
                    int close = source.indexOf('}', pos);
                    if (close < 0 || close >= limit) {
                        throw error("Invalid unicode escape", escapeStart);
                    }
                    int codePoint = parseHex(source.substring(pos + 1, close), escapeStart);
                    out.appendCodePoint(codePoint);
                    pos = close + 1;
                } else {
                    out.append((char) readHex(4, escapeStart));
                }
            }
            default -> out.append(c);
        }
    }

    private int readHex(int digits, int escapeStart) {
        if (pos + digits > limit) {
            throw error("Invalid escape sequence", escapeStart);
        }
        int value = parseHex(source.substring(pos, pos + digits), escapeStart);
        pos += digits;
        return value;
    }

    private int parseHex(String digits, int escapeStart) {
        try {
            return Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw error("Invalid escape sequence '\\" + digits + "'", escapeStart);
        }
    }

    static boolean isIdentifierStart(char c) {
        return c == '$' || c == '_' || Character.isLetter(c);
    }

    static boolean isIdentifierPart(char c) {
        return c == '$' || c == '_' || Character.isLetterOrDigit(c) || c == '\u200C' || c == '\u200D';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
