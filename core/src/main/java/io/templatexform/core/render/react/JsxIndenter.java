package io.templatexform.core.render.react;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Re-indents flat JSX text by nesting depth.
 *
 * <p>Opening tags increase the depth, closing tags decrease it, self-closing tags and {@code {...}}
 * expressions keep it. The later lines of a multi-line expression keep their indentation relative to
 * each other, so indenting already indented output returns it unchanged.
 */
final class JsxIndenter {

    static final String DEFAULT_UNIT = "  ";

    private JsxIndenter() {}

    static String indent(String input) {
        return indent(input, DEFAULT_UNIT);
    }

    static String indent(String input, String unit) {
        List<String> lines = new ArrayList<>();
        int depth = 0;
        int pos = 0;
        int length = input.length();
        while (pos < length) {
            while (pos < length && isWhitespace(input.charAt(pos))) {
                pos++;
            }
            if (pos >= length) {
                break;
            }
            char c = input.charAt(pos);
            if (c == '<' && pos + 1 < length && input.charAt(pos + 1) == '/') {
                int end = input.indexOf('>', pos);
                if (end < 0) {
                    lines.add(unit.repeat(depth) + input.substring(pos).trim());
                    break;
                }
                depth = Math.max(0, depth - 1);
                lines.add(unit.repeat(depth) + input.substring(pos, end + 1));
                pos = end + 1;
            } else if (c == '<') {
                int end = tagEnd(input, pos);
                if (end < 0) {
                    lines.add(unit.repeat(depth) + input.substring(pos).trim());
                    break;
                }
                String tag = input.substring(pos, end + 1);
                lines.add(unit.repeat(depth) + tag);
                if (!tag.endsWith("/>")) {
                    depth++;
                }
                pos = end + 1;
            } else if (c == '{') {
                int end = matchingBrace(input, pos);
                if (end < 0) {
                    lines.add(unit.repeat(depth) + input.substring(pos).trim());
                    break;
                }
                addExpression(lines, unit.repeat(depth), input.substring(pos, end + 1));
                pos = end + 1;
            } else {
                int end = pos;
                while (end < length && input.charAt(end) != '<' && input.charAt(end) != '{') {
                    end++;
                }
                String text = input.substring(pos, end).trim();
                if (!text.isEmpty()) {
                    lines.add(unit.repeat(depth) + text);
                }
                pos = end;
            }
        }
        return String.join("\n", lines) + "\n";
    }

    private static void addExpression(List<String> lines, String pad, String expression) {
        String[] exprLines = expression.split("\n", -1);
        lines.add(pad + exprLines[0]);
        int common = Integer.MAX_VALUE;
        for (int i = 1; i < exprLines.length; i++) {
            if (!exprLines[i].isBlank()) {
                common = Math.min(common, leadingWhitespace(exprLines[i]));
            }
        }
        for (int i = 1; i < exprLines.length; i++) {
            String line = exprLines[i];
            if (!line.isBlank()) {
                lines.add(pad + line.substring(common).stripTrailing());
            }
        }
    }

    private static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    /** Index of the {@code >} ending the tag at {@code start}, skipping quoted and braced parts. */
    static int tagEnd(String input, int start) {
        int braces = 0;
        char quote = 0;
        for (int pos = start + 1; pos < input.length(); pos++) {
            char c = input.charAt(pos);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '{') {
                braces++;
            } else if (c == '}') {
                braces--;
            } else if (c == '>' && braces == 0) {
                return pos;
            }
        }
        return -1;
    }

    /** Index of the brace closing the expression at {@code start}, or {@code -1}. */
    static int matchingBrace(String input, int start) {
        Scanner scanner = new Scanner(input, start);
        return scanner.closeOf(start);
    }

    /**
     * Counts unbalanced expression braces of a whole JSX document. Quotes count only inside
     * expressions and tags: an apostrophe in JSX text does not open a string.
     *
     * @return a negative value when a brace closes with nothing open, else the number left open
     */
    static int braceBalance(String input) {
        Scanner scanner = new Scanner(input, 0);
        return scanner.balance();
    }

    /** Tracks whether the current character is JSX text, a tag, or a JS expression. */
    private static final class Scanner {

        private enum Mode {
            TEXT,
            TAG,
            CLOSING_TAG,
            EXPRESSION
        }

        private static final String TAG_PRECEDERS = "(,=?:{[&|!;>";

        private final String input;
        private final int start;
        private final Deque<Mode> modes = new ArrayDeque<>();

        Scanner(String input, int start) {
            this.input = input;
            this.start = start;
        }

        int closeOf(int open) {
            modes.push(Mode.EXPRESSION);
            int pos = open + 1;
            while (pos < input.length()) {
                int next = step(pos);
                if (next < 0) {
                    return -1;
                }
                if (modes.isEmpty()) {
                    return next - 1;
                }
                pos = next;
            }
            return -1;
        }

        int balance() {
            int pos = start;
            while (pos < input.length()) {
                int next;
                if (modes.isEmpty()) {
                    char c = input.charAt(pos);
                    if (c == '}') {
                        return -1;
                    }
                    if (c == '{') {
                        modes.push(Mode.EXPRESSION);
                    } else if (c == '<' && opensTag(pos)) {
                        modes.push(isClosingTag(pos) ? Mode.CLOSING_TAG : Mode.TAG);
                    }
                    next = pos + 1;
                } else {
                    if (input.charAt(pos) == '}' && !modes.contains(Mode.EXPRESSION)) {
                        return -1;
                    }
                    next = step(pos);
                }
                if (next < 0) {
                    break;
                }
                pos = next;
            }
            int open = 0;
            for (Mode mode : modes) {
                if (mode == Mode.EXPRESSION) {
                    open++;
                }
            }
            return open;
        }

        /** Consumes the token at {@code pos}; returns the next position or {@code -1}. */
        private int step(int pos) {
            char c = input.charAt(pos);
            Mode mode = modes.peek();
            if (mode == Mode.TEXT) {
                if (c == '{') {
                    modes.push(Mode.EXPRESSION);
                } else if (c == '}') {
                    closeExpression();
                } else if (c == '<' && opensTag(pos)) {
                    if (isClosingTag(pos)) {
                        modes.pop();
                        modes.push(Mode.CLOSING_TAG);
                    } else {
                        modes.push(Mode.TAG);
                    }
                }
                return pos + 1;
            }
            if (mode == Mode.TAG || mode == Mode.CLOSING_TAG) {
                if (c == '"' || c == '\'') {
                    return skipString(pos);
                }
                if (c == '{') {
                    modes.push(Mode.EXPRESSION);
                } else if (c == '>') {
                    modes.pop();
                    if (mode == Mode.TAG && input.charAt(pos - 1) != '/') {
                        modes.push(Mode.TEXT);
                    }
                }
                return pos + 1;
            }
            if (c == '"' || c == '\'' || c == '`') {
                return skipString(pos);
            }
            if (c == '{') {
                modes.push(Mode.EXPRESSION);
            } else if (c == '}') {
                closeExpression();
            } else if (c == '<' && opensTag(pos) && followsOperator(pos)) {
                modes.push(isClosingTag(pos) ? Mode.CLOSING_TAG : Mode.TAG);
            }
            return pos + 1;
        }

        private void closeExpression() {
            while (!modes.isEmpty() && modes.peek() != Mode.EXPRESSION) {
                modes.pop();
            }
            if (!modes.isEmpty()) {
                modes.pop();
            }
        }

        private boolean opensTag(int pos) {
            if (pos + 1 >= input.length()) {
                return false;
            }
            char next = input.charAt(pos + 1);
            return Character.isLetter(next) || next == '/' || next == '>';
        }

        private boolean isClosingTag(int pos) {
            return input.charAt(pos + 1) == '/';
        }

        /** A {@code <} inside an expression starts JSX only after an operator, never after an operand. */
        private boolean followsOperator(int pos) {
            int i = pos - 1;
            while (i >= 0 && isWhitespace(input.charAt(i))) {
                i--;
            }
            return i < 0 || TAG_PRECEDERS.indexOf(input.charAt(i)) >= 0 || input.startsWith("return", i - 5);
        }

        private int skipString(int pos) {
            char quote = input.charAt(pos);
            int i = pos + 1;
            while (i < input.length()) {
                char c = input.charAt(i);
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote) {
                    return i + 1;
                }
                i++;
            }
            return -1;
        }
    }
}
