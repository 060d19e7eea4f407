package io.templatexform.core.build;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Regex helpers over raw source text used while lowering markup. */
final class SourceText {

    private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-zA-Z0-9]*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NEWLINE_ONLY = Pattern.compile("^\\s*\\n[\\s]*$");
    private static final Pattern ID_ACCESS =
            Pattern.compile("(?<![\\w$.])([A-Za-z_$][\\w$]*)\\s*\\??\\.\\s*id(?![\\w$])");

    private SourceText() {}

    static boolean isPascalCase(String name) {
        return name != null && PASCAL_CASE.matcher(name).matches();
    }

    /** Replaces every whitespace run with a single space. */
    static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ");
    }

    static String[] splitWhitespace(String text) {
        return WHITESPACE.split(text);
    }

    /** {@code true} for whitespace that contains a line break and nothing else. */
    static boolean isNewlineOnly(String text) {
        return NEWLINE_ONLY.matcher(text).matches();
    }

    /** Returns {@code true} when {@code text} reads {@code binding.id} or {@code binding?.id}. */
    static boolean readsId(String text, String binding) {
        Matcher matcher = ID_ACCESS.matcher(text);
        while (matcher.find()) {
            if (matcher.group(1).equals(binding)) {
                return true;
            }
        }
        return false;
    }
}
