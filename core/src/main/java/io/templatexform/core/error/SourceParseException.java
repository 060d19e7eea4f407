package io.templatexform.core.error;

/**
 * Thrown when component source text cannot be parsed. Carries the 1-based line and 0-based column
 * of the offending token so callers can report {@code file:line:col} diagnostics.
 */
public final class SourceParseException extends TemplateXformException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;
    private final int offset;

    public SourceParseException(String message, String sourceFile, int line, int column, int offset) {
        super(message, sourceFile, Phase.PARSE);
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /** Character offset into the source text. */
    public int offset() {
        return offset;
    }

    /** Formats the error as {@code file:line:col: message}. */
    public String toDiagnostic() {
        String file = sourceFile() != null ? sourceFile() : "<source>";
        return file + ":" + line + ":" + column + ": " + getMessage();
    }
}
