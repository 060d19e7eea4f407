package io.templatexform.core.error;

/**
 * Abstract base for all template-xform exceptions. Never thrown directly; use one of the concrete
 * subclasses. Most failures inside {@code buildTree} and {@code transform} are reported through
 * result values instead, so these exceptions surface only at the edges (parsing, configuration
 * loading, renderer registration).
 */
public abstract class TemplateXformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        CONFIGURATION,
        RENDER
    }

    private final String sourceFile;
    private final Phase phase;

    protected TemplateXformException(String message, String sourceFile, Phase phase) {
        super(message);
        this.sourceFile = sourceFile;
        this.phase = phase;
    }

    protected TemplateXformException(String message, Throwable cause, String sourceFile, Phase phase) {
        super(message, cause);
        this.sourceFile = sourceFile;
        this.phase = phase;
    }

    /** The source file or resource that triggered the error, or {@code null} if unknown. */
    public String sourceFile() {
        return sourceFile;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
