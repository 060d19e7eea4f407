package io.templatexform.core.error;

/** Thrown when a renderer configuration file has invalid syntax, unknown keys or wrong types. */
public final class RendererConfigException extends TemplateXformException {

    private static final long serialVersionUID = 1L;

    public RendererConfigException(String message, String source) {
        super(message, source, Phase.CONFIGURATION);
    }

    public RendererConfigException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.CONFIGURATION);
    }
}
