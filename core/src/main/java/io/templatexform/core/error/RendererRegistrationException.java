package io.templatexform.core.error;

/** Thrown when a renderer cannot be registered, e.g. because its id is already taken. */
public final class RendererRegistrationException extends TemplateXformException {

    private static final long serialVersionUID = 1L;

    private final String rendererId;

    public RendererRegistrationException(String message, String rendererId) {
        super(message, null, Phase.RENDER);
        this.rendererId = rendererId;
    }

    /** The renderer id involved in the failed registration. */
    public String rendererId() {
        return rendererId;
    }
}
