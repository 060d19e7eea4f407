package io.templatexform.core.spi;

/**
 * Capability flags a renderer advertises. Callers use them to decide, for example, whether a
 * layout can be expressed through inheritance or has to be composed.
 */
public record RendererFeatures(
        boolean inheritance,
        boolean partials,
        boolean filters,
        boolean macros,
        boolean async,
        boolean raw,
        boolean comments) {

    /** Features shared by every text template engine: partials, filters, raw output and comments. */
    public static RendererFeatures textEngine(boolean inheritance, boolean macros) {
        return new RendererFeatures(inheritance, true, true, macros, false, true, true);
    }
}
