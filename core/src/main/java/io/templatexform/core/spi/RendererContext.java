package io.templatexform.core.spi;

/**
 * Per-document context handed to {@link TemplateRenderer#initialize(RendererContext)}.
 *
 * @param sourceFile the component source the tree was built from, may be {@code null}
 * @param outputDir  target directory, may be {@code null}
 */
public record RendererContext(RendererConfig config, String sourceFile, String outputDir) {

    public RendererContext {
        config = config != null ? config : RendererConfig.defaults();
        outputDir = outputDir != null ? outputDir : config.outputDir();
    }

    public static RendererContext defaults() {
        return new RendererContext(RendererConfig.defaults(), null, null);
    }

    public static RendererContext of(RendererConfig config) {
        return new RendererContext(config, null, null);
    }
}
