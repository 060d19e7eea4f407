package io.templatexform.core.spi;

/** Creates fresh renderer instances; renderers hold per-document state and are not shared. */
@FunctionalInterface
public interface RendererFactory {

    TemplateRenderer create();
}
