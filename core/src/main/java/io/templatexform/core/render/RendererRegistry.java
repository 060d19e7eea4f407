package io.templatexform.core.render;

import io.templatexform.core.error.RendererRegistrationException;
import io.templatexform.core.render.handlebars.HandlebarsRenderer;
import io.templatexform.core.render.latte.LatteRenderer;
import io.templatexform.core.render.liquid.LiquidRenderer;
import io.templatexform.core.render.react.ReactRenderer;
import io.templatexform.core.render.twig.TwigRenderer;
import io.templatexform.core.spi.RendererContext;
import io.templatexform.core.spi.RendererFactory;
import io.templatexform.core.spi.RendererMetadata;
import io.templatexform.core.spi.TargetRuntime;
import io.templatexform.core.spi.TemplateRenderer;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of renderers by id. Holds factories rather than instances because renderers keep
 * per-document state; {@link #create(String, RendererContext)} returns a fresh, initialized
 * renderer for every call. Thread-safe.
 */
public final class RendererRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RendererRegistry.class);

    private record Registration(RendererMetadata metadata, RendererFactory factory) {}

    private final Map<String, Registration> renderers = new ConcurrentHashMap<>();

    /** Creates a registry holding the React, Liquid, Handlebars, Twig and Latte renderers. */
    public static RendererRegistry withBuiltIns() {
        RendererRegistry registry = new RendererRegistry();
        registry.registerBuiltIn(ReactRenderer::new);
        registry.registerBuiltIn(LiquidRenderer::new);
        registry.registerBuiltIn(HandlebarsRenderer::new);
        registry.registerBuiltIn(TwigRenderer::new);
        registry.registerBuiltIn(LatteRenderer::new);
        return registry;
    }

    private void registerBuiltIn(RendererFactory factory) {
        register(factory.create().metadata(), factory);
    }

    /**
     * Registers a renderer factory under {@code metadata.id()}.
     *
     * @throws RendererRegistrationException if a renderer with the same id is already registered
     */
    public void register(RendererMetadata metadata, RendererFactory factory) {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
        Registration existing = renderers.putIfAbsent(metadata.id(), new Registration(metadata, factory));
        if (existing != null) {
            throw new RendererRegistrationException(
                    "Renderer already registered for id: '" + metadata.id() + "'", metadata.id());
        }
        LOG.debug(
                "renderer.registered: id={}, runtime={}, extension={}",
                metadata.id(),
                metadata.runtime(),
                metadata.fileExtension());
    }

    /**
     * Registers an existing renderer instance. Every {@code create} call returns that same instance,
     * so it must not be used for two documents at once.
     */
    public void registerInstance(TemplateRenderer renderer) {
        Objects.requireNonNull(renderer, "renderer must not be null");
        register(renderer.metadata(), () -> renderer);
    }

    /** Removes a renderer; returns {@code true} if one was registered. */
    public boolean unregister(String id) {
        boolean removed = renderers.remove(id) != null;
        if (removed) {
            LOG.debug("renderer.unregistered: id={}", id);
        }
        return removed;
    }

    public boolean has(String id) {
        return renderers.containsKey(id);
    }

    public Optional<RendererMetadata> metadata(String id) {
        return Optional.ofNullable(renderers.get(id)).map(Registration::metadata);
    }

    /** Returns the metadata of all registered renderers, sorted by id. */
    public List<RendererMetadata> allMetadata() {
        return renderers.values().stream()
                .map(Registration::metadata)
                .sorted(Comparator.comparing(RendererMetadata::id))
                .collect(Collectors.toList());
    }

    /** Returns the renderers targeting {@code runtime}, sorted by id. */
    public List<RendererMetadata> byRuntime(TargetRuntime runtime) {
        return allMetadata().stream().filter(m -> m.runtime() == runtime).collect(Collectors.toList());
    }

    /** Finds the renderer producing {@code extension}; the leading dot is optional and case is ignored. */
    public Optional<RendererMetadata> byExtension(String extension) {
        Objects.requireNonNull(extension, "extension must not be null");
        String normalized = (extension.startsWith(".") ? extension : "." + extension).toLowerCase(Locale.ROOT);
        return allMetadata().stream()
                .filter(m -> m.fileExtension().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }

    /** Creates and initializes a renderer, or returns empty when none is registered for {@code id}. */
    public Optional<TemplateRenderer> create(String id, RendererContext context) {
        Objects.requireNonNull(context, "context must not be null");
        Registration registration = renderers.get(id);
        if (registration == null) {
            return Optional.empty();
        }
        TemplateRenderer renderer = registration.factory().create();
        renderer.initialize(context);
        return Optional.of(renderer);
    }

    /**
     * Creates a renderer initialized with {@link RendererContext#defaults()}.
     *
     * @throws IllegalArgumentException if no renderer is registered for {@code id}
     */
    public TemplateRenderer require(String id) {
        return require(id, RendererContext.defaults());
    }

    /**
     * Creates a renderer initialized with {@code context}.
     *
     * @throws IllegalArgumentException if no renderer is registered for {@code id}
     */
    public TemplateRenderer require(String id, RendererContext context) {
        return create(id, context)
                .orElseThrow(() -> new IllegalArgumentException("No renderer registered for id: '" + id + "'"));
    }

    public int size() {
        return renderers.size();
    }
}
