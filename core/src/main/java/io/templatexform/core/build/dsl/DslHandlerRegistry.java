package io.templatexform.core.build.dsl;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of reserved markup tags and the handlers that lower them. Thread-safe: registration and
 * lookup can happen concurrently.
 */
public final class DslHandlerRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(DslHandlerRegistry.class);

    private final Map<String, DslHandler> handlers = new ConcurrentHashMap<>();

    /** Creates a registry holding the built-in handlers. */
    public static DslHandlerRegistry withDefaults() {
        DslHandlerRegistry registry = new DslHandlerRegistry();
        registry.register("Loop", new LoopHandler());
        registry.register("If", ConditionHandlers.ifHandler());
        registry.register("ElseIf", ConditionHandlers.elseIfHandler());
        registry.register("Else", ConditionHandlers.elseHandler());
        registry.register("Var", VariableHandlers.varHandler());
        registry.register("Raw", VariableHandlers.rawHandler());
        registry.register("Slot", new SlotHandler());
        registry.register("Include", new IncludeHandler());
        registry.register("DefineBlock", BlockHandlers.defineBlockHandler());
        registry.register("Extends", BlockHandlers.extendsHandler());
        return registry;
    }

    /**
     * Registers a handler for a tag. A handler already registered for the tag is replaced.
     *
     * @throws IllegalArgumentException if the tag is blank
     */
    public void register(String tagName, DslHandler handler) {
        Objects.requireNonNull(tagName, "tagName must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        if (tagName.isBlank()) {
            throw new IllegalArgumentException("tagName must not be blank");
        }
        if (handlers.put(tagName, handler) != null) {
            LOG.warn("dsl.handler.overwritten: tag={}", tagName);
        }
    }

    public Optional<DslHandler> get(String tagName) {
        return Optional.ofNullable(handlers.get(tagName));
    }

    public boolean has(String tagName) {
        return handlers.containsKey(tagName);
    }

    /** Returns the registered tag names, sorted. */
    public List<String> tags() {
        return List.copyOf(new TreeSet<>(handlers.keySet()));
    }

    /** Removes a handler; returns {@code true} if one was registered. */
    public boolean unregister(String tagName) {
        return handlers.remove(tagName) != null;
    }

    public void clear() {
        handlers.clear();
    }

    public int size() {
        return handlers.size();
    }
}
