package io.templatexform.core.build;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options for one {@link TemplateCompiler#buildTree(String, BuildOptions)} call.
 *
 * <p>Instances are immutable; use {@link #builder()} to create one.
 */
public final class BuildOptions {

    private static final BuildOptions DEFAULTS = builder().build();

    private final String sourceFile;
    private final String componentName;
    private final Set<String> passthroughComponents;
    private final ComponentTypePatterns componentTypePatterns;
    private final boolean includeSourceLocation;
    private final boolean preserveComments;

    private BuildOptions(Builder builder) {
        this.sourceFile = builder.sourceFile;
        this.componentName = builder.componentName;
        this.passthroughComponents = Set.copyOf(builder.passthroughComponents);
        this.componentTypePatterns = builder.componentTypePatterns;
        this.includeSourceLocation = builder.includeSourceLocation;
        this.preserveComments = builder.preserveComments;
    }

    public static BuildOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Source identifier for diagnostics and metadata, or {@code null}. */
    public String sourceFile() {
        return sourceFile;
    }

    /** Component to build when a file declares several, or {@code null} to pick the first. */
    public String componentName() {
        return componentName;
    }

    /** Component names kept as literal elements instead of becoming includes. */
    public Set<String> passthroughComponents() {
        return passthroughComponents;
    }

    public boolean isPassthrough(String tagName) {
        return passthroughComponents.contains(tagName);
    }

    public ComponentTypePatterns componentTypePatterns() {
        return componentTypePatterns;
    }

    public boolean includeSourceLocation() {
        return includeSourceLocation;
    }

    public boolean preserveComments() {
        return preserveComments;
    }

    /** Returns a builder pre-populated with these options. */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .sourceFile(sourceFile)
                .componentName(componentName)
                .componentTypePatterns(componentTypePatterns)
                .includeSourceLocation(includeSourceLocation)
                .preserveComments(preserveComments);
        builder.passthroughComponents.addAll(passthroughComponents);
        return builder;
    }

    /** Fluent builder for {@link BuildOptions}. */
    public static final class Builder {

        private String sourceFile;
        private String componentName;
        private final Set<String> passthroughComponents = new LinkedHashSet<>();
        private ComponentTypePatterns componentTypePatterns = ComponentTypePatterns.defaults();
        private boolean includeSourceLocation;
        private boolean preserveComments;

        Builder() {}

        public Builder sourceFile(String value) {
            this.sourceFile = value;
            return this;
        }

        public Builder componentName(String value) {
            this.componentName = value;
            return this;
        }

        public Builder passthroughComponents(Set<String> names) {
            passthroughComponents.clear();
            passthroughComponents.addAll(names);
            return this;
        }

        public Builder passthrough(String... names) {
            for (String name : names) {
                passthroughComponents.add(name);
            }
            return this;
        }

        public Builder componentTypePatterns(ComponentTypePatterns patterns) {
            this.componentTypePatterns = patterns != null ? patterns : ComponentTypePatterns.defaults();
            return this;
        }

        public Builder includeSourceLocation(boolean enabled) {
            this.includeSourceLocation = enabled;
            return this;
        }

        public Builder preserveComments(boolean enabled) {
            this.preserveComments = enabled;
            return this;
        }

        public BuildOptions build() {
            return new BuildOptions(this);
        }
    }
}
