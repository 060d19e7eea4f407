package io.templatexform.core.build;

import io.templatexform.core.model.BuildResult;
import io.templatexform.core.model.TemplateOutput;
import java.util.Objects;

/**
 * Result of {@link TemplateCompiler#compile}.
 *
 * @param build  the build stage result
 * @param output rendered output, or {@code null} when the build had errors or nothing to render
 */
public record CompileOutcome(BuildResult build, TemplateOutput output) {

    public CompileOutcome {
        Objects.requireNonNull(build, "build must not be null");
    }

    public boolean rendered() {
        return output != null;
    }
}
