package io.templatexform.core.spi;

import java.util.Objects;

/**
 * Identity of a renderer.
 *
 * @param id            unique lowercase id, e.g. {@code liquid}
 * @param fileExtension extension of produced files, including the dot
 */
public record RendererMetadata(
        String id,
        String version,
        TargetRuntime runtime,
        String fileExtension,
        String description,
        RendererFeatures features) {

    public RendererMetadata {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(runtime, "runtime must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
        Objects.requireNonNull(features, "features must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("renderer id must not be blank");
        }
        if (!fileExtension.startsWith(".")) {
            throw new IllegalArgumentException("fileExtension must start with '.': " + fileExtension);
        }
        version = version != null ? version : "1.0.0";
        description = description != null ? description : "";
    }
}
