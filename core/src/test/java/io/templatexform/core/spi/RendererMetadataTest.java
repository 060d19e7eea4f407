package io.templatexform.core.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the small value types renderers are described and configured with. */
class RendererMetadataTest {

    private static final RendererFeatures FEATURES = RendererFeatures.textEngine(true, false);

    @Test
    void versionAndDescriptionDefault() {
        var metadata = new RendererMetadata("jinja", null, TargetRuntime.JS, ".j2", null, FEATURES);

        assertThat(metadata.version()).isEqualTo("1.0.0");
        assertThat(metadata.description()).isEmpty();
    }

    @Test
    void blankIdIsRejected() {
        assertThatThrownBy(() -> new RendererMetadata(" ", null, TargetRuntime.JS, ".j2", null, FEATURES))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("renderer id must not be blank");
    }

    @Test
    void extensionNeedsLeadingDot() {
        assertThatThrownBy(() -> new RendererMetadata("jinja", null, TargetRuntime.JS, "j2", null, FEATURES))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("fileExtension must start with '.': j2");
    }

    @Test
    @DisplayName("text engines share partials, filters, raw output and comments")
    void textEngineFeatures() {
        assertThat(FEATURES.inheritance()).isTrue();
        assertThat(FEATURES.macros()).isFalse();
        assertThat(FEATURES.partials()).isTrue();
        assertThat(FEATURES.filters()).isTrue();
        assertThat(FEATURES.raw()).isTrue();
        assertThat(FEATURES.comments()).isTrue();
        assertThat(FEATURES.async()).isFalse();
    }

    @Test
    void configDefaultsAndCopies() {
        var defaults = RendererConfig.defaults();
        var changed = defaults.withPrettyPrint(false).withFilterMapping("date", "strftime");

        assertThat(defaults.fileExtension()).isNull();
        assertThat(defaults.outputDir()).isEqualTo(".");
        assertThat(defaults.indent()).isEqualTo("  ");
        assertThat(defaults.prettyPrint()).isTrue();
        assertThat(defaults.filterMapping(StandardFilter.DATE)).isEmpty();
        assertThat(changed.prettyPrint()).isFalse();
        assertThat(changed.filterMapping(StandardFilter.DATE)).contains("strftime");
    }

    @Test
    void contextOutputDirFallsBackToConfig() {
        var config = new RendererConfig(null, "build/out", null, true, null, null);

        assertThat(RendererContext.of(config).outputDir()).isEqualTo("build/out");
        assertThat(new RendererContext(config, "A.tsx", "elsewhere").outputDir()).isEqualTo("elsewhere");
        assertThat(new RendererContext(null, null, null).config()).isEqualTo(RendererConfig.defaults());
    }

    @Test
    void filterDefinitionArguments() {
        assertThat(FilterDefinition.of("upcase").hasArgs()).isFalse();
        assertThat(FilterDefinition.of("date", "\"%Y\"").args()).containsExactly("\"%Y\"");
    }
}
