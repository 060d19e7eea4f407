package io.templatexform.core.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.templatexform.core.error.RendererRegistrationException;
import io.templatexform.core.render.liquid.LiquidRenderer;
import io.templatexform.core.spi.RendererConfig;
import io.templatexform.core.spi.RendererContext;
import io.templatexform.core.spi.RendererFactory;
import io.templatexform.core.spi.RendererFeatures;
import io.templatexform.core.spi.RendererMetadata;
import io.templatexform.core.spi.StandardFilter;
import io.templatexform.core.spi.TargetRuntime;
import io.templatexform.core.spi.TemplateRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link RendererRegistry}. */
class RendererRegistryTest {

    private static final RendererMetadata MOCK_METADATA = new RendererMetadata(
            "mock", null, TargetRuntime.JS, ".mock", null, RendererFeatures.textEngine(false, false));

    @Nested
    @DisplayName("Built-in renderers")
    class BuiltIns {

        private final RendererRegistry registry = RendererRegistry.withBuiltIns();

        @Test
        void registersAllFiveEnginesSortedById() {
            assertThat(registry.size()).isEqualTo(5);
            assertThat(registry.allMetadata())
                    .extracting(RendererMetadata::id)
                    .containsExactly("handlebars", "latte", "liquid", "react", "twig");
        }

        @Test
        void filtersByRuntime() {
            assertThat(registry.byRuntime(TargetRuntime.PHP))
                    .extracting(RendererMetadata::id)
                    .containsExactly("latte", "twig");
            assertThat(registry.byRuntime(TargetRuntime.JS))
                    .extracting(RendererMetadata::id)
                    .containsExactly("handlebars", "liquid", "react");
        }

        @Test
        void findsByExtensionWithOrWithoutDot() {
            assertThat(registry.byExtension(".tsx")).map(RendererMetadata::id).contains("react");
            assertThat(registry.byExtension("HBS")).map(RendererMetadata::id).contains("handlebars");
            assertThat(registry.byExtension(".vue")).isEmpty();
        }

        @Test
        void requireReturnsInitializedFreshInstances() {
            TemplateRenderer first = registry.require("liquid");
            TemplateRenderer second = registry.require("liquid");

            assertThat(first).isInstanceOf(LiquidRenderer.class).isNotSameAs(second);
            assertThat(first.filter(StandardFilter.UPPERCASE)).isPresent();
        }

        @Test
        void requireUnknownIdFails() {
            assertThatThrownBy(() -> registry.require("jinja"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("No renderer registered for id: 'jinja'");
            assertThat(registry.create("jinja", RendererContext.defaults())).isEmpty();
        }

        @Test
        void duplicateRegistrationIsRejected() {
            assertThatThrownBy(() -> registry.register(new LiquidRenderer().metadata(), LiquidRenderer::new))
                    .isInstanceOf(RendererRegistrationException.class)
                    .hasMessage("Renderer already registered for id: 'liquid'")
                    .satisfies(e -> assertThat(((RendererRegistrationException) e).rendererId())
                            .isEqualTo("liquid"));
        }

        @Test
        void unregisterRemovesRenderer() {
            assertThat(registry.unregister("latte")).isTrue();
            assertThat(registry.unregister("latte")).isFalse();
            assertThat(registry.has("latte")).isFalse();
            assertThat(registry.metadata("latte")).isEmpty();
            assertThat(registry.size()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Custom renderers")
    class Custom {

        private final RendererRegistry registry = new RendererRegistry();

        @Test
        void factoryRenderersAreInitializedWithTheGivenContext() {
            TemplateRenderer renderer = mock(TemplateRenderer.class);
            RendererFactory factory = mock(RendererFactory.class);
            when(factory.create()).thenReturn(renderer);
            registry.register(MOCK_METADATA, factory);
            var context = RendererContext.of(RendererConfig.defaults().withPrettyPrint(false));

            var created = registry.create("mock", context);

            assertThat(created).containsSame(renderer);
            verify(factory, times(1)).create();
            verify(renderer).initialize(context);
            assertThat(registry.metadata("mock")).contains(MOCK_METADATA);
        }

        @Test
        void registeredInstanceIsReturnedOnEveryCreate() {
            TemplateRenderer renderer = mock(TemplateRenderer.class);
            when(renderer.metadata()).thenReturn(MOCK_METADATA);

            registry.registerInstance(renderer);

            assertThat(registry.has("mock")).isTrue();
            assertThat(registry.require("mock")).isSameAs(renderer);
            assertThat(registry.require("mock")).isSameAs(renderer);
            verify(renderer, times(2)).initialize(RendererContext.defaults());
        }

        @Test
        void nullArgumentsAreRejected() {
            assertThatThrownBy(() -> registry.register(null, LiquidRenderer::new))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("metadata must not be null");
            assertThatThrownBy(() -> registry.register(MOCK_METADATA, null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessage("factory must not be null");
        }
    }
}
