package io.templatexform.core.render;

import static io.templatexform.core.Fixtures.component;
import static org.assertj.core.api.Assertions.assertThat;

import io.templatexform.core.build.BuildOptions;
import io.templatexform.core.build.TemplateCompiler;
import io.templatexform.core.model.Root;
import io.templatexform.core.spi.TemplateRenderer;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Properties every built-in renderer must satisfy for every sample component. */
class RendererContractTest {

    private static final List<String> RENDERERS = List.of("react", "liquid", "handlebars", "twig", "latte");
    private static final List<String> COMPONENTS = List.of("ProductList.tsx", "BlogLayout.tsx", "StatusBadge.tsx");

    private final TemplateCompiler compiler = new TemplateCompiler();
    private final RendererRegistry registry = RendererRegistry.withBuiltIns();

    static Stream<Arguments> renderersAndComponents() {
        return RENDERERS.stream().flatMap(id -> COMPONENTS.stream().map(file -> Arguments.of(id, file)));
    }

    private Root tree(String source, String file) {
        var result = compiler.buildTree(source, BuildOptions.builder().sourceFile(file).build());
        assertThat(result.errors()).isEmpty();
        return result.tree();
    }

    @ParameterizedTest(name = "{0} renders {1}")
    @MethodSource("renderersAndComponents")
    void outputIsStructurallyValid(String rendererId, String file) {
        TemplateRenderer renderer = registry.require(rendererId);

        var output = renderer.transform(tree(component(file), file));

        assertThat(output.content()).isNotBlank().endsWith("\n").doesNotContain("___REACT_");
        assertThat(renderer.validate(output.content()).errors()).isEmpty();
        assertThat(output.filename()).endsWith(renderer.metadata().fileExtension());
    }

    @ParameterizedTest(name = "{0} renders {1} the same way twice")
    @MethodSource("renderersAndComponents")
    void renderingIsRepeatable(String rendererId, String file) {
        TemplateRenderer renderer = registry.require(rendererId);
        Root root = tree(component(file), file);

        var first = renderer.transform(root);
        var second = renderer.transform(root);

        assertThat(second).isEqualTo(first);
    }

    @ParameterizedTest
    @ValueSource(strings = {"react", "liquid", "handlebars", "twig", "latte"})
    void siblingAndNestedElseRenderIdentically(String rendererId) {
        String nested = wrap("<div><If test=\"ready\"><p>A</p><Else><p>B</p></Else></If></div>");
        String sibling = wrap("<div><If test=\"ready\"><p>A</p></If><Else><p>B</p></Else></div>");

        String fromNested = registry.require(rendererId).transform(tree(nested, "Nested.tsx")).content();
        String fromSibling = registry.require(rendererId).transform(tree(sibling, "Sibling.tsx")).content();

        assertThat(fromSibling).isEqualTo(fromNested);
    }

    private static String wrap(String markup) {
        return "export function Choice() {\n  return (\n    " + markup + "\n  );\n}\n";
    }
}
