package io.templatexform.core.build;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.templatexform.core.build.dsl.DslHandlerRegistry;
import io.templatexform.core.parse.TsxParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link TreeBuilder} behavior not covered through {@link TemplateCompiler}. */
class TreeBuilderTest {

    @ParameterizedTest
    @CsvSource({
        "CTABlock, cta-block",
        "SidebarContent, sidebar-content",
        "HTMLParser, html-parser",
        "Card, card",
        "Card2Grid, card2-grid"
    })
    void kebabCasesComponentNames(String name, String expected) {
        assertThat(TreeBuilder.kebabCase(name)).isEqualTo(expected);
    }

    @Test
    void buildsOnlyOnce() {
        var program = new TsxParser().parse("export function A() { return <p>hi</p>; }", "A.tsx");
        var builder = new TreeBuilder(program, null, DslHandlerRegistry.withDefaults());

        var root = builder.build();

        assertThat(root.meta().componentName()).isEqualTo("A");
        assertThat(root.meta().sourceFile()).isEqualTo("A.tsx");
        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("TreeBuilder instances build a single document");
    }

    @Test
    void warningsAreACopy() {
        var program = new TsxParser().parse("export function A() { return <p>{fmt(x)}</p>; }", "A.tsx");
        var builder = new TreeBuilder(program, BuildOptions.defaults(), DslHandlerRegistry.withDefaults());
        builder.build();

        var warnings = builder.warnings();

        assertThat(warnings).containsExactly("Unknown expression type: fmt(x)");
        assertThatThrownBy(() -> warnings.add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(builder.referencedIdentifiers()).contains("x");
    }
}
