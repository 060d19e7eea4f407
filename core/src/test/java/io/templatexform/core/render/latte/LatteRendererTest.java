package io.templatexform.core.render.latte;

import static io.templatexform.core.Fixtures.component;
import static org.assertj.core.api.Assertions.assertThat;

import io.templatexform.core.build.BuildOptions;
import io.templatexform.core.build.TemplateCompiler;
import io.templatexform.core.model.BlockAnnotation;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.SlotAnnotation;
import io.templatexform.core.model.VariableAnnotation;
import io.templatexform.core.spi.RendererContext;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link LatteRenderer}. */
class LatteRendererTest {

    private final LatteRenderer renderer = new LatteRenderer();

    @BeforeEach
    void initialize() {
        renderer.initialize(RendererContext.defaults());
    }

    @Nested
    @DisplayName("PHP expressions")
    class PhpExpressions {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
            "user.name                        | $user.name",
            "count(items) > 0                 | count($items) > 0",
            "items.length > 0 && !done        | $items.length > 0 && !$done",
            "a and not b                      | $a and not $b",
            "total * 2                        | $total * 2",
            "ok === true                      | $ok === true",
            "$already                         | $already"
        })
        void prefixesBareIdentifiers(String expression, String expected) {
            assertThat(LatteRenderer.phpExpression(expression)).isEqualTo(expected);
        }

        @Test
        void stringLiteralsAreLeftAlone() {
            assertThat(LatteRenderer.phpExpression("status === 'active'")).isEqualTo("$status === 'active'");
            assertThat(LatteRenderer.phpExpression("\"a b\" ~ name")).isEqualTo("\"a b\" ~ $name");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        void productList() {
            var tree = new TemplateCompiler()
                    .buildTree(component("ProductList.tsx"), BuildOptions.defaults())
                    .tree();

            var output = renderer.transform(tree);

            assertThat(output.filename()).isEqualTo("product-list.latte");
            assertThat(output.content())
                    .contains("<h2>{$title}</h2>")
                    .contains("{if $products.length > 0}")
                    .contains("{foreach $products as $product}")
                    .contains("{include 'product-card.latte', name: $product.name, price: $product.price}")
                    .contains("{else}\n<p>No products</p>\n{/if}");
        }

        @Test
        void indexedLoop() {
            assertThat(renderer.renderLoop(LoopAnnotation.of("row", "rows").withIndex("i"), "x"))
                    .isEqualTo("{foreach $rows as $i => $row}\nx\n{/foreach}");
        }

        @Test
        void conditions() {
            assertThat(renderer.renderCondition(ConditionAnnotation.of("user.admin"), "x"))
                    .isEqualTo("{if $user.admin}\nx\n{/if}");
            assertThat(renderer.renderCondition(ConditionAnnotation.elseIf("guest"), "y"))
                    .isEqualTo("{elseif $guest}\ny");
            assertThat(renderer.renderElse(null)).isEqualTo("{else}");
        }

        @Test
        void variablesWithDefaultFilterAndRaw() {
            assertThat(renderer.renderVariable(new VariableAnnotation("name", "Guest", "uppercase", null, false)))
                    .isEqualTo("{$name ?? \"Guest\"|upper}");
            assertThat(renderer.renderVariable(new VariableAnnotation("tags", null, "join", List.of(" / "), false)))
                    .isEqualTo("{$tags|implode:\" / \"}");
            assertThat(renderer.renderVariable(new VariableAnnotation("body", null, null, null, true)))
                    .isEqualTo("{$body|noescape}");
        }

        @Test
        void includeSpreadsArguments() {
            var props = new LinkedHashMap<String, String>();
            props.put("title", "\"Hi\"");
            props.put(IncludeAnnotation.SPREAD_PREFIX + "0", "rest");

            assertThat(renderer.renderInclude(new IncludeAnnotation("card", "Card", props, false), null))
                    .isEqualTo("{include 'card.latte', title: \"Hi\", ...$rest}");
        }

        @Test
        void layoutBlocksAndComments() {
            assertThat(renderer.renderExtends("layouts/base")).isEqualTo("{layout 'layouts/base.latte'}");
            assertThat(renderer.renderBlock(BlockAnnotation.of("content"), "x")).isEqualTo("{block content}x{/block}");
            assertThat(renderer.renderSlot(SlotAnnotation.defaultSlot(), null)).isEqualTo("{block default}{/block}");
            assertThat(renderer.renderComment("note")).isEqualTo("{* note *}");
        }

        @Test
        void validationCountsPairedTags() {
            assertThat(renderer.validate("{if $a}{foreach $b as $c}{/foreach}").errors())
                    .containsExactly("Unbalanced block tags: 2 open, 1 close");
            assertThat(renderer.validate("{block a}{$x}{/block}").valid()).isTrue();
        }
    }
}
