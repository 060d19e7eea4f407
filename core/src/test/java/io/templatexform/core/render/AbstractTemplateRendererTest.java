package io.templatexform.core.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.Meta;
import io.templatexform.core.model.Node;
import io.templatexform.core.model.PropertyValue;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.Text;
import io.templatexform.core.model.VariableAnnotation;
import io.templatexform.core.render.liquid.LiquidRenderer;
import io.templatexform.core.spi.FilterDefinition;
import io.templatexform.core.spi.RendererConfig;
import io.templatexform.core.spi.RendererContext;
import io.templatexform.core.spi.StandardFilter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for the traversal shared by all renderers, exercised through {@link LiquidRenderer}, whose
 * syntax adds the least noise.
 */
class AbstractTemplateRendererTest {

    private final LiquidRenderer renderer = new LiquidRenderer();

    private static Element owner(String expression, Node... children) {
        return Element.annotated("div", List.of(children), Annotations.condition(ConditionAnnotation.of(expression)));
    }

    private static Element elseBranch(Node... children) {
        return Element.annotated("div", List.of(children), Annotations.condition(ConditionAnnotation.elseBranch()));
    }

    private static Root tree(Node... children) {
        return Root.of(List.of(children), Meta.named("Sample"));
    }

    @Nested
    @DisplayName("Branch folding")
    class BranchFolding {

        @Test
        void siblingElseMovesIntoOwner() {
            var folded = AbstractTemplateRenderer.foldBranches(
                    List.of(owner("a", Text.of("A")), Text.of("\n  "), elseBranch(Text.of("B")), Text.of("tail")));

            assertThat(folded).hasSize(2);
            Element owner = (Element) folded.get(0);
            assertThat(owner.children()).hasSize(2);
            assertThat(((Element) owner.children().get(1)).isBranch()).isTrue();
            assertThat(folded.get(1)).isEqualTo(Text.of("tail"));
        }

        @Test
        void textBetweenOwnerAndElseStopsFolding() {
            var children = List.<Node>of(owner("a"), Text.of("or"), elseBranch());

            assertThat(AbstractTemplateRenderer.foldBranches(children)).isEqualTo(children);
        }

        @Test
        void orphanBranchRendersPlainAndWarns() {
            renderer.initialize(RendererContext.defaults());
            var orphan = new Element(
                    "p", null, List.of(Text.of("hi")), Annotations.NONE.withCondition(ConditionAnnotation.elseBranch()));

            var output = renderer.transform(tree(orphan));

            assertThat(output.content()).isEqualTo("<p>hi</p>\n");
            assertThat(output.warnings()).containsExactly(AbstractTemplateRenderer.ORPHAN_BRANCH_WARNING);
        }
    }

    @Nested
    @DisplayName("Tags and attributes")
    class Tags {

        @Test
        void formatsEachPropertyKind() {
            var properties = new LinkedHashMap<String, PropertyValue>();
            properties.put("className", new PropertyValue.ClassList(List.of("btn", "primary")));
            properties.put("href", PropertyValue.expression("url"));
            properties.put("disabled", PropertyValue.bool(true));
            properties.put("hidden", PropertyValue.bool(false));
            properties.put("style", new PropertyValue.StyleValue(Map.of("marginTop", "4px")));
            properties.put("title", PropertyValue.string("a \"b\" <c>"));
            properties.put("tabIndex", new PropertyValue.NumberValue("2"));

            String html = renderer.transformElement(Element.of("a", properties, List.of(Text.of("Go"))));

            assertThat(html)
                    .isEqualTo("<a class=\"btn primary\" href=\"{{ url }}\" disabled style=\"margin-top: 4px\""
                            + " title=\"a &quot;b&quot; &lt;c&gt;\" tabIndex=\"2\">Go</a>");
        }

        @Test
        void voidElementsSelfClose() {
            var img = Element.of("img", Map.of("src", PropertyValue.string("x.png")), null);

            assertThat(renderer.transformElement(img)).isEqualTo("<img src=\"x.png\" />");
            assertThat(renderer.transformElement(Element.of("br"))).isEqualTo("<br />");
            assertThat(renderer.transformElement(Element.of("div"))).isEqualTo("<div></div>");
        }

        @Test
        void htmlForBecomesFor() {
            var label = Element.of("label", Map.of("htmlFor", PropertyValue.string("email")), null);

            assertThat(renderer.transformElement(label)).isEqualTo("<label for=\"email\"></label>");
        }
    }

    @Nested
    @DisplayName("Filters")
    class Filters {

        @BeforeEach
        void initialize() {
            renderer.initialize(RendererContext.defaults());
        }

        private String variable(String name, String defaultValue, String filter, List<String> args) {
            return renderer.renderVariable(new VariableAnnotation(name, defaultValue, filter, args, false));
        }

        @Test
        void engineDefaultsApplyWithoutCallerArguments() {
            assertThat(variable("d", null, "date", null)).isEqualTo("{{ d | date: \"%Y-%m-%d\" }}");
            assertThat(variable("bio", null, "truncate", null)).isEqualTo("{{ bio | truncate: 50 }}");
        }

        @Test
        void stringArgumentsAreQuoted() {
            assertThat(variable("d", null, "date", List.of("%d.%m"))).isEqualTo("{{ d | date: \"%d.%m\" }}");
            assertThat(variable("tags", null, "join", List.of("' / '"))).isEqualTo("{{ tags | join: ' / ' }}");
        }

        @Test
        void unknownFilterPassesThrough() {
            assertThat(variable("x", null, "myfilter", List.of("1"))).isEqualTo("{{ x | myfilter: 1 }}");
        }

        @Test
        void defaultComesBeforeFilter() {
            assertThat(variable("name", "Guest", "uppercase", null))
                    .isEqualTo("{{ name | default: \"Guest\" | upcase }}");
        }

        @Test
        void configuredMappingOverridesEngineName() {
            renderer.initialize(RendererContext.of(RendererConfig.defaults().withFilterMapping("uppercase", "shout")));

            assertThat(renderer.filter(StandardFilter.UPPERCASE)).contains(FilterDefinition.of("shout"));
            assertThat(variable("name", null, "UPPERCASE", null)).isEqualTo("{{ name | shout }}");
        }
    }

    @Nested
    @DisplayName("Output")
    class Output {

        @Test
        void transformBeforeInitializeFails() {
            assertThatThrownBy(() -> renderer.transform(tree(Text.of("x"))))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("Renderer 'liquid' is not initialized: call initialize(context) first");
        }

        @Test
        void prettyPrintTrimsAndEndsWithNewline() {
            renderer.initialize(RendererContext.defaults());
            assertThat(renderer.transform(tree(Text.of("  hi  "))).content()).isEqualTo("hi\n");

            renderer.initialize(RendererContext.of(RendererConfig.defaults().withPrettyPrint(false)));
            assertThat(renderer.transform(tree(Text.of("  hi  "))).content()).isEqualTo("  hi  ");
        }

        @Test
        void filenameFollowsComponentNameAndConfiguredExtension() {
            var config = new RendererConfig(".html", null, null, true, null, null);
            renderer.initialize(RendererContext.of(config));
            var include = Element.annotated("div", null, Annotations.include(IncludeAnnotation.of("card")));

            var output = renderer.transform(Root.of(List.of(include), Meta.named("MyPage")));

            assertThat(output.filename()).isEqualTo("my-page.html");
            assertThat(output.content()).isEqualTo("{% include 'card.html' %}\n");
            assertThat(output.dependencies()).containsExactly("card");
        }

        @Test
        void unnamedTreeUsesTemplateFilename() {
            renderer.initialize(RendererContext.defaults());

            var output = renderer.transform(Root.of(List.of(Text.of("x")), Meta.empty(null)));

            assertThat(output.filename()).isEqualTo("template.liquid");
        }

        @Test
        void conditionOperatorsBecomeWords() {
            assertThat(renderer.renderCondition(ConditionAnnotation.of("a && !b || c === 1"), "X"))
                    .isEqualTo("{% if a and not b or c == 1 %}\nX\n{% endif %}");
        }

        @Test
        void emptyOutputIsInvalid() {
            assertThat(renderer.validate(null).errors()).containsExactly("Output is empty");
            assertThat(renderer.validate("  \n").valid()).isFalse();
        }
    }

    @Nested
    @DisplayName("Logging")
    class Logging {

        private ListAppender<ILoggingEvent> appender;
        private Logger rendererLogger;

        @BeforeEach
        void attachAppender() {
            rendererLogger = (Logger) LoggerFactory.getLogger(AbstractTemplateRenderer.class);
            appender = new ListAppender<>();
            appender.start();
            rendererLogger.addAppender(appender);
        }

        @AfterEach
        void detachAppender() {
            rendererLogger.detachAppender(appender);
        }

        @Test
        void warningsAreLoggedWithRendererId() {
            renderer.initialize(RendererContext.defaults());

            renderer.transform(tree(elseBranch(Text.of("x"))));

            assertThat(appender.list)
                    .filteredOn(event -> event.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .containsExactly("[liquid] Else branch without a preceding condition");
        }

        @Test
        void warningsDoNotLeakAcrossDocuments() {
            renderer.initialize(RendererContext.defaults());
            renderer.transform(tree(elseBranch(Text.of("x"))));

            var second = renderer.transform(tree(Text.of("clean")));

            assertThat(second.warnings()).isEmpty();
        }
    }
}
