package io.templatexform.core.build;

import static io.templatexform.core.Fixtures.component;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.templatexform.core.build.dsl.DslHandlerRegistry;
import io.templatexform.core.error.SourceParseException;
import io.templatexform.core.model.BuildResult;
import io.templatexform.core.model.Comment;
import io.templatexform.core.model.ComponentType;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation.KeyKind;
import io.templatexform.core.model.Node;
import io.templatexform.core.model.PropDefinition;
import io.templatexform.core.model.PropertyValue;
import io.templatexform.core.model.Text;
import io.templatexform.core.parse.MarkupParser;
import io.templatexform.core.render.liquid.LiquidRenderer;
import io.templatexform.core.spi.RendererContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Tests for {@link TemplateCompiler#buildTree}: how component source is lowered into the annotated
 * tree, and how failures are reported.
 */
class TemplateCompilerTest {

    private final TemplateCompiler compiler = new TemplateCompiler();

    private BuildResult build(String source) {
        return compiler.buildTree(source, BuildOptions.builder().sourceFile("Test.tsx").build());
    }

    private static Element root(BuildResult result) {
        assertThat(result.errors()).isEmpty();
        assertThat(result.tree().children()).isNotEmpty();
        return (Element) result.tree().children().get(0);
    }

    private static Element child(Element parent, int index) {
        return (Element) parent.children().get(index);
    }

    @Nested
    @DisplayName("Loops")
    class Loops {

        @Test
        void explicitKeyWins() {
            var result = build("""
                    export function List({ items }) {
                      return <ul>{items.map((item) => <li key={item.slug}>{item.name}</li>)}</ul>;
                    }
                    """);

            Element loop = child(root(result), 0);
            var annotation = loop.annotations().loop();
            assertThat(annotation.item()).isEqualTo("item");
            assertThat(annotation.collection()).isEqualTo("items");
            assertThat(annotation.key()).isEqualTo("item.slug");
            assertThat(annotation.keyKind()).isEqualTo(KeyKind.EXPLICIT);
            assertThat(loop.annotations().unwrap()).isTrue();
            assertThat(child(loop, 0).tagName()).isEqualTo("li");
            assertThat(child(loop, 0).properties()).doesNotContainKey("key");
        }

        @Test
        void itemIdInBodyGivesIdentityKey() {
            var result = build("""
                    export function List({ items }) {
                      return <ul>{items.map((item) => <li>{item.id}</li>)}</ul>;
                    }
                    """);

            var annotation = child(root(result), 0).annotations().loop();
            assertThat(annotation.keyKind()).isEqualTo(KeyKind.IDENTITY);
            assertThat(annotation.key()).isNull();
        }

        @Test
        void idFieldInPropTypeGivesIdentityKey() {
            var result = build("""
                    interface Item { id: string; label: string }
                    export function List({ items }: { items: Item[] }) {
                      return <ul>{items.map((item) => <li>{item.label}</li>)}</ul>;
                    }
                    """);

            assertThat(child(root(result), 0).annotations().loop().keyKind()).isEqualTo(KeyKind.IDENTITY);
        }

        @Test
        void keyExpressionIsStoredAsWritten() {
            var result = build("""
                    export function List({ items }) {
                      return <ul>{items.map((item, i) => <li key={i}>{item.name}</li>)}</ul>;
                    }
                    """);

            var annotation = child(root(result), 0).annotations().loop();
            assertThat(annotation.key()).isEqualTo("i");
            assertThat(annotation.keyKind()).isEqualTo(KeyKind.EXPLICIT);
        }

        @Test
        void destructuredItemIsRenamedWithWarning() {
            var result = build("""
                    export function List({ rows }) {
                      return <ul>{rows.map(({ id, label }) => <li>{label}</li>)}</ul>;
                    }
                    """);

            assertThat(child(root(result), 0).annotations().loop().item()).isEqualTo("item");
            assertThat(result.warnings()).containsExactly(
                    "Destructured loop item {id, label} of 'rows' is bound as 'item'; "
                            + "references to id, label are left unbound");
        }

        @Test
        void noKeyInformationKeepsIndex() {
            var result = build("""
                    export function Tags({ tags }) {
                      return <div>{tags.map((tag, i) => <span>{tag}</span>)}</div>;
                    }
                    """);

            var annotation = child(root(result), 0).annotations().loop();
            assertThat(annotation.keyKind()).isEqualTo(KeyKind.NONE);
            assertThat(annotation.indexVar()).isEqualTo("i");
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        void logicalAndBecomesConditionWithoutBranches() {
            var result = build("""
                    export function Greeting({ user }) {
                      return <div>{user && <p>Hi</p>}</div>;
                    }
                    """);

            Element condition = child(root(result), 0);
            assertThat(condition.isConditionOwner()).isTrue();
            assertThat(condition.annotations().condition().expression()).isEqualTo("user");
            assertThat(condition.children()).hasSize(1);
            assertThat(child(condition, 0).tagName()).isEqualTo("p");
        }

        @Test
        void ternaryWithNullAddsNoBranch() {
            var result = build("""
                    export function Flag({ ok }) {
                      return <div>{ok ? <b>yes</b> : null}</div>;
                    }
                    """);

            Element condition = child(root(result), 0);
            assertThat(condition.children()).hasSize(1);
            assertThat(condition.children()).noneMatch(n -> n instanceof Element e && e.isBranch());
        }

        @Test
        void nestedTernaryFlattensIntoElseIfAndElse() {
            var result = compiler.buildTree(component("StatusBadge.tsx"), null);

            Element badge = root(result);
            assertThat(badge.tagName()).isEqualTo("span");
            assertThat(badge.properties().get("className")).isEqualTo(new PropertyValue.ClassList(List.of("badge")));
            Element condition = child(badge, 0);
            assertThat(condition.annotations().condition().expression()).isEqualTo("status === 'active'");
            assertThat(condition.children()).hasSize(3);

            Element elseIf = child(condition, 1);
            assertThat(elseIf.annotations().condition().isElseIf()).isTrue();
            assertThat(elseIf.annotations().condition().expression()).isEqualTo("status === 'pending'");
            assertThat(child(elseIf, 0).tagName()).isEqualTo("em");

            Element elseBranch = child(condition, 2);
            assertThat(elseBranch.annotations().condition().isElse()).isTrue();
            assertThat(child(elseBranch, 0).tagName()).isEqualTo("s");
        }

        @Test
        void conditionVariablesSkipStringLiterals() {
            var result = compiler.buildTree(component("StatusBadge.tsx"), null);

            assertThat(result.variables()).containsExactly("label", "status");
        }
    }

    @Nested
    @DisplayName("Includes")
    class Includes {

        @Test
        void componentTagBecomesIncludeWithKebabTarget() {
            var result = build("""
                    export function Page({ rest }) {
                      return <main><CTABlock title="Hi" count={3} {...rest} /></main>;
                    }
                    """);

            Element include = child(root(result), 0);
            IncludeAnnotation annotation = include.annotations().include();
            assertThat(include.tagName()).isEqualTo("div");
            assertThat(include.annotations().unwrap()).isFalse();
            assertThat(annotation.targetName()).isEqualTo("cta-block");
            assertThat(annotation.originalName()).isEqualTo("CTABlock");
            assertThat(annotation.props()).containsExactly(
                    Map.entry("title", "\"Hi\""),
                    Map.entry("count", "3"),
                    Map.entry(IncludeAnnotation.SPREAD_PREFIX + "2", "rest"));
            assertThat(annotation.hasChildren()).isFalse();
            assertThat(result.dependencies()).containsExactly("cta-block");
        }

        @Test
        void includeKeepsChildren() {
            var result = build("""
                    export function Page() {
                      return <main><SidebarContent><p>More</p></SidebarContent></main>;
                    }
                    """);

            Element include = child(root(result), 0);
            assertThat(include.annotations().include().targetName()).isEqualTo("sidebar-content");
            assertThat(include.annotations().include().hasChildren()).isTrue();
            assertThat(child(include, 0).tagName()).isEqualTo("p");
        }

        @Test
        void passthroughComponentKeepsItsTag() {
            var options = BuildOptions.builder().passthrough("Link").build();

            var result = compiler.buildTree("""
                    export function Nav() {
                      return <nav><Link href="/">Home</Link></nav>;
                    }
                    """, options);

            Element link = child(root(result), 0);
            assertThat(link.tagName()).isEqualTo("Link");
            assertThat(link.annotations().component()).isTrue();
            assertThat(link.annotations().include()).isNull();
            assertThat(result.dependencies()).isEmpty();
        }

        @Test
        void relativeComponentImportsAreDependencies() {
            var result = compiler.buildTree(component("ProductList.tsx"), null);

            assertThat(result.dependencies()).containsExactly("ProductCard", "product-card");
        }
    }

    @Nested
    @DisplayName("Variables and text")
    class VariablesAndText {

        @Test
        void repeatedVariableIsReportedOnce() {
            var result = build("""
                    export function Card({ user }) {
                      return <p>{user.name} {user.name}</p>;
                    }
                    """);

            assertThat(result.variables()).containsExactly("user.name");
            assertThat(result.referencedIdentifiers()).containsExactly("user");
            assertThat(root(result).children()).hasSize(3);
            assertThat(root(result).children().get(1)).isEqualTo(Text.of(" "));
        }

        @Test
        void optionalChainingIsNormalized() {
            var result = build("""
                    export const Card = ({ user }) => <p>{user?.profile?.name}</p>;
                    """);

            assertThat(child(root(result), 0).annotations().variable().name()).isEqualTo("user.profile.name");
        }

        @Test
        void templateLiteralIsSplitIntoTextAndVariables() {
            var result = build("""
                    export const Hello = ({ user }) => <p>{`Hello ${user.name}!`}</p>;
                    """);

            List<Node> parts = root(result).children();
            assertThat(parts).hasSize(3);
            assertThat(parts.get(0)).isEqualTo(Text.of("Hello "));
            assertThat(((Element) parts.get(1)).annotations().variable().name()).isEqualTo("user.name");
            assertThat(parts.get(2)).isEqualTo(Text.of("!"));
        }

        @Test
        void unsupportedExpressionIsDroppedWithWarning() {
            var result = build("""
                    export const When = ({ date }) => <p>{formatDate(date)}</p>;
                    """);

            assertThat(root(result).children()).isEmpty();
            assertThat(result.warnings()).containsExactly("Unknown expression type: formatDate(date)");
        }

        @Test
        void booleanLiteralsAreDroppedAndNumbersKept() {
            var result = build("""
                    export const Count = () => <p>{true}{42}</p>;
                    """);

            assertThat(root(result).children()).containsExactly(Text.of("42"));
        }

        @Test
        void childrenBecomeDefaultSlot() {
            var result = build("""
                    export function Box({ children }) {
                      return <div className="box">{children}</div>;
                    }
                    """);

            Element slot = child(root(result), 0);
            assertThat(slot.annotations().slot().isDefault()).isTrue();
            assertThat(slot.annotations().unwrap()).isTrue();
        }

        @Test
        void whitespaceOnlyLinesAreDropped() {
            var result = build("""
                    export function Box() {
                      return (
                        <div>
                          <h1>Title</h1>
                          <p>Lots   of
                             space</p>
                        </div>
                      );
                    }
                    """);

            Element div = root(result);
            assertThat(div.children()).hasSize(2);
            assertThat(child(div, 1).children()).containsExactly(Text.of("Lots of space"));
        }

        @Test
        void fragmentsAreFlattened() {
            var result = build("""
                    export const Pair = () => <><h1>A</h1><p>B</p></>;
                    """);

            assertThat(result.tree().children())
                    .extracting(node -> ((Element) node).tagName())
                    .containsExactly("h1", "p");
        }

        @Test
        void commentsAreKeptOnlyWhenRequested() {
            String source = """
                    export const Note = () => <div>{/* note */}<p>x</p></div>;
                    """;

            var dropped = compiler.buildTree(source, null);
            var kept = compiler.buildTree(source, BuildOptions.builder().preserveComments(true).build());

            assertThat(root(dropped).children()).hasSize(1);
            assertThat(root(kept).children().get(0)).isEqualTo(Comment.of("note"));
        }
    }

    @Nested
    @DisplayName("Attributes")
    class Attributes {

        @Test
        void attributesKeepOrderAndKind() {
            var result = build("""
                    export const Field = ({ value }) => (
                      <input className="a  b" type="text" maxLength={10} disabled value={value} style={{ marginTop: 4 }} />
                    );
                    """);

            Element input = root(result);
            assertThat(input.properties().keySet())
                    .containsExactly("className", "type", "maxLength", "disabled", "value", "style");
            assertThat(input.properties().get("className")).isEqualTo(new PropertyValue.ClassList(List.of("a", "b")));
            assertThat(input.properties().get("type")).isEqualTo(PropertyValue.string("text"));
            assertThat(input.properties().get("maxLength")).isEqualTo(new PropertyValue.NumberValue("10"));
            assertThat(input.properties().get("disabled")).isEqualTo(PropertyValue.bool(true));
            assertThat(input.properties().get("value")).isEqualTo(PropertyValue.expression("value"));
            assertThat(input.properties().get("style"))
                    .isEqualTo(new PropertyValue.StyleValue(Map.of("marginTop", "4")));
        }

        @Test
        void spreadOnPlainElementIsDroppedWithWarning() {
            var result = build("""
                    export const Box = (props) => <div {...props}>x</div>;
                    """);

            assertThat(root(result).properties()).isEmpty();
            assertThat(result.warnings()).singleElement()
                    .asString()
                    .startsWith("Spread attribute not supported in templates:");
        }
    }

    @Nested
    @DisplayName("Component metadata")
    class ComponentMetadata {

        @Test
        void propsPreambleAndTypeAreExtracted() {
            var result = compiler.buildTree(component("ProductList.tsx"), BuildOptions.builder()
                    .sourceFile("components/ProductList.tsx")
                    .build());

            var meta = result.tree().meta();
            assertThat(meta.componentName()).isEqualTo("ProductList");
            assertThat(meta.componentType()).isEqualTo(ComponentType.COMPONENT);
            assertThat(meta.sourceFile()).isEqualTo("components/ProductList.tsx");
            assertThat(meta.props()).containsExactly(
                    new PropDefinition("title", "string", true, null),
                    new PropDefinition("products", "Product[]", true, null),
                    new PropDefinition("showEmpty", "boolean", false, "false"));
            assertThat(meta.preamble()).containsExactly("const count = products.length;");
            assertThat(meta.preambleVars()).containsExactly("count");
            assertThat(meta.imports()).extracting(i -> i.source()).containsExactly("react", "./ProductCard");
        }

        @Test
        void layoutNameGivesLayoutType() {
            var result = compiler.buildTree(component("BlogLayout.tsx"), null);

            assertThat(result.tree().meta().componentType()).isEqualTo(ComponentType.LAYOUT);
        }

        @Test
        void requestedComponentNameSelectsFunction() {
            String source = """
                    export function First() { return <p>1</p>; }
                    export function Second() { return <p>2</p>; }
                    """;

            var result = compiler.buildTree(source, BuildOptions.builder().componentName("Second").build());

            assertThat(result.tree().meta().componentName()).isEqualTo("Second");
            assertThat(root(result).children()).containsExactly(Text.of("2"));
        }

        @Test
        void sourceLocationIsRecordedWhenRequested() {
            var result = compiler.buildTree(
                    "export const A = () => <div />;\n",
                    BuildOptions.builder().sourceFile("A.tsx").includeSourceLocation(true).build());

            var location = root(result).annotations().source();
            assertThat(location.file()).isEqualTo("A.tsx");
            assertThat(location.line()).isEqualTo(1);
            assertThat(location.column()).isEqualTo(23);
        }
    }

    @Nested
    @DisplayName("Empty results and failures")
    class Failures {

        @Test
        void sourceWithoutComponentYieldsEmptyTree() {
            var result = build("export function helper() { return 1; }\n");

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.hasErrors()).isFalse();
            assertThat(result.warnings()).containsExactly("No component function found");
        }

        @Test
        void componentWithoutMarkupYieldsEmptyTree() {
            var result = build("export function Empty() { return null; }\n");

            assertThat(result.isEmpty()).isTrue();
            assertThat(result.warnings()).containsExactly("No JSX found in source");
        }

        @Test
        void emptyTreeIsNotRendered() {
            var renderer = new LiquidRenderer();
            renderer.initialize(RendererContext.defaults());

            var outcome = compiler.compile("export function Empty() { return null; }\n", null, renderer);

            assertThat(outcome.rendered()).isFalse();
            assertThat(outcome.build().warnings()).isNotEmpty();
        }

        @Test
        void parseErrorIsReportedAsDiagnostic() {
            var result = compiler.buildTree(
                    component("Broken.tsx"), BuildOptions.builder().sourceFile("Broken.tsx").build());

            assertThat(result.hasErrors()).isTrue();
            assertThat(result.isEmpty()).isTrue();
            assertThat(result.errors())
                    .containsExactly("Broken.tsx:5:6: Expected closing tag </span> but found </div>");
        }

        @Test
        void parserFailureFromCustomParserIsReported() {
            MarkupParser parser = mock(MarkupParser.class);
            when(parser.parse(anyString(), eq("x.tsx")))
                    .thenThrow(new SourceParseException("Unexpected token", "x.tsx", 2, 4, 20));
            var custom = new TemplateCompiler(parser, DslHandlerRegistry.withDefaults());

            var result = custom.buildTree("whatever", BuildOptions.builder().sourceFile("x.tsx").build());

            assertThat(result.errors()).containsExactly("x.tsx:2:4: Unexpected token");
            verify(parser).parse("whatever", "x.tsx");
        }

        @Test
        void nullSourceIsRejected() {
            assertThatThrownBy(() -> compiler.buildTree(null, null)).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("Logging")
    class Logging {

        private final Logger logger = (Logger) LoggerFactory.getLogger(TemplateCompiler.class);
        private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

        @BeforeEach
        void attach() {
            appender.start();
            logger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            logger.detachAppender(appender);
        }

        @Test
        void successfulBuildLogsSummary() {
            compiler.buildTree(component("ProductList.tsx"), BuildOptions.builder().sourceFile("ProductList.tsx").build());

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.INFO)
                    .singleElement()
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .asString()
                    .startsWith("tree.built: source=ProductList.tsx, component=ProductList, type=COMPONENT");
        }

        @Test
        void parseFailureLogsWarning() {
            compiler.buildTree(component("Broken.tsx"), BuildOptions.builder().sourceFile("Broken.tsx").build());

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .extracting(ILoggingEvent::getFormattedMessage)
                    .singleElement()
                    .asString()
                    .contains("tree.parse_failed", "line=5", "column=6");
        }
    }
}
