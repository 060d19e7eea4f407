package io.templatexform.core.build;

import static org.assertj.core.api.Assertions.assertThat;

import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.BlockAnnotation;
import io.templatexform.core.model.Comment;
import io.templatexform.core.model.ComponentType;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.ImportDeclaration;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.Meta;
import io.templatexform.core.model.PropDefinition;
import io.templatexform.core.model.PropertyValue;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.SourceLocation;
import io.templatexform.core.model.Text;
import io.templatexform.core.model.VariableAnnotation;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link TreeJsonWriter}. */
class TreeJsonWriterTest {

    @Test
    void writesElementPropertiesByKind() {
        var properties = new LinkedHashMap<String, PropertyValue>();
        properties.put("href", PropertyValue.string("/about"));
        properties.put("disabled", PropertyValue.bool(true));
        properties.put("tabIndex", new PropertyValue.NumberValue("2"));
        properties.put("className", new PropertyValue.ClassList(List.of("nav", "link")));
        properties.put("title", PropertyValue.expression("page.title"));
        properties.put("style", new PropertyValue.StyleValue(Map.of("color", "red")));
        var root = Root.of(List.of(Element.of("a", properties, List.of(Text.of("About")))), Meta.named("Nav"));

        var json = TreeJsonWriter.toJson(root);

        var element = json.at("/children/0");
        assertThat(element.get("type").asText()).isEqualTo("element");
        assertThat(element.get("tagName").asText()).isEqualTo("a");
        assertThat(element.has(TreeJsonWriter.ANNOTATIONS_KEY)).isFalse();
        var props = element.get("properties");
        assertThat(props.fieldNames())
                .toIterable()
                .containsExactly("href", "disabled", "tabIndex", "className", "title", "style");
        assertThat(props.get("href").asText()).isEqualTo("/about");
        assertThat(props.get("disabled").asBoolean()).isTrue();
        assertThat(props.get("tabIndex").asText()).isEqualTo("2");
        assertThat(props.get("className").isArray()).isTrue();
        assertThat(props.at("/className/1").asText()).isEqualTo("link");
        assertThat(props.at("/title/" + TreeJsonWriter.EXPRESSION_KEY).asText()).isEqualTo("page.title");
        assertThat(props.at("/style/color").asText()).isEqualTo("red");
        assertThat(element.at("/children/0/type").asText()).isEqualTo("text");
        assertThat(element.at("/children/0/value").asText()).isEqualTo("About");
    }

    @Test
    void writesAnnotationsUnderReservedKey() {
        var loop = new LoopAnnotation("post", "posts", null, LoopAnnotation.KeyKind.IDENTITY, "i");
        var variable = new VariableAnnotation("post.title", "Untitled", "truncate", List.of("20"), true);
        var element = Element.annotated(
                "li",
                List.of(Element.annotated("span", null, Annotations.variable(variable))),
                Annotations.loop(loop).withSource(new SourceLocation("Blog.tsx", 3, 8)));

        var gen = TreeJsonWriter.toJson(Root.of(List.of(element), Meta.named("Blog")))
                .at("/children/0/" + TreeJsonWriter.ANNOTATIONS_KEY);

        assertThat(gen.at("/loop/item").asText()).isEqualTo("post");
        assertThat(gen.at("/loop/collection").asText()).isEqualTo("posts");
        assertThat(gen.at("/loop/keyKind").asText()).isEqualTo("IDENTITY");
        assertThat(gen.at("/loop/index").asText()).isEqualTo("i");
        assertThat(gen.get("loop").has("key")).isFalse();
        assertThat(gen.get("unwrap").asBoolean()).isTrue();
        assertThat(gen.has("component")).isFalse();
        assertThat(gen.at("/source/file").asText()).isEqualTo("Blog.tsx");
        assertThat(gen.at("/source/line").asInt()).isEqualTo(3);

        var variableJson = TreeJsonWriter.toJson(Root.of(List.of(element), Meta.named("Blog")))
                .at("/children/0/children/0/_gen/variable");
        assertThat(variableJson.get("name").asText()).isEqualTo("post.title");
        assertThat(variableJson.get("default").asText()).isEqualTo("Untitled");
        assertThat(variableJson.get("filter").asText()).isEqualTo("truncate");
        assertThat(variableJson.at("/filterArgs/0").asText()).isEqualTo("20");
        assertThat(variableJson.get("raw").asBoolean()).isTrue();
    }

    @Test
    void writesConditionIncludeAndBlock() {
        var include = new IncludeAnnotation("cta-block", "CTABlock", Map.of("title", "\"Hi\""), false);
        var children = List.<io.templatexform.core.model.Node>of(
                Element.annotated("p", null, Annotations.condition(ConditionAnnotation.elseBranch())),
                Element.annotated("div", null, Annotations.include(include)),
                Element.annotated("main", null, Annotations.block(BlockAnnotation.extending("base"))),
                Comment.of("note"));

        var json = TreeJsonWriter.toJson(Root.of(children, Meta.named("Page")));

        assertThat(json.at("/children/0/_gen/condition/expression").asText()).isEmpty();
        assertThat(json.at("/children/0/_gen/condition/isElse").asBoolean()).isTrue();
        assertThat(json.at("/children/0/_gen/condition/isElseIf").asBoolean()).isFalse();
        assertThat(json.at("/children/1/_gen/include/template").asText()).isEqualTo("cta-block");
        assertThat(json.at("/children/1/_gen/include/originalName").asText()).isEqualTo("CTABlock");
        assertThat(json.at("/children/1/_gen/include/props/title").asText()).isEqualTo("\"Hi\"");
        assertThat(json.at("/children/1/_gen/include/hasChildren").asBoolean()).isFalse();
        assertThat(json.at("/children/2/_gen/block/name").asText()).isEqualTo(BlockAnnotation.EXTENDS_NAME);
        assertThat(json.at("/children/2/_gen/block/extends").asText()).isEqualTo("base");
        assertThat(json.at("/children/3/type").asText()).isEqualTo("comment");
        assertThat(json.at("/children/3/value").asText()).isEqualTo("note");
    }

    @Test
    void writesMeta() {
        var meta = new Meta(
                "Card.tsx",
                "Card",
                ComponentType.BLOCK,
                List.of(new PropDefinition("title", "string", false, "'Card'")),
                List.of("badge"),
                List.of(new ImportDeclaration("./Badge", null, List.of("Badge"), null, false)),
                List.of("const x = 1;"),
                List.of("x"));

        var json = TreeJsonWriter.toJson(Root.of(List.of(), meta));

        assertThat(json.get("type").asText()).isEqualTo("root");
        assertThat(json.get("children").isEmpty()).isTrue();
        var metaJson = json.get("meta");
        assertThat(metaJson.get("sourceFile").asText()).isEqualTo("Card.tsx");
        assertThat(metaJson.get("componentType").asText()).isEqualTo("block");
        assertThat(metaJson.at("/props/0/required").asBoolean()).isFalse();
        assertThat(metaJson.at("/props/0/defaultValue").asText()).isEqualTo("'Card'");
        assertThat(metaJson.at("/dependencies/0").asText()).isEqualTo("badge");
        assertThat(metaJson.at("/imports/0/source").asText()).isEqualTo("./Badge");
        assertThat(metaJson.at("/imports/0/namedImports/0").asText()).isEqualTo("Badge");
        assertThat(metaJson.at("/imports/0").has("defaultImport")).isFalse();
        assertThat(metaJson.at("/preamble/0").asText()).isEqualTo("const x = 1;");
        assertThat(metaJson.at("/preambleVars/0").asText()).isEqualTo("x");
    }

    @Test
    void writeProducesIndentedText() {
        String text = TreeJsonWriter.write(Root.of(List.of(Text.of("hi")), Meta.named("Hi")));

        assertThat(text).contains("\"type\" : \"root\"").contains("\n");
    }
}
