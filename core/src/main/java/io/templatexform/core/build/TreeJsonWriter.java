package io.templatexform.core.build;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.BlockAnnotation;
import io.templatexform.core.model.Comment;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.ImportDeclaration;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.Meta;
import io.templatexform.core.model.Node;
import io.templatexform.core.model.PropDefinition;
import io.templatexform.core.model.PropertyValue;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.Text;
import io.templatexform.core.model.VariableAnnotation;
import java.util.Map;

/**
 * Writes an annotated tree as JSON. Annotations go under the reserved {@code _gen} key;
 * expression-valued properties are written as {@code {"__expression": "..."}} objects so they
 * cannot be confused with string attributes.
 */
public final class TreeJsonWriter {

    public static final String ANNOTATIONS_KEY = "_gen";
    public static final String EXPRESSION_KEY = "__expression";

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private TreeJsonWriter() {}

    /** Returns the JSON tree of {@code root}. */
    public static ObjectNode toJson(Root root) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("type", "root");
        ArrayNode children = json.putArray("children");
        root.children().forEach(child -> children.add(node(child)));
        json.set("meta", meta(root.meta()));
        return json;
    }

    /** Returns {@code root} as indented JSON text. */
    public static String write(Root root) {
        try {
            return MAPPER.writeValueAsString(toJson(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize annotated tree", e);
        }
    }

    private static ObjectNode node(Node node) {
        ObjectNode json = MAPPER.createObjectNode();
        if (node instanceof Text text) {
            json.put("type", "text");
            json.put("value", text.value());
        } else if (node instanceof Comment comment) {
            json.put("type", "comment");
            json.put("value", comment.value());
        } else {
            Element element = (Element) node;
            json.put("type", "element");
            json.put("tagName", element.tagName());
            ObjectNode properties = json.putObject("properties");
            for (Map.Entry<String, PropertyValue> entry : element.properties().entrySet()) {
                property(properties, entry.getKey(), entry.getValue());
            }
            if (!element.annotations().isEmpty()) {
                json.set(ANNOTATIONS_KEY, annotations(element.annotations()));
            }
            ArrayNode children = json.putArray("children");
            element.children().forEach(child -> children.add(node(child)));
        }
        return json;
    }

    private static void property(ObjectNode properties, String name, PropertyValue value) {
        if (value instanceof PropertyValue.StringValue string) {
            properties.put(name, string.value());
        } else if (value instanceof PropertyValue.BooleanValue bool) {
            properties.put(name, bool.value());
        } else if (value instanceof PropertyValue.NumberValue number) {
            properties.put(name, number.literal());
        } else if (value instanceof PropertyValue.ClassList classes) {
            ArrayNode array = properties.putArray(name);
            classes.classes().forEach(array::add);
        } else if (value instanceof PropertyValue.ExpressionValue expression) {
            properties.putObject(name).put(EXPRESSION_KEY, expression.expression());
        } else if (value instanceof PropertyValue.StyleValue style) {
            ObjectNode declarations = properties.putObject(name);
            style.declarations().forEach(declarations::put);
        }
    }

    private static ObjectNode annotations(Annotations annotations) {
        ObjectNode json = MAPPER.createObjectNode();
        LoopAnnotation loop = annotations.loop();
        if (loop != null) {
            ObjectNode node = json.putObject("loop");
            node.put("item", loop.item());
            node.put("collection", loop.collection());
            putIfPresent(node, "key", loop.key());
            node.put("keyKind", loop.keyKind().name());
            putIfPresent(node, "index", loop.indexVar());
        }
        ConditionAnnotation condition = annotations.condition();
        if (condition != null) {
            ObjectNode node = json.putObject("condition");
            node.put("expression", condition.expression());
            node.put("isElse", condition.isElse());
            node.put("isElseIf", condition.isElseIf());
        }
        VariableAnnotation variable = annotations.variable();
        if (variable != null) {
            ObjectNode node = json.putObject("variable");
            node.put("name", variable.name());
            putIfPresent(node, "default", variable.defaultValue());
            putIfPresent(node, "filter", variable.filter());
            if (!variable.filterArgs().isEmpty()) {
                ArrayNode args = node.putArray("filterArgs");
                variable.filterArgs().forEach(args::add);
            }
            if (variable.raw()) {
                node.put("raw", true);
            }
        }
        if (annotations.slot() != null) {
            json.putObject("slot").put("name", annotations.slot().name());
        }
        IncludeAnnotation include = annotations.include();
        if (include != null) {
            ObjectNode node = json.putObject("include");
            node.put("template", include.targetName());
            putIfPresent(node, "originalName", include.originalName());
            ObjectNode props = node.putObject("props");
            include.props().forEach(props::put);
            node.put("hasChildren", include.hasChildren());
        }
        BlockAnnotation block = annotations.block();
        if (block != null) {
            ObjectNode node = json.putObject("block");
            node.put("name", block.name());
            putIfPresent(node, "extends", block.extendsLayout());
        }
        if (annotations.unwrap()) {
            json.put("unwrap", true);
        }
        if (annotations.component()) {
            json.put("component", true);
        }
        if (annotations.source() != null) {
            ObjectNode node = json.putObject("source");
            putIfPresent(node, "file", annotations.source().file());
            node.put("line", annotations.source().line());
            node.put("column", annotations.source().column());
        }
        return json;
    }

    private static ObjectNode meta(Meta meta) {
        ObjectNode json = MAPPER.createObjectNode();
        putIfPresent(json, "sourceFile", meta.sourceFile());
        putIfPresent(json, "componentName", meta.componentName());
        json.put("componentType", meta.componentType().key());
        ArrayNode props = json.putArray("props");
        for (PropDefinition prop : meta.props()) {
            ObjectNode node = props.addObject();
            node.put("name", prop.name());
            node.put("type", prop.type());
            node.put("required", prop.required());
            putIfPresent(node, "defaultValue", prop.defaultValue());
        }
        ArrayNode dependencies = json.putArray("dependencies");
        meta.dependencies().forEach(dependencies::add);
        ArrayNode imports = json.putArray("imports");
        for (ImportDeclaration declaration : meta.imports()) {
            ObjectNode node = imports.addObject();
            node.put("source", declaration.source());
            putIfPresent(node, "defaultImport", declaration.defaultImport());
            ArrayNode named = node.putArray("namedImports");
            declaration.namedImports().forEach(named::add);
            putIfPresent(node, "namespaceImport", declaration.namespaceImport());
            node.put("typeOnly", declaration.typeOnly());
        }
        ArrayNode preamble = json.putArray("preamble");
        meta.preamble().forEach(preamble::add);
        ArrayNode preambleVars = json.putArray("preambleVars");
        meta.preambleVars().forEach(preambleVars::add);
        return json;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
