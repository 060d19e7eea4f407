package io.templatexform.core.build.dsl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.Node;
import io.templatexform.core.parse.ast.Expression.JsxElement;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code <Include partial="partials/card" props='{"title": "page.title"}' />}. Textual JSON values
 * are taken as expression source; other JSON values keep their JSON text.
 */
final class IncludeHandler implements DslHandler {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @Override
    public Optional<Element> handle(JsxElement node, List<Node> children, DslContext context) {
        Optional<String> partial = context.attribute(node, "partial").filter(value -> !value.isBlank());
        if (partial.isEmpty()) {
            context.warn("Include requires 'partial' prop");
            return Optional.of(Element.of("div"));
        }
        Map<String, String> props = context.attribute(node, "props")
                .map(json -> parseProps(json, context))
                .orElse(Map.of());

        context.addDependency(partial.get());
        IncludeAnnotation include = new IncludeAnnotation(partial.get(), null, props, false);
        return Optional.of(
                Element.annotated("div", List.of(), Annotations.include(include).withUnwrap(true)));
    }

    private static Map<String, String> parseProps(String json, DslContext context) {
        JsonNode tree;
        try {
            tree = JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            context.warn("Invalid Include props JSON: " + e.getOriginalMessage());
            return Map.of();
        }
        if (tree == null || !tree.isObject()) {
            context.warn("Invalid Include props JSON: expected an object");
            return Map.of();
        }
        Map<String, String> props = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            props.put(field.getKey(), value.isTextual() ? value.textValue() : value.toString());
        }
        return props;
    }
}
