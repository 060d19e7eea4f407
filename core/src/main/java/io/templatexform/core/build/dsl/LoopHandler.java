package io.templatexform.core.build.dsl;

import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.Node;
import io.templatexform.core.parse.ast.Expression.JsxElement;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code <Loop each="items" as="item" key="slug" index="i">}. Item and index names may also come
 * from a render-callback child such as {@code {(item, i) => <li/>}}. {@code key} names a field of
 * the item; {@code keyExpr} is a key expression kept as written.
 */
final class LoopHandler implements DslHandler {

    @Override
    public Optional<Element> handle(JsxElement node, List<Node> children, DslContext context) {
        Map<String, String> attrs = context.attributes(node);
        Optional<DslContext.RenderCallback> callback = context.renderCallback(node);
        List<Node> body = callback.map(DslContext.RenderCallback::children).orElse(children);

        String each = attrs.get("each");
        String item = attrs.get("as");
        String index = attrs.get("index");
        if (callback.isPresent()) {
            item = item != null ? item : callback.get().parameter(0);
            index = index != null ? index : callback.get().parameter(1);
        }
        if (each == null || item == null) {
            context.warn("Loop requires 'each' and 'as' props");
            return Optional.of(Element.of("div", null, body));
        }
        String key = attrs.get("key");
        LoopAnnotation.KeyKind keyKind = LoopAnnotation.KeyKind.FIELD;
        if (key == null) {
            key = attrs.get("keyExpr");
            keyKind = LoopAnnotation.KeyKind.EXPLICIT;
        }

        context.addVariableRoot(each);
        LoopAnnotation loop = new LoopAnnotation(item, each, key, keyKind, index);
        return Optional.of(Element.annotated("div", body, Annotations.loop(loop)));
    }
}
