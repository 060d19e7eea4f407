package io.templatexform.core.build;

import static org.assertj.core.api.Assertions.assertThat;

import io.templatexform.core.model.Annotations;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.Meta;
import io.templatexform.core.model.Node;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.Text;
import io.templatexform.core.model.VariableAnnotation;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link TreeQueries}. */
class TreeQueriesTest {

    private static Element variable(String name) {
        return Element.annotated("span", null, Annotations.variable(VariableAnnotation.of(name)));
    }

    private static Element include(String target, String... props) {
        var map = new LinkedHashMap<String, String>();
        for (int i = 0; i < props.length; i += 2) {
            map.put(props[i], props[i + 1]);
        }
        return Element.annotated("div", null, Annotations.include(new IncludeAnnotation(target, null, map, false)));
    }

    @Test
    void collectsVariablesFromEveryAnnotationKind() {
        var loop = Element.annotated(
                "li", List.of(variable("post.title")), Annotations.loop(LoopAnnotation.of("post", "posts")));
        var condition = Element.annotated(
                "p",
                List.of(variable("user.name")),
                Annotations.condition(ConditionAnnotation.of("user.isAdmin && items?.length > 0")));
        var elseBranch = Element.annotated(
                "p", List.of(Text.of("guest")), Annotations.condition(ConditionAnnotation.elseBranch()));
        var card = include("card", "title", "page.title", "label", "\"Hi\"", "count", "3", "open", "true");
        var root = Root.of(List.of(Element.of("ul", null, List.of(loop)), condition, elseBranch, card), Meta.named("X"));

        assertThat(TreeQueries.collectVariables(root))
                .containsExactly("items", "page", "post", "post.title", "posts", "user", "user.name");
    }

    @Test
    void quotedWordsInConditionsAreNotVariables() {
        var element = Element.annotated(
                "em", null, Annotations.condition(ConditionAnnotation.elseIf("status === 'pending' || kind == \"draft\"")));

        assertThat(TreeQueries.collectVariables(Root.of(List.of(element), Meta.named("X"))))
                .containsExactly("kind", "status");
    }

    @Test
    void dependenciesAreSortedAndDeduplicated() {
        var nested = Element.of("section", null, List.of(include("footer"), include("card")));
        var root = Root.of(List.<Node>of(include("card"), nested), Meta.named("X"));

        assertThat(TreeQueries.collectDependencies(root)).containsExactly("card", "footer");
    }

    @Test
    void countsElementsAtAnyDepth() {
        var tree = Element.of("div", null, List.of(Text.of("a"), Element.of("p", null, List.of(Element.of("b")))));
        var root = Root.of(List.of(tree, Text.of("tail")), Meta.named("X"));

        assertThat(TreeQueries.countElements(root)).isEqualTo(3);
        assertThat(TreeQueries.countElements(Root.empty(null))).isZero();
    }
}
