package io.templatexform.core.build;

import static org.assertj.core.api.Assertions.assertThat;

import io.templatexform.core.build.ExpressionAnalysis.Kind;
import io.templatexform.core.build.ExpressionAnalysis.TemplatePart;
import io.templatexform.core.parse.TsxParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link ExpressionClassifier}. */
class ExpressionClassifierTest {

    private final TsxParser parser = new TsxParser();

    private ExpressionAnalysis classify(String source) {
        return new ExpressionClassifier(source).classify(parser.parseExpression(source));
    }

    @Nested
    @DisplayName("Variables and slots")
    class VariablesAndSlots {

        @Test
        void identifierIsVariable() {
            var analysis = classify("title");

            assertThat(analysis.kind()).isEqualTo(Kind.VARIABLE);
            assertThat(analysis.path()).isEqualTo("title");
            assertThat(analysis.variables()).containsExactly("title");
            assertThat(analysis.isMarkupControl()).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
            "user.profile.name, user.profile.name",
            "user?.profile?.name, user.profile.name",
            "user!.name, user.name",
            "(user as Account).name, user.name",
            "items[0], items.0"
        })
        void memberChainsNormalizeToDottedPath(String source, String path) {
            var analysis = classify(source);

            assertThat(analysis.kind()).isEqualTo(Kind.MEMBER);
            assertThat(analysis.path()).isEqualTo(path);
        }

        @Test
        void computedKeyIsNotAPath() {
            var analysis = classify("items[i]");

            assertThat(analysis.kind()).isEqualTo(Kind.UNKNOWN);
            assertThat(analysis.variables()).containsExactly("items", "i");
        }

        @Test
        void childrenIsDefaultSlot() {
            assertThat(classify("children").kind()).isEqualTo(Kind.SLOT);
            assertThat(classify("props.children").kind()).isEqualTo(Kind.SLOT);
        }
    }

    @Nested
    @DisplayName("Loops")
    class Loops {

        @Test
        void mapWithJsxBodyIsLoop() {
            var analysis = classify("posts.map((post, i) => <li key={post.id}>{post.title}</li>)");

            assertThat(analysis.kind()).isEqualTo(Kind.LOOP);
            assertThat(analysis.isMarkupControl()).isTrue();
            var loop = analysis.loop();
            assertThat(loop.item()).isEqualTo("post");
            assertThat(loop.indexVar()).isEqualTo("i");
            assertThat(loop.collection()).isEqualTo("posts");
            assertThat(loop.key()).isEqualTo("post.id");
            assertThat(analysis.variables()).containsExactly("posts");
        }

        @Test
        void blockBodyReturningJsxIsLoop() {
            var analysis = classify("rows.map(function (row) { const x = row.a; return <tr>{x}</tr>; })");

            assertThat(analysis.kind()).isEqualTo(Kind.LOOP);
            assertThat(analysis.loop().item()).isEqualTo("row");
            assertThat(analysis.loop().indexVar()).isNull();
        }

        @Test
        void destructuredItemFallsBackToItem() {
            var analysis = classify("tags.map(({ label, meta: { slug }, ...rest }) => <span>{label}</span>)");

            assertThat(analysis.loop().item()).isEqualTo("item");
            assertThat(analysis.loop().destructured()).containsExactly("label", "slug", "rest");
        }

        @Test
        void plainItemHasNoDestructuredNames() {
            assertThat(classify("tags.map((tag) => <span>{tag}</span>)").loop().destructured()).isEmpty();
        }

        @Test
        void keyExpressionIsKeptAsWritten() {
            assertThat(classify("rows.map((row, i) => <tr key={i} />)").loop().key()).isEqualTo("i");
            assertThat(classify("rows.map((row) => <tr key=\"fixed\" />)").loop().key()).isEqualTo("\"fixed\"");
        }

        @Test
        void mapWithoutMarkupIsNotLoop() {
            var analysis = classify("tags.map((tag) => tag.toUpperCase())");

            assertThat(analysis.kind()).isEqualTo(Kind.UNKNOWN);
            assertThat(analysis.variables()).containsExactly("tags");
        }
    }

    @Nested
    @DisplayName("Conditionals")
    class Conditionals {

        @Test
        void logicalAndWithMarkup() {
            var analysis = classify("user && <p>{user.name}</p>");

            assertThat(analysis.kind()).isEqualTo(Kind.CONDITIONAL);
            assertThat(analysis.conditional().condition()).isEqualTo("user");
            assertThat(analysis.conditional().ternary()).isFalse();
            assertThat(analysis.conditional().alternate()).isNull();
        }

        @Test
        void ternaryWithMarkupOnOneSide() {
            var analysis = classify("items.length > 0 ? <ul /> : null");

            assertThat(analysis.kind()).isEqualTo(Kind.CONDITIONAL);
            assertThat(analysis.conditional().condition()).isEqualTo("items.length > 0");
            assertThat(analysis.conditional().ternary()).isTrue();
        }

        @Test
        void ternaryOfStringsIsUnknown() {
            var analysis = classify("active ? 'on' : 'off'");

            assertThat(analysis.kind()).isEqualTo(Kind.UNKNOWN);
            assertThat(analysis.variables()).containsExactly("active");
        }
    }

    @Nested
    @DisplayName("Literals and templates")
    class Literals {

        @Test
        void stringLiteralIsCooked() {
            var analysis = classify("'hello'");

            assertThat(analysis.kind()).isEqualTo(Kind.LITERAL);
            assertThat(analysis.literalValue()).isEqualTo("hello");
        }

        @Test
        void nullLiteralHasNoValue() {
            var analysis = classify("null");

            assertThat(analysis.kind()).isEqualTo(Kind.LITERAL);
            assertThat(analysis.literalValue()).isNull();
        }

        @Test
        void templateLiteralSplitsIntoParts() {
            var analysis = classify("`Hello ${user.name}!`");

            assertThat(analysis.kind()).isEqualTo(Kind.TEMPLATE);
            assertThat(analysis.templateParts())
                    .containsExactly(
                            TemplatePart.text("Hello "), TemplatePart.variable("user.name"), TemplatePart.text("!"));
        }

        @Test
        void globalsAreNotVariables() {
            var analysis = classify("Math.max(count, limit)");

            assertThat(analysis.kind()).isEqualTo(Kind.UNKNOWN);
            assertThat(analysis.variables()).containsExactly("count", "limit");
            assertThat(analysis.raw()).isEqualTo("Math.max(count, limit)");
        }
    }

    @Test
    void producesMarkupLooksThroughParentheses() {
        String source = "(<div />)";
        var classifier = new ExpressionClassifier(source);

        assertThat(classifier.producesMarkup(parser.parseExpression(source))).isTrue();
    }
}
