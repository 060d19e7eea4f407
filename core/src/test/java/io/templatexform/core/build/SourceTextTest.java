package io.templatexform.core.build;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SourceTextTest {

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "<li>{item.id}</li>        | item | true",
                "<li>{item?.id}</li>       | item | true",
                "<li>{item . id}</li>      | item | true",
                "<li>{item.identity}</li>  | item | false",
                "<li>{other.item.id}</li>  | item | false",
                "<li>{myitem.id}</li>      | item | false",
                "<li>{row.id}{item.x}</li> | item | false",
                "<li>{row.id}{item.id}</li> | item | true",
            })
    void readsIdOnlyThroughTheBinding(String text, String binding, boolean expected) {
        assertThat(SourceText.readsId(text, binding)).isEqualTo(expected);
    }

    @Test
    void collapsesAndSplitsWhitespace() {
        assertThat(SourceText.collapseWhitespace("a \n\t b")).isEqualTo("a b");
        assertThat(SourceText.splitWhitespace("btn  primary")).containsExactly("btn", "primary");
        assertThat(SourceText.isNewlineOnly("  \n    ")).isTrue();
        assertThat(SourceText.isNewlineOnly("   ")).isFalse();
    }

    @Test
    void pascalCaseNames() {
        assertThat(SourceText.isPascalCase("ProductCard")).isTrue();
        assertThat(SourceText.isPascalCase("productCard")).isFalse();
        assertThat(SourceText.isPascalCase(null)).isFalse();
    }
}
