package io.templatexform.core.spi;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

class StandardFilterTest {

    @ParameterizedTest
    @EnumSource(StandardFilter.class)
    void keyRoundTripsThroughFromKey(StandardFilter filter) {
        assertThat(filter.key()).isLowerCase();
        assertThat(StandardFilter.fromKey(filter.key())).contains(filter);
    }

    @ParameterizedTest
    @ValueSource(strings = {"uppercase", "UPPERCASE", " UpperCase "})
    void fromKeyIgnoresCaseAndSurroundingSpace(String key) {
        assertThat(StandardFilter.fromKey(key)).contains(StandardFilter.UPPERCASE);
    }

    @Test
    void unknownKeysResolveToEmpty() {
        assertThat(StandardFilter.fromKey("shout")).isEmpty();
        assertThat(StandardFilter.fromKey(null)).isEmpty();
    }

    @Test
    void vocabularyHasTwentyFilters() {
        assertThat(StandardFilter.values()).hasSize(20);
    }
}
