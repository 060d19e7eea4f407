package io.templatexform.core.build.dsl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.templatexform.core.model.Element;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/** Tests for {@link DslHandlerRegistry}. */
class DslHandlerRegistryTest {

    private static final DslHandler ICON = (node, children, context) -> Optional.of(Element.of("i"));

    private ListAppender<ILoggingEvent> appender;
    private Logger registryLogger;

    @BeforeEach
    void attachAppender() {
        registryLogger = (Logger) LoggerFactory.getLogger(DslHandlerRegistry.class);
        appender = new ListAppender<>();
        appender.start();
        registryLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        registryLogger.detachAppender(appender);
    }

    @Test
    void defaultsRegisterBuiltInTags() {
        var registry = DslHandlerRegistry.withDefaults();

        assertThat(registry.size()).isEqualTo(10);
        assertThat(registry.tags())
                .containsExactly(
                        "DefineBlock", "Else", "ElseIf", "Extends", "If", "Include", "Loop", "Raw", "Slot", "Var");
        assertThat(registry.get("Loop")).containsInstanceOf(LoopHandler.class);
        assertThat(appender.list).isEmpty();
    }

    @Test
    void registerAndLookUp() {
        var registry = new DslHandlerRegistry();

        registry.register("Icon", ICON);

        assertThat(registry.has("Icon")).isTrue();
        assertThat(registry.get("Icon")).containsSame(ICON);
        assertThat(registry.get("icon")).isEmpty();
    }

    @Test
    void overwritingLogsWarning() {
        var registry = DslHandlerRegistry.withDefaults();

        registry.register("Loop", ICON);

        assertThat(registry.get("Loop")).containsSame(ICON);
        assertThat(appender.list)
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.WARN);
                    assertThat(event.getFormattedMessage()).isEqualTo("dsl.handler.overwritten: tag=Loop");
                });
    }

    @Test
    void blankTagIsRejected() {
        var registry = new DslHandlerRegistry();

        assertThatThrownBy(() -> registry.register("  ", ICON))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("tagName must not be blank");
        assertThatThrownBy(() -> registry.register("X", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void unregisterAndClear() {
        var registry = DslHandlerRegistry.withDefaults();

        assertThat(registry.unregister("Raw")).isTrue();
        assertThat(registry.unregister("Raw")).isFalse();
        assertThat(registry.has("Raw")).isFalse();

        registry.clear();

        assertThat(registry.size()).isZero();
        assertThat(registry.tags()).isEmpty();
    }
}
