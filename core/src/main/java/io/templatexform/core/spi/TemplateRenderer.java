package io.templatexform.core.spi;

import io.templatexform.core.model.BlockAnnotation;
import io.templatexform.core.model.ConditionAnnotation;
import io.templatexform.core.model.Element;
import io.templatexform.core.model.IncludeAnnotation;
import io.templatexform.core.model.LoopAnnotation;
import io.templatexform.core.model.PropertyValue;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.SlotAnnotation;
import io.templatexform.core.model.TemplateOutput;
import io.templatexform.core.model.ValidationResult;
import io.templatexform.core.model.VariableAnnotation;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pluggable output format. A renderer turns an annotated tree into the text of one target
 * language.
 *
 * <p>Renderers hold per-document state (warnings, collected variables) and are therefore not
 * thread-safe: create one per document through a {@link RendererFactory}, or call {@link
 * #dispose()} between documents.
 */
public interface TemplateRenderer {

    RendererMetadata metadata();

    /** Prepares the renderer for one document. Must be called before {@link #transform(Root)}. */
    void initialize(RendererContext context);

    /** Clears per-document state. */
    void dispose();

    /**
     * Renders a complete tree. Never throws for well-formed trees; problems are reported as
     * {@link TemplateOutput#warnings()}.
     */
    TemplateOutput transform(Root root);

    /** Renders one element, applying its annotations. */
    String transformElement(Element element);

    // --- Annotation renderers; content arguments are already rendered ---

    String renderLoop(LoopAnnotation loop, String content);

    String renderCondition(ConditionAnnotation condition, String content);

    /** Renders the separator that opens an else ({@code condition == null}) or else-if branch. */
    String renderElse(ConditionAnnotation condition);

    String renderVariable(VariableAnnotation variable);

    String renderSlot(SlotAnnotation slot, String defaultContent);

    /** @param childrenContent rendered children of the include, or {@code null} */
    String renderInclude(IncludeAnnotation include, String childrenContent);

    String renderBlock(BlockAnnotation block, String content);

    String renderExtends(String layout);

    String renderComment(String text);

    // --- Tags ---

    String renderOpeningTag(String tagName, Map<String, PropertyValue> attributes);

    String renderClosingTag(String tagName);

    String renderSelfClosingTag(String tagName, Map<String, PropertyValue> attributes);

    // --- Filters ---

    /** Maps a standard filter onto this engine, or empty when the engine has no equivalent. */
    Optional<FilterDefinition> filter(StandardFilter filter);

    String applyFilter(String expression, String filterName, List<String> args);

    /** Checks rendered output for structural problems such as unbalanced tags. */
    ValidationResult validate(String output);
}
