package io.templatexform.core.build;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.templatexform.core.model.Root;
import io.templatexform.core.model.ValidationResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks the JSON form of an annotated tree against the bundled {@code annotated-tree} schema. Used
 * to catch malformed annotations (an empty loop collection, a nameless slot) in hand-built or
 * post-processed trees before they reach a renderer.
 */
public final class TreeSchemaValidator {

    static final String SCHEMA_RESOURCE = "/schema/annotated-tree.schema.json";

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    public TreeSchemaValidator() {
        this.schema = SCHEMA_FACTORY.getSchema(loadSchema());
    }

    public ValidationResult validate(Root root) {
        return validate(TreeJsonWriter.toJson(root));
    }

    /** Validates an already serialized tree. */
    public ValidationResult validate(JsonNode tree) {
        Set<ValidationMessage> errors = schema.validate(tree);
        List<String> messages =
                errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
        return ValidationResult.of(messages);
    }

    private static JsonNode loadSchema() {
        try (InputStream in = TreeSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled schema: " + SCHEMA_RESOURCE);
            }
            return new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled schema " + SCHEMA_RESOURCE, e);
        }
    }
}
