package io.templatexform.core.render;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.templatexform.core.error.RendererConfigException;
import io.templatexform.core.spi.RendererConfig;
import io.templatexform.core.spi.StandardFilter;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link RendererConfig} from a YAML file.
 *
 * <p>Example:
 *
 * <pre>
 * indent: "    "
 * prettyPrint: true
 * filterMappings:
 *   uppercase: shout
 * extra:
 *   strictVariables: true
 * </pre>
 *
 * <p>Every key is optional; omitted keys take the values of {@link RendererConfig#defaults()}. An
 * empty file yields the defaults.
 */
public final class RendererConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RendererConfigLoader.class);

    static final String SCHEMA_RESOURCE = "/schema/renderer-config.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private static final Set<String> KNOWN_KEYS =
            new LinkedHashSet<>(List.of("fileExtension", "outputDir", "indent", "prettyPrint", "filterMappings", "extra"));

    private final JsonSchema schema;

    public RendererConfigLoader() {
        this.schema = SCHEMA_FACTORY.getSchema(loadSchema());
    }

    /**
     * Reads and validates the configuration at {@code path}.
     *
     * @throws RendererConfigException if the file cannot be read, is not valid YAML, contains unknown
     *     keys or values of the wrong type
     */
    public RendererConfig load(Path path) {
        String source = path.toString();
        JsonNode root = readYaml(path, source);
        if (root == null || root.isMissingNode() || root.isNull()) {
            LOG.debug("renderer.config.empty: source={}", source);
            return RendererConfig.defaults();
        }
        if (!root.isObject()) {
            throw new RendererConfigException("Renderer configuration must be a YAML mapping", source);
        }
        rejectUnknownKeys(root, KNOWN_KEYS, "renderer config", source);
        validateAgainstSchema(root, source);

        JsonNode filterMappingsNode = root.get("filterMappings");
        Map<String, String> filterMappings = parseFilterMappings(filterMappingsNode, source);
        Map<String, Object> extra = root.has("extra")
                ? YAML_MAPPER.convertValue(root.get("extra"), new TypeReference<LinkedHashMap<String, Object>>() {})
                : Map.of();

        RendererConfig defaults = RendererConfig.defaults();
        RendererConfig config = new RendererConfig(
                textOrNull(root, "fileExtension"),
                textOrDefault(root, "outputDir", defaults.outputDir()),
                textOrDefault(root, "indent", defaults.indent()),
                root.has("prettyPrint") ? root.get("prettyPrint").asBoolean() : defaults.prettyPrint(),
                filterMappings,
                extra);
        LOG.info(
                "renderer.config.loaded: source={}, filterMappings={}, extraKeys={}",
                source,
                config.filterMappings().size(),
                config.extra().size());
        return config;
    }

    private Map<String, String> parseFilterMappings(JsonNode node, String source) {
        Map<String, String> mappings = new LinkedHashMap<>();
        if (node == null) {
            return mappings;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            StandardFilter filter = StandardFilter.fromKey(field.getKey())
                    .orElseThrow(() -> new RendererConfigException(
                            "Unknown standard filter in 'filterMappings': '" + field.getKey() + "'", source));
            mappings.put(filter.key(), field.getValue().asText());
        }
        return mappings;
    }

    private void validateAgainstSchema(JsonNode root, String source) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new RendererConfigException("Renderer configuration is invalid: " + detail, source);
        }
    }

    private JsonNode readYaml(Path path, String source) {
        try {
            return YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new RendererConfigException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String textOrDefault(JsonNode root, String field, String fallback) {
        String value = textOrNull(root, field);
        return value != null ? value : fallback;
    }

    private static void rejectUnknownKeys(JsonNode node, Set<String> knownKeys, String blockName, String source) {
        List<String> unknown = StreamSupport.stream(((Iterable<String>) node::fieldNames).spliterator(), false)
                .filter(key -> !knownKeys.contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            throw new RendererConfigException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in '" + blockName + "': " + unknown
                            + "; recognized keys are: " + knownKeys,
                    source);
        }
    }

    private static JsonNode loadSchema() {
        try (InputStream in = RendererConfigLoader.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled schema: " + SCHEMA_RESOURCE);
            }
            return new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled schema " + SCHEMA_RESOURCE, e);
        }
    }
}
