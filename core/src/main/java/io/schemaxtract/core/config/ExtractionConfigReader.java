package io.schemaxtract.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.schemaxtract.core.engine.ExtractionConfig;
import io.schemaxtract.core.error.ExtractionConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads an {@link ExtractionConfig} from YAML.
 *
 * <p>
 * Recognised keys:
 *
 * <pre>
 * traversal:
 *   max-layout-depth: 10
 *   max-expression-depth: 20
 *   max-repeater-depth: 20
 * controls:
 *   selectable-control-types: [SingleSelect, MultiSelect]
 *   repeater-control-type: Repeater
 * </pre>
 *
 * Missing keys receive the defaults of {@link ExtractionConfig.Builder}. An
 * empty document yields {@link ExtractionConfig#DEFAULT}.
 */
public final class ExtractionConfigReader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ExtractionConfigReader() {
        // utility class
    }

    public static ExtractionConfig fromYaml(InputStream in) {
        try {
            return fromTree(YAML_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new ExtractionConfigException("Failed to parse YAML configuration", e);
        }
    }

    public static ExtractionConfig fromYaml(Reader reader) {
        try {
            return fromTree(YAML_MAPPER.readTree(reader));
        } catch (IOException e) {
            throw new ExtractionConfigException("Failed to parse YAML configuration", e);
        }
    }

    public static ExtractionConfig fromYaml(String yaml) {
        try {
            return fromTree(YAML_MAPPER.readTree(yaml));
        } catch (IOException e) {
            throw new ExtractionConfigException("Failed to parse YAML configuration", e);
        }
    }

    /** Maps an already parsed tree. A {@code null} or missing root yields the defaults. */
    public static ExtractionConfig fromTree(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return ExtractionConfig.DEFAULT;
        }
        if (!root.isObject()) {
            throw new ExtractionConfigException("Configuration root must be a mapping, got: " + root.getNodeType());
        }
        ExtractionConfig.Builder builder = ExtractionConfig.builder();

        JsonNode traversal = section(root, "traversal");
        if (traversal.has("max-layout-depth"))
            builder.maxLayoutDepth(depth(traversal, "max-layout-depth"));
        if (traversal.has("max-expression-depth"))
            builder.maxExpressionDepth(depth(traversal, "max-expression-depth"));
        if (traversal.has("max-repeater-depth"))
            builder.maxRepeaterDepth(depth(traversal, "max-repeater-depth"));

        JsonNode controls = section(root, "controls");
        if (controls.has("selectable-control-types"))
            builder.selectableControlTypes(controlTypes(controls.get("selectable-control-types")));
        if (controls.has("repeater-control-type"))
            builder.repeaterControlType(nonBlankText(controls, "repeater-control-type"));

        return builder.build();
    }

    private static JsonNode section(JsonNode root, String name) {
        JsonNode section = root.path(name);
        if (!section.isMissingNode() && !section.isNull() && !section.isObject()) {
            throw new ExtractionConfigException("'" + name + "' must be a mapping, got: " + section.getNodeType());
        }
        return section;
    }

    private static int depth(JsonNode section, String key) {
        JsonNode value = section.get(key);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new ExtractionConfigException("'" + key + "' must be an integer, got: " + value);
        }
        int depth = value.intValue();
        if (depth < 0) {
            throw new ExtractionConfigException("'" + key + "' must not be negative, got: " + depth);
        }
        return depth;
    }

    private static Set<String> controlTypes(JsonNode value) {
        if (!value.isArray()) {
            throw new ExtractionConfigException("'selectable-control-types' must be a list, got: " + value.getNodeType());
        }
        Set<String> types = new LinkedHashSet<>();
        for (JsonNode element : value) {
            if (!element.isTextual() || element.asText().isBlank()) {
                throw new ExtractionConfigException("'selectable-control-types' entries must be non-blank strings, got: "
                        + element);
            }
            types.add(element.asText());
        }
        return types;
    }

    private static String nonBlankText(JsonNode section, String key) {
        JsonNode value = section.get(key);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new ExtractionConfigException("'" + key + "' must be a non-blank string, got: " + value);
        }
        return value.asText();
    }
}
