package io.schemaxtract.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemaxtract.core.error.MalformedInputException;
import io.schemaxtract.core.model.ExtractionStage;
import io.schemaxtract.core.model.ResourceElement;
import io.schemaxtract.core.model.ResourceGroup;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Indexes the host's resource table into enumerations.
 *
 * <p>
 * The table is irregular: some top-level keys map directly to a group (an
 * object with an {@code Elements} list), others map to an intermediate
 * container whose own keys are the groups. Both shapes are registered, each
 * group under the key it was found at.
 *
 * <p>
 * Thread-safe: holds no per-call state.
 */
public final class EnumerationResolver {

    private static final Logger LOG = LoggerFactory.getLogger(EnumerationResolver.class);

    static final String ELEMENTS = "Elements";

    private final GraphReader reader;

    public EnumerationResolver(GraphReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    /**
     * Builds the lookup index over a resource table.
     *
     * @param resourceTable resource table root, may be null or absent
     * @return the index; empty when the table is absent
     * @throws MalformedInputException if the table is present but not an object
     */
    public ResourceIndex index(JsonNode resourceTable) {
        JsonNode table = reader.value(resourceTable);
        if (JsonNodeUtils.isAbsent(table)) {
            LOG.debug("No resource table, enumerations unavailable");
            return ResourceIndex.empty();
        }
        if (!table.isObject()) {
            throw new MalformedInputException(
                    "Resource table must be an object, got " + table.getNodeType(), ExtractionStage.RESOURCE_GROUPS);
        }

        List<ResourceGroup> groups = new ArrayList<>();
        Map<String, ResourceGroup> topLevel = new LinkedHashMap<>();
        List<Map<String, ResourceGroup>> containers = new ArrayList<>();

        for (Map.Entry<String, JsonNode> entry : reader.properties(table)) {
            String topKey = entry.getKey();
            JsonNode value = entry.getValue();
            if (!value.isObject()) {
                continue;
            }
            ResourceGroup direct = toGroup(topKey, value);
            topLevel.put(topKey, direct);
            if (hasElements(value)) {
                groups.add(direct);
                continue;
            }
            // intermediate container: every nested object is a candidate group
            Map<String, ResourceGroup> container = new LinkedHashMap<>();
            for (Map.Entry<String, JsonNode> nested : reader.properties(value)) {
                if (!nested.getValue().isObject()) {
                    continue;
                }
                ResourceGroup group = toGroup(nested.getKey(), nested.getValue());
                container.put(nested.getKey(), group);
                if (hasElements(nested.getValue())) {
                    groups.add(group);
                }
            }
            containers.add(container);
        }

        LOG.debug(
                "Indexed resource table: groups={}, with_elements={}, containers={}",
                groups.size(),
                groups.stream().filter(g -> g.elementCount() > 0).count(),
                containers.size());
        return new ResourceIndex(groups, topLevel, containers);
    }

    private boolean hasElements(JsonNode group) {
        return reader.child(group, ELEMENTS).isArray();
    }

    private ResourceGroup toGroup(String id, JsonNode group) {
        List<JsonNode> rawElements = reader.elements(group, ELEMENTS);
        String name = rawElements.isEmpty() ? null : reader.text(rawElements.get(0), "ResourceGroupID");
        List<ResourceElement> elements = new ArrayList<>(rawElements.size());
        for (JsonNode element : rawElements) {
            elements.add(toElement(element));
        }
        return new ResourceGroup(id, name != null && !name.isEmpty() ? name : id, elements);
    }

    private ResourceElement toElement(JsonNode element) {
        String value = reader.text(element, "Value");
        String text = reader.firstText(element, "OriginalDisplayMember", "Value");
        Integer order = JsonNodeUtils.intOrNull(reader.first(element, "SortOrder", "Order"));
        return new ResourceElement(
                reader.firstText(element, "Id", "ID"), value, text, order != null ? order : 0);
    }
}
