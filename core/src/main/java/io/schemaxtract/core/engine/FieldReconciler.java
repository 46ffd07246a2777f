package io.schemaxtract.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemaxtract.core.error.MalformedInputException;
import io.schemaxtract.core.model.DictionaryOrigin;
import io.schemaxtract.core.model.ExtractionStage;
import io.schemaxtract.core.model.FieldConstraints;
import io.schemaxtract.core.model.FieldDescriptor;
import io.schemaxtract.core.model.LayoutMetadata;
import io.schemaxtract.core.model.ResourceGroup;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the field dictionary and the layout tree into one set of
 * {@link FieldDescriptor}s keyed by binding-path entry id.
 *
 * <p>
 * Phase 1 seeds one draft per dictionary entry (label, type, placement) and
 * resolves enumerations for selectable control types. Phase 2 walks every
 * layout (form → panel → control, nested controls guarded by
 * {@link ExtractionConfig#maxLayoutDepth()}) and lets layout data win for
 * binding path, control type, required flag, resource group, constraints and
 * metadata. Controls unknown to the dictionary become layout-only fields.
 * Layouts that disagree on a binding path resolve to the smallest one and
 * leave a conflict in the {@link FieldSet}.
 *
 * <p>
 * The returned list is in discovery order; consumers sort before doing
 * anything order-sensitive.
 *
 * <p>
 * Thread-safe: all per-call state lives in a {@link FieldSet}.
 */
public final class FieldReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(FieldReconciler.class);

    private static final String CONTROLS = "Controls";
    private static final String GRID_MARKER = "grid";
    private static final String MULTI_SELECT = "MultiSelect";

    private final GraphReader reader;
    private final ExtractionConfig config;
    private final DepthGuard layoutGuard;

    public FieldReconciler(GraphReader reader, ExtractionConfig config) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.layoutGuard = config.layoutGuard();
    }

    /**
     * Runs both phases.
     *
     * @param dictionary field dictionary root, may be absent
     * @param layouts    layout collection root, may be absent
     * @param resources  resource index for enumeration lookups
     * @return reconciled fields in discovery order
     * @throws MalformedInputException if a present root has an unexpected shape
     */
    public List<FieldDescriptor> extractFields(JsonNode dictionary, JsonNode layouts, ResourceIndex resources) {
        FieldSet fields = new FieldSet(resources);
        seedFromDictionary(fields, dictionary);
        mergeLayouts(fields, layouts);
        return fields.build();
    }

    // --- Phase 1: dictionary ---

    void seedFromDictionary(FieldSet fields, JsonNode dictionary) {
        JsonNode entries = reader.value(dictionary);
        if (JsonNodeUtils.isAbsent(entries)) {
            LOG.debug("No field dictionary, fields come from layouts only");
            return;
        }
        if (!entries.isArray()) {
            throw new MalformedInputException(
                    "Field dictionary must be a list, got " + entries.getNodeType(), ExtractionStage.FIELDS);
        }

        int skipped = 0;
        for (JsonNode entry : reader.elements(entries)) {
            String id = reader.firstText(entry, "bpID", "bindingPathEntryId");
            if (id == null || id.isEmpty()) {
                skipped++;
                continue;
            }
            FieldDraft draft = fields.replace(id);
            draft.key = reader.text(entry, "key");
            draft.label = draft.key;
            draft.controlType = reader.firstText(entry, "type", "controlType");
            draft.origin = new DictionaryOrigin(
                    reader.text(entry, "formID"),
                    reader.text(entry, "panelID"),
                    reader.text(entry, "sectionID"),
                    reader.text(entry, "locationName"),
                    reader.text(entry, "formManagerNoDataNodeID"),
                    reader.text(entry, "presetValueDefinitionID"));

            // the binding-path entry id doubles as the resource group id of selectable fields
            if (config.isSelectable(draft.controlType)) {
                fields.resources().lookup(id).ifPresent(group -> bind(draft, group));
            }
        }
        LOG.debug("Seeded {} fields from dictionary (skipped {} without id)", fields.size(), skipped);
    }

    // --- Phase 2: layouts ---

    void mergeLayouts(FieldSet fields, JsonNode layouts) {
        JsonNode root = reader.value(layouts);
        if (JsonNodeUtils.isAbsent(root)) {
            LOG.debug("No layouts, binding paths stay unresolved");
            return;
        }
        if (root.isArray()) {
            for (JsonNode layout : reader.elements(root)) {
                traverseLayout(fields, layout);
            }
        } else if (root.isObject()) {
            traverseLayout(fields, root);
        } else {
            throw new MalformedInputException(
                    "Layout collection must be an object or a list, got " + root.getNodeType(),
                    ExtractionStage.FIELDS);
        }
        if (fields.truncatedBranches() > 0) {
            LOG.debug(
                    "Layout traversal cut {} branches deeper than {}",
                    fields.truncatedBranches(),
                    config.maxLayoutDepth());
        }
    }

    private void traverseLayout(FieldSet fields, JsonNode layout) {
        if (!layout.isObject()) {
            return;
        }
        List<JsonNode> forms = reader.elements(layout, "Forms");
        for (int formIndex = 0; formIndex < forms.size(); formIndex++) {
            JsonNode form = forms.get(formIndex);
            String formPath = "Form[" + formIndex + "]";
            for (JsonNode panel : reader.elements(form, "Panels")) {
                traverseControls(fields, reader.child(panel, CONTROLS), formPath + "/" + panelSegment(panel), 0);
            }
            traverseControls(fields, reader.child(form, CONTROLS), formPath, 0);
        }
        for (JsonNode panel : reader.elements(layout, "Panels")) {
            traverseControls(fields, reader.child(panel, CONTROLS), panelSegment(panel), 0);
        }
    }

    private String panelSegment(JsonNode panel) {
        return "Panel[" + Objects.toString(reader.text(panel, "Name"), "") + "]";
    }

    private void traverseControls(FieldSet fields, JsonNode controls, String path, int depth) {
        boolean visited = layoutGuard.descend(controls, depth, (node, level) -> {
            for (JsonNode control : reader.elements(node)) {
                visitControl(fields, control, path);
                JsonNode children = reader.child(control, CONTROLS);
                if (reader.isPresent(children)) {
                    String name = reader.firstText(control, "Name");
                    traverseControls(fields, children, path + "/" + (name != null ? name : "group"), level + 1);
                }
            }
        });
        if (!visited) {
            fields.recordTruncation();
        }
    }

    private void visitControl(FieldSet fields, JsonNode control, String path) {
        JsonNode idNode = reader.child(control, "BindingPathEntryID");
        if (!JsonNodeUtils.isTruthy(idNode)) {
            return;
        }
        String id = JsonNodeUtils.textOrNull(idNode);
        FieldDraft draft = fields.get(id);
        if (draft == null) {
            draft = fields.replace(id);
            String name = reader.firstText(control, "Name", "Label");
            draft.layoutPath = path + "/" + (name != null ? name : "field");
            draft.label = reader.text(control, "Label");
        }

        draft.bindingPath = mergeBindingPath(fields, id, reader.text(control, "BindingPath"), draft.bindingPath);
        draft.controlType = preferLayout(reader.text(control, "ControlType"), draft.controlType);
        draft.required = preferLayout(reader.flag(control, "Required"), draft.required);
        draft.constraints = constraints(control);
        draft.metadata = new LayoutMetadata(
                reader.flag(control, "IsRepeating"),
                reader.flag(control, "IsCollection"),
                reader.integer(control, "DisplayOrder"),
                reader.integer(control, "ColumnSpan"));

        String groupId = reader.text(control, "ResourceGroupID");
        if (groupId != null && !groupId.equals(draft.resourceGroupId)) {
            // group id and values always change together; an unknown group leaves no values
            Optional<ResourceGroup> group = fields.resources().lookup(groupId);
            draft.resourceGroupId = groupId;
            draft.possibleValues = group.map(ResourceGroup::elements).orElse(List.of());
        }
    }

    /**
     * Binding paths only come from layouts. When two controls disagree, the
     * smallest path (code-point order) is kept so layout order cannot change
     * the result, and the conflict is recorded.
     */
    private static String mergeBindingPath(FieldSet fields, String id, String layoutPath, String current) {
        if (layoutPath == null || current == null || layoutPath.equals(current)) {
            return preferLayout(layoutPath, current);
        }
        String kept = layoutPath.compareTo(current) < 0 ? layoutPath : current;
        String conflict = "Field " + id + " has conflicting binding paths '" + current + "' and '" + layoutPath
                + "', keeping '" + kept + "'";
        LOG.warn("Layout conflict: {}", conflict);
        fields.recordConflict(conflict);
        return kept;
    }

    private static <T> T preferLayout(T layoutValue, T current) {
        return layoutValue != null ? layoutValue : current;
    }

    private FieldConstraints constraints(JsonNode control) {
        return new FieldConstraints(
                reader.integer(control, "MinLength"),
                reader.integer(control, "MaxLength"),
                reader.text(control, "MinValue"),
                reader.text(control, "MaxValue"),
                reader.text(control, "Pattern"),
                reader.text(control, "Mask"),
                reader.text(control, "DefaultValue"),
                reader.truthy(control, "IsRequired") ? 1 : 0,
                isMultiValued(control) ? FieldConstraints.UNBOUNDED : 1,
                reader.truthy(control, "FormManagerNoDataNodeID"));
    }

    /**
     * Classifies a layout control as multi-valued. Any single signal is
     * sufficient: a grid-like control type, a multi-select control, array
     * notation in the binding path, a repeating or collection flag, or a
     * declared maximum cardinality above one.
     */
    boolean isMultiValued(JsonNode control) {
        String controlType = reader.text(control, "ControlType");
        String bindingPath = reader.text(control, "BindingPath");
        Integer maxCardinality = reader.integer(control, "MaxCardinality");
        return (controlType != null && controlType.toLowerCase(Locale.ROOT).contains(GRID_MARKER))
                || MULTI_SELECT.equals(controlType)
                || (bindingPath != null && bindingPath.contains("[]"))
                || reader.truthy(control, "IsRepeating")
                || reader.truthy(control, "IsCollection")
                || (maxCardinality != null && maxCardinality > 1);
    }

    private static void bind(FieldDraft draft, ResourceGroup group) {
        draft.resourceGroupId = group.id();
        draft.possibleValues = group.elements();
    }
}
