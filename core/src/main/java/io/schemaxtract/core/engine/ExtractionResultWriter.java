package io.schemaxtract.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.schemaxtract.core.model.Comparison;
import io.schemaxtract.core.model.DictionaryOrigin;
import io.schemaxtract.core.model.ExtractionDiagnostic;
import io.schemaxtract.core.model.ExtractionResult;
import io.schemaxtract.core.model.ExtractionStats;
import io.schemaxtract.core.model.FieldConstraints;
import io.schemaxtract.core.model.FieldDescriptor;
import io.schemaxtract.core.model.FormAction;
import io.schemaxtract.core.model.LayoutMetadata;
import io.schemaxtract.core.model.OperatorProfile;
import io.schemaxtract.core.model.Repeater;
import io.schemaxtract.core.model.ResourceElement;
import io.schemaxtract.core.model.ResourceGroup;
import io.schemaxtract.core.model.Rule;
import io.schemaxtract.core.model.RuleExpression;
import io.schemaxtract.core.model.ValidationAction;
import io.schemaxtract.core.model.VisibilityAction;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders an {@link ExtractionResult} as the JSON payload handed back to the
 * host integration layer. Form actions are written with the host's property
 * names, followed by their extension properties, so unrecognized upstream
 * properties round-trip.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ExtractionResultWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Builds the payload tree. */
    public ObjectNode toJson(ExtractionResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("formHierarchyCollectionId", result.formHierarchyCollectionId());
        root.put("reportingStandardId", result.reportingStandardId());

        ArrayNode fields = root.putArray("fields");
        result.fields().forEach(field -> writeField(fields.addObject(), field));

        ArrayNode groups = root.putArray("resourceGroups");
        for (ResourceGroup group : result.resourceGroups()) {
            ObjectNode node = groups.addObject();
            node.put("id", group.id());
            node.put("name", group.name());
            writeElements(node.putArray("elements"), group.elements());
        }

        if (result.formActions() == null) {
            root.putNull("formActions");
        } else {
            ObjectNode formActions = root.putObject("formActions");
            for (Map.Entry<String, List<FormAction>> entry : result.formActions().entrySet()) {
                ArrayNode actions = formActions.putArray(entry.getKey());
                entry.getValue().forEach(action -> writeAction(actions.addObject(), action));
            }
        }

        writeOperators(root, result.operators());

        ArrayNode rules = root.putArray("rules");
        result.rules().forEach(rule -> writeRule(rules.addObject(), rule));

        ArrayNode repeaters = root.putArray("repeaters");
        for (Repeater repeater : result.repeaters()) {
            ObjectNode node = repeaters.addObject();
            node.put("id", repeater.id());
            node.put("path", repeater.path());
            ArrayNode children = node.putArray("childBindings");
            repeater.childBindings().forEach(children::add);
        }

        writeStats(root.putObject("stats"), result.stats());

        ArrayNode diagnostics = root.putArray("diagnostics");
        for (ExtractionDiagnostic diagnostic : result.diagnostics()) {
            ObjectNode node = diagnostics.addObject();
            node.put("stage", diagnostic.stage().name());
            node.put("kind", diagnostic.kind().name());
            node.put("detail", diagnostic.detail());
        }
        return root;
    }

    /** Serializes the payload as compact JSON. */
    public String toJsonString(ExtractionResult result) {
        try {
            return MAPPER.writeValueAsString(toJson(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize extraction result", e);
        }
    }

    private static void writeField(ObjectNode node, FieldDescriptor field) {
        node.put("id", field.id());
        node.put("key", field.key());
        node.put("label", field.label());
        node.put("controlType", field.controlType());
        node.put("bindingPath", field.bindingPath());
        if (field.layoutPath() != null) {
            node.put("path", field.layoutPath());
        }
        node.put("required", field.required());
        node.put("resourceGroupId", field.resourceGroupId());
        writeElements(node.putArray("possibleValues"), field.possibleValues());

        FieldConstraints constraints = field.constraints();
        if (constraints != null) {
            ObjectNode c = node.putObject("constraints");
            c.put("minLength", constraints.minLength());
            c.put("maxLength", constraints.maxLength());
            c.put("min", constraints.min());
            c.put("max", constraints.max());
            c.put("pattern", constraints.pattern());
            c.put("mask", constraints.mask());
            c.put("defaultValue", constraints.defaultValue());
            c.put("minOccurs", constraints.minOccurs());
            c.put("maxOccurs", constraints.maxOccurs());
            c.put("nillable", constraints.nillable());
        }
        LayoutMetadata metadata = field.metadata();
        if (metadata != null) {
            ObjectNode m = node.putObject("metadata");
            m.put("isRepeating", metadata.repeating());
            m.put("isCollection", metadata.collection());
            m.put("displayOrder", metadata.displayOrder());
            m.put("columnSpan", metadata.columnSpan());
        }
        DictionaryOrigin origin = field.origin();
        if (origin != null) {
            node.put("formId", origin.formId());
            node.put("panelId", origin.panelId());
            node.put("sectionId", origin.sectionId());
            node.put("location", origin.location());
            node.put("formManagerNodeId", origin.formManagerNodeId());
            node.put("presetValueDefinitionId", origin.presetValueId());
        }
    }

    private static void writeElements(ArrayNode target, List<ResourceElement> elements) {
        for (ResourceElement element : elements) {
            ObjectNode node = target.addObject();
            node.put("id", element.id());
            node.put("value", element.value());
            node.put("text", element.text());
            node.put("order", element.order());
        }
    }

    private static void writeAction(ObjectNode node, FormAction action) {
        node.put("ActionID", action.actionId());
        node.put("ActionType", action.actionType());
        node.put("Name", action.name());
        if (action instanceof ValidationAction validation) {
            node.put("AffectedBindingPathEntryID", validation.targetField());
            node.put("ErrorMessage", validation.errorMessage());
            node.put("Points", validation.points());
        } else if (action instanceof VisibilityAction visibility) {
            node.put("FieldNodeID", visibility.fieldNodeId());
            node.put("AffectedFormHierarchyId", visibility.affectedFormHierarchyId());
            node.put("ComponentType", visibility.componentType());
        }
        node.set("expression", expressionNode(action.expression()));
        for (Map.Entry<String, JsonNode> extension : action.extensions().entrySet()) {
            node.set(extension.getKey(), extension.getValue().deepCopy());
        }
    }

    private static void writeRule(ObjectNode node, Rule rule) {
        node.put("type", rule.kind().actionType().toLowerCase(Locale.ROOT));
        node.put("id", rule.id());
        node.put("name", rule.name());
        node.put("targetField", rule.targetField());
        switch (rule.kind()) {
            case VALIDATION -> {
                node.put("errorMessage", rule.errorMessage());
                node.put("points", rule.points());
            }
            case VISIBILITY -> node.put("componentType", rule.componentType());
        }
        node.set("expression", expressionNode(rule.expression()));
    }

    private static JsonNode expressionNode(RuleExpression expression) {
        if (expression == null) {
            return MAPPER.nullNode();
        }
        ObjectNode node = MAPPER.createObjectNode();
        node.put("booleanOperator", expression.booleanOperator());
        ArrayNode comparisons = node.putArray("expressions");
        for (Comparison comparison : expression.comparisons()) {
            ObjectNode c = comparisons.addObject();
            if (comparison.leftTerm() == null) {
                c.putNull("leftTerm");
            } else {
                ObjectNode left = c.putObject("leftTerm");
                left.put("fieldId", comparison.leftTerm().fieldId());
                left.put("path", comparison.leftTerm().path());
                left.put("value", comparison.leftTerm().literal());
                left.put("operator", comparison.leftCalculationOperator());
            }
            if (comparison.rightTerm() == null) {
                c.putNull("rightTerm");
            } else {
                ObjectNode right = c.putObject("rightTerm");
                ArrayNode values = right.putArray("values");
                comparison.rightTerm().values().forEach(values::add);
                right.put("operator", comparison.rightTerm().calculationOperator());
            }
            c.put("operator", comparison.comparisonOperator());
        }
        ArrayNode children = node.putArray("childGroups");
        expression.childGroups().forEach(child -> children.add(expressionNode(child)));
        return node;
    }

    private static void writeOperators(ObjectNode root, OperatorProfile operators) {
        if (operators == null) {
            root.putNull("operators");
            return;
        }
        ObjectNode node = root.putObject("operators");
        ArrayNode expression = node.putArray("expression");
        operators.comparison().forEach(expression::add);
        ArrayNode bool = node.putArray("boolean");
        operators.bool().forEach(bool::add);
        ArrayNode calculation = node.putArray("calculation");
        operators.calculation().forEach(calculation::add);
    }

    private static void writeStats(ObjectNode node, ExtractionStats stats) {
        node.put("fieldCount", stats.fieldCount());
        node.put("resourceGroupCount", stats.resourceGroupCount());
        node.put("ruleCount", stats.ruleCount());
        node.put("repeaterCount", stats.repeaterCount());
        node.put("fieldsWithBindingPath", stats.fieldsWithBindingPath());
        node.put("formActionCount", stats.formActionCount());
        node.put("validationRuleCount", stats.validationRuleCount());
        node.put("uniqueOperators", stats.uniqueOperators());
    }
}
