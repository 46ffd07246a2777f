package io.schemaxtract.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.schemaxtract.core.error.MalformedInputException;
import io.schemaxtract.core.model.Comparison;
import io.schemaxtract.core.model.ExtractionStage;
import io.schemaxtract.core.model.FormAction;
import io.schemaxtract.core.model.GenericAction;
import io.schemaxtract.core.model.LeftTerm;
import io.schemaxtract.core.model.Repeater;
import io.schemaxtract.core.model.RightTerm;
import io.schemaxtract.core.model.Rule;
import io.schemaxtract.core.model.RuleExpression;
import io.schemaxtract.core.model.RuleKind;
import io.schemaxtract.core.model.ValidationAction;
import io.schemaxtract.core.model.VisibilityAction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts the host's rule records into canonical {@link RuleExpression} trees.
 *
 * <p>
 * Two extraction modes coexist:
 * <ul>
 * <li>legacy: flat validation and visibility action lists, filtered by their
 * {@code ActionType} tag and mapped 1:1 to {@link Rule}s;</li>
 * <li>rich: a per-path map of form actions with an open-ended property set,
 * decoded into {@link FormAction} variants; unrecognized properties are kept
 * as detached copies in the action's extension map.</li>
 * </ul>
 *
 * <p>
 * Expression groups are normalized recursively up to
 * {@link ExtractionConfig#maxExpressionDepth()}. Only the first term of a left
 * term group is kept. Missing groups yield {@code null}, missing lists yield
 * empty lists.
 *
 * <p>
 * Also discovers repeaters in the layout tree, which is walked independently
 * of field reconciliation.
 *
 * <p>
 * Thread-safe: holds no per-call state.
 */
public final class RuleNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(RuleNormalizer.class);

    private static final String ACTION_ID = "ActionID";
    private static final String ACTION_TYPE = "ActionType";
    private static final String NAME = "Name";
    private static final String EXPRESSION_GROUP = "ExpressionGroup";
    private static final String AFFECTED_BINDING = "AffectedBindingPathEntryID";
    private static final String ERROR_MESSAGE = "ErrorMessage";
    private static final String POINTS = "Points";
    private static final String FIELD_NODE_ID = "FieldNodeID";
    private static final String AFFECTED_HIERARCHY = "AffectedFormHierarchyId";
    private static final String COMPONENT_TYPE = "ComponentType";

    private static final Set<String> COMMON_KEYS = Set.of(ACTION_ID, ACTION_TYPE, NAME, EXPRESSION_GROUP);
    private static final Set<String> VALIDATION_KEYS =
            Set.of(ACTION_ID, ACTION_TYPE, NAME, EXPRESSION_GROUP, AFFECTED_BINDING, ERROR_MESSAGE, POINTS);
    private static final Set<String> VISIBILITY_KEYS = Set.of(
            ACTION_ID, ACTION_TYPE, NAME, EXPRESSION_GROUP, FIELD_NODE_ID, AFFECTED_HIERARCHY, COMPONENT_TYPE);

    /** Layout properties holding child nodes, walked during repeater discovery. */
    private static final List<String> LAYOUT_CHILD_KEYS = List.of("Forms", "Panels", "Controls");

    private final GraphReader reader;
    private final ExtractionConfig config;
    private final DepthGuard expressionGuard;
    private final DepthGuard repeaterGuard;

    public RuleNormalizer(GraphReader reader, ExtractionConfig config) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.expressionGuard = config.expressionGuard();
        this.repeaterGuard = config.repeaterGuard();
    }

    // --- Legacy mode ---

    /**
     * Extracts legacy rules from both lists, validations first.
     *
     * @throws MalformedInputException if a present list is not a list
     */
    public List<Rule> normalizeLegacy(JsonNode validationActions, JsonNode visibilityActions) {
        List<Rule> rules = new ArrayList<>(legacyRules(validationActions, RuleKind.VALIDATION));
        rules.addAll(legacyRules(visibilityActions, RuleKind.VISIBILITY));
        return rules;
    }

    /**
     * Extracts the legacy rules of one kind. Entries whose {@code ActionType}
     * does not match the kind are ignored.
     *
     * @param actions legacy action list, may be absent
     * @param kind    the kind of list being read
     * @return rules in source order
     * @throws MalformedInputException if the list is present but not a list
     */
    public List<Rule> legacyRules(JsonNode actions, RuleKind kind) {
        JsonNode list = reader.value(actions);
        if (JsonNodeUtils.isAbsent(list)) {
            return List.of();
        }
        if (!list.isArray()) {
            throw new MalformedInputException(
                    "Legacy " + kind.actionType().toLowerCase(Locale.ROOT) + " actions must be a list, got " + list.getNodeType(),
                    ExtractionStage.LEGACY_RULES);
        }
        List<Rule> rules = new ArrayList<>();
        for (JsonNode action : reader.elements(list)) {
            if (!kind.actionType().equals(reader.text(action, ACTION_TYPE))) {
                continue;
            }
            RuleExpression expression = normalizeExpression(reader.child(action, EXPRESSION_GROUP));
            if (kind == RuleKind.VALIDATION) {
                rules.add(new Rule(
                        kind,
                        reader.text(action, ACTION_ID),
                        reader.text(action, NAME),
                        reader.text(action, AFFECTED_BINDING),
                        reader.text(action, ERROR_MESSAGE),
                        reader.integer(action, POINTS),
                        null,
                        expression));
            } else {
                rules.add(new Rule(
                        kind,
                        reader.text(action, ACTION_ID),
                        reader.text(action, NAME),
                        reader.firstText(action, FIELD_NODE_ID, AFFECTED_HIERARCHY),
                        null,
                        null,
                        reader.text(action, COMPONENT_TYPE),
                        expression));
            }
        }
        return rules;
    }

    // --- Rich mode ---

    /**
     * Decodes the per-path form action map.
     *
     * @param formActions form action map root, may be absent
     * @return decoded actions per path in source order, or {@code null} when absent
     * @throws MalformedInputException if the root is present but not an object
     */
    public Map<String, List<FormAction>> extractFormActions(JsonNode formActions) {
        JsonNode root = reader.value(formActions);
        if (JsonNodeUtils.isAbsent(root)) {
            LOG.debug("No form actions found");
            return null;
        }
        if (!root.isObject()) {
            throw new MalformedInputException(
                    "Form actions must be an object keyed by path, got " + root.getNodeType(),
                    ExtractionStage.FORM_ACTIONS);
        }
        Map<String, List<FormAction>> extracted = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<String, JsonNode> entry : reader.properties(root)) {
            List<FormAction> actions = new ArrayList<>();
            if (!entry.getValue().isArray()) {
                LOG.debug("Form actions for path {} are not a list, treating as empty", entry.getKey());
            }
            for (JsonNode action : reader.elements(entry.getValue())) {
                if (action.isObject()) {
                    actions.add(decodeAction(action));
                }
            }
            total += actions.size();
            extracted.put(entry.getKey(), actions);
        }
        LOG.debug("Extracted {} form actions across {} paths", total, extracted.size());
        return extracted;
    }

    /** Decodes one raw form action into its variant. */
    public FormAction decodeAction(JsonNode action) {
        String actionType = reader.text(action, ACTION_TYPE);
        String actionId = reader.text(action, ACTION_ID);
        String name = reader.text(action, NAME);
        RuleExpression expression = normalizeExpression(reader.child(action, EXPRESSION_GROUP));

        if (FormAction.ACTION_TYPE_VALIDATION.equals(actionType)) {
            return new ValidationAction(
                    actionId,
                    name,
                    reader.text(action, AFFECTED_BINDING),
                    reader.text(action, ERROR_MESSAGE),
                    reader.integer(action, POINTS),
                    expression,
                    extensions(action, VALIDATION_KEYS));
        }
        if (FormAction.ACTION_TYPE_VISIBILITY.equals(actionType)) {
            return new VisibilityAction(
                    actionId,
                    name,
                    reader.text(action, FIELD_NODE_ID),
                    reader.text(action, AFFECTED_HIERARCHY),
                    reader.text(action, COMPONENT_TYPE),
                    expression,
                    extensions(action, VISIBILITY_KEYS));
        }
        return new GenericAction(actionId, actionType, name, expression, extensions(action, COMMON_KEYS));
    }

    private Map<String, JsonNode> extensions(JsonNode action, Set<String> consumed) {
        Map<String, JsonNode> extensions = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> property : reader.properties(action)) {
            if (consumed.contains(property.getKey())) {
                continue;
            }
            JsonNode copy = reader.detach(property.getValue(), expressionGuard);
            if (!copy.isMissingNode()) {
                extensions.put(property.getKey(), copy);
            }
        }
        return extensions;
    }

    // --- Expression normalization ---

    /**
     * Normalizes a raw expression group.
     *
     * @param group raw group, may be absent
     * @return the canonical tree, or {@code null} when the group is absent
     */
    public RuleExpression normalizeExpression(JsonNode group) {
        return normalizeGroup(group, 0);
    }

    private RuleExpression normalizeGroup(JsonNode rawGroup, int depth) {
        JsonNode group = reader.value(rawGroup);
        if (!group.isObject() || !expressionGuard.permits(depth)) {
            return null;
        }
        List<Comparison> comparisons = new ArrayList<>();
        for (JsonNode expression : reader.elements(group, "Expressions")) {
            if (expression.isObject()) {
                comparisons.add(comparison(expression));
            }
        }
        List<RuleExpression> childGroups = new ArrayList<>();
        for (JsonNode child : reader.elements(group, "ChildExpressionGroups")) {
            RuleExpression normalized = normalizeGroup(child, depth + 1);
            if (normalized != null) {
                childGroups.add(normalized);
            }
        }
        return new RuleExpression(reader.integer(group, "BooleanOperatorID"), comparisons, childGroups);
    }

    private Comparison comparison(JsonNode expression) {
        JsonNode leftGroup = reader.child(expression, "LeftTermGroup");
        JsonNode rightGroup = reader.child(expression, "RightTermGroup");
        return new Comparison(
                leftTerm(leftGroup),
                reader.integer(leftGroup, "CalculationOperatorID"),
                rightTerm(rightGroup),
                reader.integer(expression, "ExpressionOperatorID"));
    }

    // only the first left term is meaningful to the host's rule designer
    private LeftTerm leftTerm(JsonNode leftGroup) {
        List<JsonNode> terms = reader.elements(leftGroup, "Terms");
        if (terms.isEmpty() || !JsonNodeUtils.isTruthy(terms.get(0))) {
            return null;
        }
        JsonNode first = terms.get(0);
        return new LeftTerm(
                reader.text(first, "BindingPathEntryID"),
                reader.text(first, "PathFromParentList"),
                reader.text(first, "Value"));
    }

    private RightTerm rightTerm(JsonNode rightGroup) {
        JsonNode terms = reader.child(rightGroup, "Terms");
        if (!terms.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>();
        for (JsonNode term : reader.elements(terms)) {
            values.add(reader.text(term, "Value"));
        }
        return new RightTerm(values, reader.integer(rightGroup, "CalculationOperatorID"));
    }

    // --- Repeater discovery ---

    /**
     * Walks the layout collection for repeaters: nodes flagged repeating or of
     * the repeater control type. Each repeater records only the binding ids of
     * its immediate child controls.
     *
     * @param layouts layout collection root, may be absent
     * @return repeaters in discovery order
     * @throws MalformedInputException if the root is present but neither an object nor a list
     */
    public List<Repeater> discoverRepeaters(JsonNode layouts) {
        JsonNode root = reader.value(layouts);
        if (JsonNodeUtils.isAbsent(root)) {
            return List.of();
        }
        List<Repeater> found = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode layout : reader.elements(root)) {
                findRepeaters(layout, "", 0, found);
            }
        } else if (root.isObject()) {
            findRepeaters(root, "", 0, found);
        } else {
            throw new MalformedInputException(
                    "Layout collection must be an object or a list, got " + root.getNodeType(),
                    ExtractionStage.REPEATERS);
        }
        return found;
    }

    private void findRepeaters(JsonNode node, String path, int depth, List<Repeater> found) {
        repeaterGuard.descend(node, depth, (current, level) -> {
            if (!current.isObject()) {
                return;
            }
            String name = reader.text(current, NAME);
            String nodePath = name != null ? path + "/" + name : path;
            if (reader.truthy(current, "IsRepeating")
                    || config.repeaterControlType().equals(reader.text(current, "ControlType"))) {
                List<String> childBindings = new ArrayList<>();
                for (JsonNode child : reader.elements(current, "Controls")) {
                    String binding = reader.text(child, "BindingPathEntryID");
                    if (binding != null) {
                        childBindings.add(binding);
                    }
                }
                found.add(new Repeater(reader.text(current, "ID"), nodePath, childBindings));
            }
            for (String childKey : LAYOUT_CHILD_KEYS) {
                for (JsonNode child : reader.elements(current, childKey)) {
                    findRepeaters(child, nodePath, level + 1, found);
                }
            }
        });
    }
}
