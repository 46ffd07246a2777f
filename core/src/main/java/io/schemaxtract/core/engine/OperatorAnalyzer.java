package io.schemaxtract.core.engine;

import io.schemaxtract.core.model.Comparison;
import io.schemaxtract.core.model.FormAction;
import io.schemaxtract.core.model.OperatorProfile;
import io.schemaxtract.core.model.RuleExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the operator usage profile of the decoded form actions: every boolean
 * operator of every group, and the comparison and calculation (left and right
 * term group) operators of every comparison.
 *
 * <p>
 * The trees were already depth-bounded by {@link RuleNormalizer}, so the walk
 * needs no guard of its own.
 *
 * <p>
 * Thread-safe: stateless.
 */
public final class OperatorAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(OperatorAnalyzer.class);

    /**
     * Analyzes all actions across all paths.
     *
     * @param formActions decoded form actions, may be null
     * @return the profile; {@code null} when {@code formActions} is null, three
     *         empty lists when no action carries an expression
     */
    public OperatorProfile analyze(Map<String, List<FormAction>> formActions) {
        if (formActions == null) {
            return null;
        }
        Collector collector = new Collector();
        formActions.values().stream()
                .flatMap(List::stream)
                .map(FormAction::expression)
                .filter(Objects::nonNull)
                .forEach(collector::visit);

        OperatorProfile profile = new OperatorProfile(
                new ArrayList<>(collector.comparison),
                new ArrayList<>(collector.bool),
                new ArrayList<>(collector.calculation));
        LOG.debug(
                "Operator analysis: comparison={}, boolean={}, calculation={}",
                profile.comparison().size(),
                profile.bool().size(),
                profile.calculation().size());
        return profile;
    }

    private static final class Collector {

        private final SortedSet<Integer> comparison = new TreeSet<>();
        private final SortedSet<Integer> bool = new TreeSet<>();
        private final SortedSet<Integer> calculation = new TreeSet<>();

        void visit(RuleExpression group) {
            addIfPresent(bool, group.booleanOperator());
            for (Comparison c : group.comparisons()) {
                addIfPresent(comparison, c.comparisonOperator());
                addIfPresent(calculation, c.leftCalculationOperator());
                if (c.rightTerm() != null) {
                    addIfPresent(calculation, c.rightTerm().calculationOperator());
                }
            }
            group.childGroups().forEach(this::visit);
        }

        private static void addIfPresent(SortedSet<Integer> target, Integer code) {
            if (code != null) {
                target.add(code);
            }
        }
    }
}
