package io.schemaxtract.core.model;

import java.util.List;

/**
 * Canonical tree form of a validation or visibility condition. Depth is bounded
 * only by the traversal guard that built it.
 *
 * @param booleanOperator boolean operator code joining this group, or null
 * @param comparisons     leaf comparisons, empty when absent
 * @param childGroups     nested groups, empty when absent
 */
public record RuleExpression(Integer booleanOperator, List<Comparison> comparisons, List<RuleExpression> childGroups) {

    public RuleExpression {
        comparisons = comparisons != null ? List.copyOf(comparisons) : List.of();
        childGroups = childGroups != null ? List.copyOf(childGroups) : List.of();
    }
}
