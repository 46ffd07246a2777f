package io.schemaxtract.core.model;

/**
 * A leaf comparison of a {@link RuleExpression}.
 *
 * @param leftTerm                first left term, or null when the left group has no terms
 * @param leftCalculationOperator calculation operator of the left term group, or null
 * @param rightTerm               right term, or null when the right group has no terms
 * @param comparisonOperator      comparison (expression) operator code, or null
 */
public record Comparison(
        LeftTerm leftTerm, Integer leftCalculationOperator, RightTerm rightTerm, Integer comparisonOperator) {}
