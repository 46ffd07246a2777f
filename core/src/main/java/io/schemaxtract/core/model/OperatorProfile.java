package io.schemaxtract.core.model;

import java.util.List;

/**
 * Distinct operator codes used by the form actions, each list ascending.
 *
 * @param comparison  comparison (expression) operator codes
 * @param bool        boolean operator codes
 * @param calculation calculation operator codes from left and right term groups
 */
public record OperatorProfile(List<Integer> comparison, List<Integer> bool, List<Integer> calculation) {

    public OperatorProfile {
        comparison = comparison != null ? List.copyOf(comparison) : List.of();
        bool = bool != null ? List.copyOf(bool) : List.of();
        calculation = calculation != null ? List.copyOf(calculation) : List.of();
    }

    public boolean isEmpty() {
        return comparison.isEmpty() && bool.isEmpty() && calculation.isEmpty();
    }
}
