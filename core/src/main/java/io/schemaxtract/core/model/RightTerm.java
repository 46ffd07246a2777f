package io.schemaxtract.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Right side of a {@link Comparison}: every term value of the right term group
 * plus the group's calculation operator.
 *
 * @param values              term values in source order; entries may be null
 * @param calculationOperator calculation operator code, or null
 */
public record RightTerm(List<String> values, Integer calculationOperator) {

    public RightTerm {
        values = values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : List.of();
    }
}
