package io.schemaxtract.core.model;

/**
 * Summary counts of an extraction.
 *
 * @param fieldCount            number of field descriptors
 * @param resourceGroupCount    number of resource groups
 * @param ruleCount             number of legacy rules
 * @param repeaterCount         number of repeaters
 * @param fieldsWithBindingPath fields whose binding path was resolved
 * @param formActionCount       form actions across all paths
 * @param validationRuleCount   form actions of type {@code Validation}
 * @param uniqueOperators       distinct comparison operator codes
 */
public record ExtractionStats(
        int fieldCount,
        int resourceGroupCount,
        int ruleCount,
        int repeaterCount,
        int fieldsWithBindingPath,
        int formActionCount,
        int validationRuleCount,
        int uniqueOperators) {

    public static final ExtractionStats EMPTY = new ExtractionStats(0, 0, 0, 0, 0, 0, 0, 0);
}
