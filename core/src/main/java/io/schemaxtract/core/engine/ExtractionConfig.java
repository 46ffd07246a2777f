package io.schemaxtract.core.engine;

import java.util.Objects;
import java.util.Set;

/**
 * Tuning knobs of the extraction engine. Immutable and thread-safe.
 *
 * @param maxLayoutDepth         nested control depth visited while reconciling fields (default: 10)
 * @param maxExpressionDepth     nested expression group depth kept by rule normalization (default: 20)
 * @param maxRepeaterDepth       layout node depth visited while discovering repeaters (default: 20)
 * @param selectableControlTypes control types whose fields are resolved against the resource table
 * @param repeaterControlType    control type that marks a repeater
 */
public record ExtractionConfig(
        int maxLayoutDepth,
        int maxExpressionDepth,
        int maxRepeaterDepth,
        Set<String> selectableControlTypes,
        String repeaterControlType) {

    public static final ExtractionConfig DEFAULT = builder().build();

    public ExtractionConfig {
        requireNonNegative(maxLayoutDepth, "maxLayoutDepth");
        requireNonNegative(maxExpressionDepth, "maxExpressionDepth");
        requireNonNegative(maxRepeaterDepth, "maxRepeaterDepth");
        selectableControlTypes = Set.copyOf(
                Objects.requireNonNull(selectableControlTypes, "selectableControlTypes must not be null"));
        Objects.requireNonNull(repeaterControlType, "repeaterControlType must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public DepthGuard layoutGuard() {
        return new DepthGuard(maxLayoutDepth);
    }

    public DepthGuard expressionGuard() {
        return new DepthGuard(maxExpressionDepth);
    }

    public DepthGuard repeaterGuard() {
        return new DepthGuard(maxRepeaterDepth);
    }

    public boolean isSelectable(String controlType) {
        return controlType != null && selectableControlTypes.contains(controlType);
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, got: " + value);
        }
    }

    /** Builder with the documented defaults. */
    public static final class Builder {

        private int maxLayoutDepth = 10;
        private int maxExpressionDepth = 20;
        private int maxRepeaterDepth = 20;
        private Set<String> selectableControlTypes = Set.of("SingleSelect", "MultiSelect");
        private String repeaterControlType = "Repeater";

        private Builder() {}

        public Builder maxLayoutDepth(int maxLayoutDepth) {
            this.maxLayoutDepth = maxLayoutDepth;
            return this;
        }

        public Builder maxExpressionDepth(int maxExpressionDepth) {
            this.maxExpressionDepth = maxExpressionDepth;
            return this;
        }

        public Builder maxRepeaterDepth(int maxRepeaterDepth) {
            this.maxRepeaterDepth = maxRepeaterDepth;
            return this;
        }

        public Builder selectableControlTypes(Set<String> selectableControlTypes) {
            this.selectableControlTypes = selectableControlTypes;
            return this;
        }

        public Builder repeaterControlType(String repeaterControlType) {
            this.repeaterControlType = repeaterControlType;
            return this;
        }

        public ExtractionConfig build() {
            return new ExtractionConfig(
                    maxLayoutDepth, maxExpressionDepth, maxRepeaterDepth, selectableControlTypes, repeaterControlType);
        }
    }
}
