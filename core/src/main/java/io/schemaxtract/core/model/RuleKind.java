package io.schemaxtract.core.model;

/** Discriminator of legacy rules. */
public enum RuleKind {
    VALIDATION("Validation"),
    VISIBILITY("Visibility");

    private final String actionType;

    RuleKind(String actionType) {
        this.actionType = actionType;
    }

    /** The host's {@code ActionType} tag for this kind. */
    public String actionType() {
        return actionType;
    }
}
