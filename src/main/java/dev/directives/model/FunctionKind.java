package dev.directives.model;

public enum FunctionKind {
    STEP,
    WORKFLOW;

    public IdentityKind identityKind() {
        return this == STEP ? IdentityKind.STEP : IdentityKind.WORKFLOW;
    }
}
