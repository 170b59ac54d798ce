package dev.directives.model;

/**
 * Kind segment of an identity string.
 */
public enum IdentityKind {
    STEP("step"),
    WORKFLOW("workflow"),
    CLASS("class");

    private final String prefix;

    IdentityKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static IdentityKind fromPrefix(String prefix) {
        for (IdentityKind kind : values()) {
            if (kind.prefix.equals(prefix)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown identity kind '" + prefix + "'");
    }
}
