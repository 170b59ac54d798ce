package dev.directives.model;

import java.util.Optional;

/**
 * The two recognised directive strings.
 */
public enum Directive {
    USE_STEP("use step", FunctionKind.STEP),
    USE_WORKFLOW("use workflow", FunctionKind.WORKFLOW);

    private final String text;
    private final FunctionKind kind;

    Directive(String text, FunctionKind kind) {
        this.text = text;
        this.kind = kind;
    }

    public String text() {
        return text;
    }

    public FunctionKind kind() {
        return kind;
    }

    public static Optional<Directive> fromText(String value) {
        for (Directive directive : values()) {
            if (directive.text.equals(value)) {
                return Optional.of(directive);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return '"' + text + '"';
    }
}
