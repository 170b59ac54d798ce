package dev.directives.model;

/**
 * The five recoverable problems the transform reports. Each carries a stable code and a message
 * template.
 */
public enum DiagnosticKind {

    NON_ASYNC_FUNCTION("WF001",
        "Functions marked with %s must be async functions"),
    MISPLACED_DIRECTIVE("WF002",
        "%s"),
    MISSPELLED_DIRECTIVE("WF003",
        "Did you mean %s? \"%s\" is not a supported directive"),
    FORBIDDEN_EXPRESSION("WF004",
        "`%s` is not allowed in %s functions: they may be relocated or serialized and cannot rely on its binding"),
    INVALID_EXPORT("WF005",
        "Only async functions can be exported from a %s file. %s");

    private final String code;
    private final String template;

    DiagnosticKind(String code, String template) {
        this.code = code;
        this.template = template;
    }

    public String code() {
        return code;
    }

    public String template() {
        return template;
    }

    public String format(Object... args) {
        return String.format(template, args);
    }
}
