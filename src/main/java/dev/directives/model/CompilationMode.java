package dev.directives.model;

import java.util.Locale;

/**
 * Which runtime context will load the transformed module. Selected once per transform and applied
 * uniformly to every step and workflow function in the module.
 */
public enum CompilationMode {
    /** Step-execution worker: step bodies are kept and registered. */
    STEP,
    /** Workflow-orchestration engine: steps become proxies, workflows are registered. */
    WORKFLOW,
    /** Client code that only references steps and workflows remotely. */
    CLIENT;

    public static CompilationMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Compilation mode must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Unknown compilation mode '" + value + "', expected one of step, workflow, client", e);
        }
    }

    /** Dead-code elimination only runs where bodies were replaced. */
    public boolean eliminatesDeadCode() {
        return this != STEP;
    }
}
