package dev.directives.engine;

import dev.directives.ast.FunctionNode;
import dev.directives.ast.Statement;
import dev.directives.model.ClassSerializationEntry;
import dev.directives.model.CompilationMode;
import dev.directives.model.Diagnostic;
import dev.directives.model.Directive;
import dev.directives.model.StepFunction;
import dev.directives.model.WorkflowFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What the classification pass learned about one module. Functions are keyed by node identity, so the
 * rewrite pass can look up the exact nodes it walks.
 *
 * @param moduleDirective      honored module-level directive, or null
 * @param moduleDirectives     the module-level directive statements to remove
 * @param refs                 how generated code reaches each classified function
 * @param stepOrder            steps in registration order: nested steps before the function that holds them
 * @param insideStep           classified functions nested inside an accepted step
 * @param insideWorkflow       classified functions nested inside an accepted workflow
 * @param defaultBinding       binding synthesized for an anonymous default export, or null
 * @param declaredNames        every identifier the module mentions; generated names avoid all of them
 */
public record ModuleFacts(
    Directive moduleDirective,
    List<Statement> moduleDirectives,
    Map<FunctionNode, StepFunction> steps,
    Map<FunctionNode, WorkflowFunction> workflows,
    Map<FunctionNode, FunctionRef> refs,
    List<FunctionNode> stepOrder,
    List<FunctionNode> workflowOrder,
    Set<FunctionNode> insideStep,
    Set<FunctionNode> insideWorkflow,
    List<ClassSerializationEntry> classes,
    String defaultBinding,
    Set<String> declaredNames,
    List<Diagnostic> diagnostics
) {

    public ModuleFacts {
        // Identity-keyed: wrap, never copy.
        moduleDirectives = Collections.unmodifiableList(moduleDirectives);
        steps = Collections.unmodifiableMap(steps);
        workflows = Collections.unmodifiableMap(workflows);
        refs = Collections.unmodifiableMap(refs);
        stepOrder = Collections.unmodifiableList(stepOrder);
        workflowOrder = Collections.unmodifiableList(workflowOrder);
        insideStep = Collections.unmodifiableSet(insideStep);
        insideWorkflow = Collections.unmodifiableSet(insideWorkflow);
        classes = List.copyOf(classes);
        declaredNames = Set.copyOf(declaredNames);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isStep(FunctionNode function) {
        return steps.containsKey(function);
    }

    public boolean isWorkflow(FunctionNode function) {
        return workflows.containsKey(function);
    }

    public boolean isClassified(FunctionNode function) {
        return isStep(function) || isWorkflow(function);
    }

    public StepFunction step(FunctionNode function) {
        return steps.get(function);
    }

    public WorkflowFunction workflow(FunctionNode function) {
        return workflows.get(function);
    }

    public FunctionRef ref(FunctionNode function) {
        return refs.get(function);
    }

    public boolean isModuleDirective(Statement statement) {
        for (Statement directive : moduleDirectives) {
            if (directive == statement) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the function survives the rewrite for {@code mode}. Workflow output drops whatever sits
     * inside a step (the step becomes a proxy); client output drops whatever sits inside a workflow
     * (the workflow becomes a stub).
     */
    public boolean isLive(FunctionNode function, CompilationMode mode) {
        return switch (mode) {
            case STEP -> true;
            case WORKFLOW -> !insideStep.contains(function);
            case CLIENT -> !insideWorkflow.contains(function);
        };
    }

    public List<FunctionNode> liveSteps(CompilationMode mode) {
        var live = new ArrayList<FunctionNode>();
        for (FunctionNode function : stepOrder) {
            if (isLive(function, mode)) {
                live.add(function);
            }
        }
        return live;
    }

    public List<FunctionNode> liveWorkflows(CompilationMode mode) {
        var live = new ArrayList<FunctionNode>();
        for (FunctionNode function : workflowOrder) {
            if (isLive(function, mode)) {
                live.add(function);
            }
        }
        return live;
    }

    public boolean isEmpty() {
        return steps.isEmpty() && workflows.isEmpty() && classes.isEmpty();
    }
}
