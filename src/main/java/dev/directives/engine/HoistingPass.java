package dev.directives.engine;

import dev.directives.ast.FunctionNode;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.ImportDeclaration;
import dev.directives.model.CompilationMode;
import dev.directives.model.StepFunction;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Assembles the final module body around the rewritten statements: runtime imports first, then the
 * module's own imports, then hoisted step bodies, then the module, then registrations.
 */
final class HoistingPass {

    private HoistingPass() {}

    static List<Statement> apply(ModuleRewriter.Result rewritten, ModuleFacts facts, CompilationMode mode) {
        List<Statement> stepRegistrations = new ArrayList<>();
        boolean closureVariables = false;
        if (mode == CompilationMode.STEP) {
            for (FunctionNode function : facts.liveSteps(mode)) {
                StepFunction step = facts.step(function);
                stepRegistrations.add(RuntimeContract.registerStep(step.id(), facts.ref(function)));
                closureVariables |= step.isNested() && step.hasClosure();
            }
        }
        List<Statement> classRegistrations = ClassSerializationRegistrar.registrations(facts.classes());

        var out = new ArrayList<Statement>();
        var privateImports = new TreeSet<String>();
        if (!stepRegistrations.isEmpty()) {
            privateImports.add(RuntimeContract.REGISTER_STEP);
        }
        if (closureVariables) {
            privateImports.add(RuntimeContract.GET_CLOSURE_VARS);
        }
        if (!privateImports.isEmpty()) {
            out.add(RuntimeContract.namedImport(RuntimeContract.PRIVATE_MODULE, List.copyOf(privateImports)));
        }
        if (!classRegistrations.isEmpty()) {
            out.add(RuntimeContract.namedImport(RuntimeContract.CLASS_SERIALIZATION_MODULE,
                List.of(RuntimeContract.REGISTER_CLASS)));
        }

        List<Statement> body = rewritten.body();
        int imports = leadingImports(body);
        out.addAll(body.subList(0, imports));
        out.addAll(rewritten.hoisted());
        out.addAll(body.subList(imports, body.size()));
        out.addAll(stepRegistrations);
        out.addAll(classRegistrations);
        return out;
    }

    /** Length of the run of import declarations at the head of the body. */
    static int leadingImports(List<Statement> body) {
        int count = 0;
        while (count < body.size() && body.get(count) instanceof ImportDeclaration) {
            count++;
        }
        return count;
    }
}
