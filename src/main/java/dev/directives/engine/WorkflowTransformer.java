package dev.directives.engine;

import dev.directives.ast.Program;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.ImportDeclaration;
import dev.directives.model.ClassSerializationEntry;
import dev.directives.model.CollectingDiagnosticSink;
import dev.directives.model.CompilationMode;
import dev.directives.model.DiagnosticSink;
import dev.directives.model.ModuleManifest;
import dev.directives.model.TransformConfig;
import dev.directives.model.TransformResult;
import dev.directives.syntax.Parser;
import dev.directives.syntax.SourcePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point of the transform: classification, rewrite, hoisting and registration, dead-code
 * elimination (workflow and client modes) and metadata emission, in that order.
 *
 * <p>Each call works on its own state, so modules can be transformed concurrently as long as no
 * two calls share a {@link Program}.
 */
public final class WorkflowTransformer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowTransformer.class);

    private WorkflowTransformer() {}

    /** Printed output of {@link #transformSource}. */
    public record TransformedSource(String code, TransformResult result) {}

    public static TransformResult transform(Program program, TransformConfig config) {
        return transform(program, config, new CollectingDiagnosticSink());
    }

    /**
     * Rewrites {@code program} in place for {@code config.mode()}. Diagnostics go to {@code sink} as
     * well as into the result.
     */
    public static TransformResult transform(Program program, TransformConfig config, DiagnosticSink sink) {
        CompilationMode mode = config.mode();
        ModuleFacts facts = FunctionClassifier.classify(program, config);
        facts.diagnostics().forEach(sink::report);

        ModuleRewriter.Result rewritten = new ModuleRewriter(facts, mode).rewrite(program.body());
        List<Statement> body = HoistingPass.apply(rewritten, facts, mode);
        log.debug("Hoisted {} step bod(ies) in {}", rewritten.hoisted().size(), config.normalizedFilename());

        if (mode.eliminatesDeadCode() && !facts.isEmpty()) {
            body = DeadCodeEliminator.eliminate(body, trackedNames(facts));
        }
        ModuleManifest manifest = MetadataEmitter.manifest(facts, config.normalizedFilename(), mode);
        body = MetadataEmitter.insert(body, manifest);

        program.replaceBody(body);
        if (!program.isModule() && (!facts.isEmpty() || body.stream().anyMatch(s -> s instanceof ImportDeclaration))) {
            program.upgradeToModule();
        }
        return new TransformResult(program, facts.diagnostics(), manifest);
    }

    /** Parses {@code source}, transforms it and prints the result. */
    public static TransformedSource transformSource(String source, TransformConfig config) {
        Program program = Parser.parse(source);
        TransformResult result = transform(program, config);
        return new TransformedSource(SourcePrinter.print(result.program()), result);
    }

    /** Names dead-code elimination must keep even when nothing references them. */
    static Set<String> trackedNames(ModuleFacts facts) {
        var names = new HashSet<String>();
        facts.refs().values().forEach(ref -> {
            if (ref instanceof FunctionRef.Binding binding) {
                names.add(binding.name());
            }
        });
        for (ClassSerializationEntry entry : facts.classes()) {
            names.add(entry.className());
        }
        if (facts.defaultBinding() != null) {
            names.add(facts.defaultBinding());
        }
        return names;
    }
}
