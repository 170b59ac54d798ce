package dev.directives.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.directives.engine.MetadataEmitter;
import dev.directives.engine.ModuleSpecifierResolver;
import dev.directives.engine.TransformConfigLoader;
import dev.directives.engine.WorkflowTransformer;
import dev.directives.model.CompilationMode;
import dev.directives.model.Diagnostic;
import dev.directives.model.ModuleManifest;
import dev.directives.model.TransformConfig;
import dev.directives.model.TransformResult;
import dev.directives.syntax.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Transforms one source file for a compilation mode and prints the result.
 *
 * <p>Exit codes: 0 on success, 1 when the input or config cannot be read or parsed, 2 when the
 * transform reported diagnostics.
 */
@Command(
    name = "workflow-directives",
    mixinStandardHelpOptions = true,
    description = "Rewrite \"use step\" / \"use workflow\" functions for the step, workflow or client bundle."
)
public class WorkflowDirectivesCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_DIAGNOSTICS = 2;

    private static final Logger log = LoggerFactory.getLogger(WorkflowDirectivesCli.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source file to transform")
    private Path input;

    @Option(names = "--mode", description = "Compilation mode: step, workflow, client (default: step)")
    private String mode;

    @Option(names = "--filename",
        description = "Project-relative filename used in ids and metadata (default: input path relative to the project root)")
    private String filename;

    @Option(names = "--module-specifier", description = "Package specifier (name@version) overriding the path in ids")
    private String moduleSpecifier;

    @Option(names = "--project-root", description = "Project root (default: current directory)")
    private Path projectRoot;

    @Option(names = "--config", description = "JSON file with mode, filename and moduleSpecifier")
    private Path config;

    @Option(names = "--manifest", description = "Write the module's id manifest to this JSON file")
    private Path manifest;

    @Option(names = "--check", description = "Only report diagnostics, do not print the transformed code")
    private boolean check;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        WorkflowTransformer.TransformedSource transformed;
        try {
            TransformConfig transformConfig = resolveConfig();
            String source = Files.readString(input, StandardCharsets.UTF_8);
            transformed = WorkflowTransformer.transformSource(source, transformConfig);
            TransformResult result = transformed.result();
            log.info("Transformed {} for {}: {} workflow(s), {} step(s), {} class(es), {} diagnostic(s)",
                transformConfig.normalizedFilename(), transformConfig.mode().name().toLowerCase(Locale.ROOT),
                result.manifest().workflowCount(), result.manifest().stepCount(), result.manifest().classCount(),
                result.diagnostics().size());
            if (manifest != null) {
                writeManifest(result.manifest());
            }
            for (Diagnostic diagnostic : result.diagnostics()) {
                err.println(diagnostic.render(transformConfig.normalizedFilename()));
            }
            if (!check) {
                out.print(transformed.code());
                out.flush();
            }
            return result.hasDiagnostics() ? EXIT_DIAGNOSTICS : EXIT_OK;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (ParseException e) {
            err.println("Syntax error in " + input + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /** Config file first, then explicit options on top, then defaults. */
    TransformConfig resolveConfig() throws IOException {
        Path root = projectRoot != null ? projectRoot : Path.of("").toAbsolutePath();
        TransformConfig base = config != null ? TransformConfigLoader.loadFromFile(config) : null;

        CompilationMode resolvedMode = mode != null ? CompilationMode.parse(mode)
            : base != null ? base.mode() : CompilationMode.STEP;
        String resolvedFilename = filename != null ? filename
            : base != null ? base.filename() : defaultFilename(root);
        String resolvedSpecifier = moduleSpecifier != null ? moduleSpecifier
            : base != null && base.moduleSpecifier() != null ? base.moduleSpecifier()
            : new ModuleSpecifierResolver(root).resolve(input).orElse(null);
        return new TransformConfig(resolvedMode, resolvedFilename, resolvedSpecifier);
    }

    private String defaultFilename(Path root) {
        Path absolute = input.toAbsolutePath().normalize();
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(normalizedRoot) ? normalizedRoot.relativize(absolute) : input.getFileName();
        return relative.toString().replace('\\', '/');
    }

    private void writeManifest(ModuleManifest moduleManifest) throws IOException {
        Path parent = manifest.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(manifest.toFile(), MetadataEmitter.toJsonTree(moduleManifest));
        log.debug("Wrote manifest to {}", manifest);
    }
}
