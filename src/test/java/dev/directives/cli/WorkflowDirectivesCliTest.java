package dev.directives.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowDirectivesCliTest {

    private static final String JOBS = """
        export async function add(a, b) {
            "use step";
            return a + b;
        }
        """;

    @TempDir
    Path root;

    private Path input;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() throws IOException {
        input = root.resolve("src/jobs.js");
        Files.createDirectories(input.getParent());
        Files.writeString(input, JOBS);
    }

    private int run(String... args) {
        var commandLine = new CommandLine(new WorkflowDirectivesCli());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void printsTransformedCode() {
        int exitCode = run("--mode", "workflow", "--project-root", root.toString(), input.toString());

        assertThat(exitCode).isEqualTo(WorkflowDirectivesCli.EXIT_OK);
        assertThat(out.toString())
            .contains("export var add = globalThis[Symbol.for(\"WORKFLOW_USE_STEP\")](\"step//./src/jobs//add\");");
    }

    @Test
    void defaultsToStepMode() {
        run("--project-root", root.toString(), input.toString());

        assertThat(out.toString()).contains("registerStepFunction(\"step//./src/jobs//add\", add);");
    }

    @Test
    void explicitFilenameOverridesPath() {
        run("--filename", "lib/math.ts", "--project-root", root.toString(), input.toString());

        assertThat(out.toString()).contains("step//./lib/math//add");
    }

    @Test
    void checkOnlyReportsDiagnostics() throws IOException {
        Files.writeString(input, """
            export function add(a, b) {
                "use step";
                return a + b;
            }
            """);

        int exitCode = run("--check", "--project-root", root.toString(), input.toString());

        assertThat(exitCode).isEqualTo(WorkflowDirectivesCli.EXIT_DIAGNOSTICS);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("src/jobs.js:").contains("error[WF001]");
    }

    @Test
    void reportsEachDiagnosticOnce() throws IOException {
        Files.writeString(input, """
            export function add(a, b) {
                "use step";
                return a + b;
            }
            """);
        Logger logger = (Logger) LoggerFactory.getLogger(WorkflowDirectivesCli.class);
        Level old = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            run("--check", "--project-root", root.toString(), input.toString());
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(old);
        }

        assertThat(err.toString().split("error\\[WF001]", -1)).hasSize(2);
        assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
            .noneMatch(message -> message.contains("WF001"));
    }

    @Test
    void writesManifest() throws IOException {
        Path manifest = root.resolve("out/manifest.json");

        int exitCode = run("--manifest", manifest.toString(), "--project-root", root.toString(), input.toString());

        assertThat(exitCode).isEqualTo(WorkflowDirectivesCli.EXIT_OK);
        JsonNode json = new ObjectMapper().readTree(manifest.toFile());
        assertThat(json.path("steps").path("src/jobs.js").path("add").path("stepId").asText())
            .isEqualTo("step//./src/jobs//add");
    }

    @Test
    void readsConfigFileAndLetsOptionsOverride() throws IOException {
        Path config = root.resolve("transform.json");
        Files.writeString(config, """
            {"mode": "workflow", "filename": "src/jobs.js", "moduleSpecifier": "jobs@2.0.0"}
            """);

        run("--config", config.toString(), "--mode", "client", input.toString());

        assertThat(out.toString()).contains("\"step//jobs@2.0.0//add\"").doesNotContain("WORKFLOW_USE_STEP");
    }

    @Test
    void resolvesSpecifierForWorkspacePackages() throws IOException {
        Files.writeString(root.resolve("package.json"), "{\"name\": \"app\", \"version\": \"1.0.0\"}");
        Path pkg = root.resolve("packages/shared");
        Files.createDirectories(pkg.resolve("src"));
        Files.writeString(pkg.resolve("package.json"), "{\"name\": \"shared\", \"version\": \"0.3.0\"}");
        Path file = pkg.resolve("src/steps.js");
        Files.writeString(file, JOBS);

        run("--project-root", root.toString(), file.toString());

        assertThat(out.toString()).contains("registerStepFunction(\"step//shared@0.3.0//add\", add);");
    }

    @Test
    void failsOnMissingInput() {
        int exitCode = run("--project-root", root.toString(), root.resolve("missing.js").toString());

        assertThat(exitCode).isEqualTo(WorkflowDirectivesCli.EXIT_FAILURE);
        assertThat(err.toString()).startsWith("Error:");
    }

    @Test
    void failsOnSyntaxErrors() throws IOException {
        Files.writeString(input, "const = 1;");

        int exitCode = run("--project-root", root.toString(), input.toString());

        assertThat(exitCode).isEqualTo(WorkflowDirectivesCli.EXIT_FAILURE);
        assertThat(err.toString()).contains("Syntax error in");
    }

    @Test
    void failsOnUnknownMode() {
        int exitCode = run("--mode", "server", "--project-root", root.toString(), input.toString());

        assertThat(exitCode).isEqualTo(WorkflowDirectivesCli.EXIT_FAILURE);
        assertThat(err.toString()).contains("Unknown compilation mode 'server'");
    }
}
