package dev.directives.engine;

import dev.directives.model.CollectingDiagnosticSink;
import dev.directives.model.CompilationMode;
import dev.directives.model.DiagnosticKind;
import dev.directives.model.TransformConfig;
import dev.directives.syntax.Parser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowTransformerTest {

    private static final String JOBS = """
        export async function add(a, b) {
            "use step";
            return a + b;
        }
        export async function run(x) {
            "use workflow";
            return await add(x, 1);
        }
        """;

    private static final String JOBS_METADATA = "/**__internal_workflows"
        + "{\"workflows\":{\"src/jobs.js\":{\"run\":{\"workflowId\":\"workflow//./src/jobs//run\"}}},"
        + "\"steps\":{\"src/jobs.js\":{\"add\":{\"stepId\":\"step//./src/jobs//add\"}}}}*/;\n";

    private static WorkflowTransformer.TransformedSource transform(String source, CompilationMode mode) {
        return WorkflowTransformer.transformSource(source, TransformConfig.of(mode, "src/jobs.js"));
    }

    @Test
    void stepModeRegistersStepsAndStubsWorkflows() {
        var out = transform(JOBS, CompilationMode.STEP);

        assertThat(out.code()).isEqualTo("import { registerStepFunction } from \"workflow/internal/private\";\n"
            + JOBS_METADATA + """
            export async function add(a, b) {
                return a + b;
            }
            export async function run(x) {
                throw new Error("You attempted to execute workflow run function directly. \
            To start a workflow, use start(run) from workflow/api");
            }
            run.workflowId = "workflow//./src/jobs//run";
            registerStepFunction("step//./src/jobs//add", add);
            """);
        assertThat(out.result().diagnostics()).isEmpty();
    }

    @Test
    void workflowModeProxiesStepsAndRegistersWorkflows() {
        var out = transform(JOBS, CompilationMode.WORKFLOW);

        assertThat(out.code()).isEqualTo(JOBS_METADATA + """
            export var add = globalThis[Symbol.for("WORKFLOW_USE_STEP")]("step//./src/jobs//add");
            export async function run(x) {
                return await add(x, 1);
            }
            run.workflowId = "workflow//./src/jobs//run";
            globalThis.__private_workflows.set("workflow//./src/jobs//run", run);
            """);
    }

    @Test
    void clientModeKeepsStepBodiesAndStubsWorkflows() {
        var out = transform(JOBS, CompilationMode.CLIENT);

        assertThat(out.code()).isEqualTo(JOBS_METADATA + """
            export async function add(a, b) {
                return a + b;
            }
            export async function run(x) {
                throw new Error("You attempted to execute workflow run function directly. \
            To start a workflow, use start(run) from workflow/api");
            }
            run.workflowId = "workflow//./src/jobs//run";
            """);
    }

    @Test
    void hoistsNestedStepsWithClosureVariablesInStepMode() {
        String source = """
            export async function run(items) {
                "use workflow";
                const multiplier = 2;
                const scale = async (x) => {
                    "use step";
                    return x * multiplier;
                };
                return scale(items);
            }
            """;

        String code = transform(source, CompilationMode.STEP).code();

        assertThat(code).startsWith(
            "import { __private_getClosureVars, registerStepFunction } from \"workflow/internal/private\";\n");
        assertThat(code).contains("""
            var run$scale = async (x) => {
                const { multiplier } = __private_getClosureVars();
                return x * multiplier;
            };
            """);
        assertThat(code).contains("registerStepFunction(\"step//./src/jobs//run/scale\", run$scale);");
        assertThat(code.indexOf("var run$scale")).isLessThan(code.indexOf("export async function run"));
    }

    @Test
    void proxiesNestedStepsWithCaptureThunkInWorkflowMode() {
        String source = """
            export async function run(items) {
                "use workflow";
                const multiplier = 2;
                const scale = async (x) => {
                    "use step";
                    return x * multiplier;
                };
                return scale(items);
            }
            """;

        String code = transform(source, CompilationMode.WORKFLOW).code();

        assertThat(code).contains("const scale = globalThis[Symbol.for(\"WORKFLOW_USE_STEP\")]"
            + "(\"step//./src/jobs//run/scale\", () => ({ multiplier }));");
        assertThat(code).doesNotContain("registerStepFunction").doesNotContain("use step");
    }

    @Test
    void workflowModeDropsStepsNestedInSteps() {
        String source = """
            export async function outer() {
                "use step";
                const inner = async () => {
                    "use step";
                    return 1;
                };
                return inner();
            }
            """;

        var out = transform(source, CompilationMode.WORKFLOW);

        assertThat(out.code()).doesNotContain("outer/inner");
        assertThat(out.result().manifest().stepCount()).isEqualTo(1);
    }

    @Test
    void staticStepMethodsBecomeProxiesAfterTheClass() {
        String source = """
            export class Counter {
                static async bump(n) {
                    "use step";
                    return n + 1;
                }
            }
            """;

        String workflow = transform(source, CompilationMode.WORKFLOW).code();
        String step = transform(source, CompilationMode.STEP).code();

        assertThat(workflow).contains("""
            export class Counter {}
            Counter.bump = globalThis[Symbol.for("WORKFLOW_USE_STEP")]("step//./src/jobs//Counter.bump");
            """);
        assertThat(workflow).contains("registerSerializationClass(\"class//./src/jobs//Counter\", Counter);");
        assertThat(step).contains("registerStepFunction(\"step//./src/jobs//Counter.bump\", Counter.bump);");
        assertThat(step.indexOf("registerStepFunction(")).isLessThan(step.indexOf("registerSerializationClass("));
    }

    @Test
    void instanceStepMethodsAreReachedThroughThePrototype() {
        String source = """
            export class Account {
                async refresh() {
                    "use step";
                    return 1;
                }
            }
            """;

        String code = transform(source, CompilationMode.WORKFLOW).code();

        assertThat(code).contains("Account.prototype[\"refresh\"] = globalThis[Symbol.for(\"WORKFLOW_USE_STEP\")]"
            + "(\"step//./src/jobs//Account#refresh\");");
    }

    @Test
    void anonymousDefaultWorkflowIsNamed() {
        String source = """
            export default async function () {
                "use workflow";
                return 1;
            }
            """;

        String code = transform(source, CompilationMode.WORKFLOW).code();

        assertThat(code).contains("export default async function __default() {\n    return 1;\n}\n");
        assertThat(code).contains("__default.workflowId = \"workflow//./src/jobs//default\";");
        assertThat(code).contains("\"workflows\":{\"src/jobs.js\":{\"default\"");
    }

    @Test
    void clientModeRemovesCodeOnlyWorkflowsUsed() {
        String source = """
            import { format } from "./format";
            import "./polyfill";
            function describe(order) {
                return format(order);
            }
            export async function process(order) {
                "use workflow";
                return describe(order);
            }
            """;

        String code = transform(source, CompilationMode.CLIENT).code();

        assertThat(code).doesNotContain("describe").doesNotContain("./format");
        assertThat(code).contains("import \"./polyfill\";");
    }

    @Test
    void workflowModeDropsSetupOnlyStepsUsed() {
        String source = """
            import { connect } from "db";
            const client = connect();
            export async function save(row) {
                "use step";
                return client.insert(row);
            }
            """;

        String workflow = transform(source, CompilationMode.WORKFLOW).code();
        String step = transform(source, CompilationMode.STEP).code();

        assertThat(workflow).doesNotContain("connect").doesNotContain("client");
        assertThat(step).contains("import { connect } from \"db\";").contains("const client = connect();");
    }

    @Test
    void stepModeKeepsUnreferencedCode() {
        String source = """
            function unused() {
                return 1;
            }
            export async function task() {
                "use step";
            }
            """;

        assertThat(transform(source, CompilationMode.STEP).code()).contains("function unused()");
    }

    @Test
    void modulesWithoutDirectivesPassThrough() {
        String source = """
            const value = 1;
            function helper() {
                return value;
            }
            """;

        var out = transform(source, CompilationMode.WORKFLOW);

        assertThat(out.code()).isEqualTo(source);
        assertThat(out.result().manifest().isEmpty()).isTrue();
        assertThat(out.result().program().isModule()).isFalse();
    }

    @Test
    void moduleDirectiveIsRemovedFromOutput() {
        String source = """
            "use step";
            export async function a() {
                return 1;
            }
            """;

        String code = transform(source, CompilationMode.STEP).code();

        assertThat(code).doesNotContain("\"use step\"");
        assertThat(code).contains("registerStepFunction(\"step//./src/jobs//a\", a);");
    }

    @Test
    void diagnosticsReachTheSinkAndLeaveFunctionsUntouched() {
        var program = Parser.parse("""
            export function notAsync() {
                "use step";
                return 1;
            }
            """);
        var sink = new CollectingDiagnosticSink();

        var result = WorkflowTransformer.transform(program, TransformConfig.of(CompilationMode.STEP, "src/jobs.js"), sink);

        assertThat(sink.has(DiagnosticKind.NON_ASYNC_FUNCTION)).isTrue();
        assertThat(result.hasDiagnostics()).isTrue();
        assertThat(result.manifest().isEmpty()).isTrue();
    }

    @Test
    void moduleSpecifierFeedsIdentities() {
        var config = new TransformConfig(CompilationMode.STEP, "node_modules/lib/index.js", "lib@1.0.0");

        String code = WorkflowTransformer.transformSource(JOBS, config).code();

        assertThat(code).contains("registerStepFunction(\"step//lib@1.0.0//add\", add);");
        assertThat(code).contains("\"node_modules/lib/index.js\"");
    }

    @Test
    void capturesAssignedByTheStepAreDeclaredWithLet() {
        String source = """
            export async function run(items) {
                "use workflow";
                let total = 0;
                const add = async (n) => {
                    "use step";
                    total = total + n;
                    return total;
                };
                return add(items);
            }
            """;

        String code = transform(source, CompilationMode.STEP).code();

        assertThat(code).contains("""
            var run$add = async (n) => {
                let { total } = __private_getClosureVars();
                total = total + n;
                return total;
            };
            """);
        assertThat(code).doesNotContain("const { total }");
    }

    @Test
    void stubbedWorkflowStillRegistersItsNestedSteps() {
        String source = """
            export async function run(id) {
                "use workflow";
                const load = async () => {
                    "use step";
                    return id;
                };
                return load();
            }
            """;

        String code = transform(source, CompilationMode.STEP).code();

        assertThat(code).contains("To start a workflow, use start(run) from workflow/api");
        assertThat(code).contains("registerStepFunction(\"step//./src/jobs//run/load\", run$load);");
        assertThat(code.split("var run\\$load = ", -1)).hasSize(2);
    }

    @Test
    void anonymousDefaultWorkflowStubNamesTheExport() {
        String source = """
            export default async function () {
                "use workflow";
                return 1;
            }
            """;

        String code = transform(source, CompilationMode.STEP).code();

        assertThat(code).contains("You attempted to execute workflow default function directly. "
            + "To start a workflow, use start(default) from workflow/api");
        assertThat(code).doesNotContain("start(__default");
    }

    @Test
    void stepMethodAndHookPairRegisterBothTheMethodAndTheClass() {
        String source = """
            export class Account {
                static [Symbol.for("workflow-serialize")](account) {
                    return { id: account.id };
                }
                static [Symbol.for("workflow-deserialize")](data) {
                    return new Account(data.id);
                }
                async refresh() {
                    "use step";
                    return 1;
                }
            }
            """;

        var out = transform(source, CompilationMode.STEP);

        assertThat(out.code()).contains("registerStepFunction(\"step//./src/jobs//Account#refresh\", ");
        assertThat(out.code().split("registerSerializationClass\\(\"class//./src/jobs//Account\", Account\\);", -1))
            .hasSize(2);
        assertThat(out.code().indexOf("registerStepFunction("))
            .isLessThan(out.code().indexOf("registerSerializationClass("));
        assertThat(out.result().manifest().classCount()).isEqualTo(1);
    }

    private static final String LOWERED_USING = """
        export async function sync() {
            const env = { stack: [], error: undefined, hasError: false };
            try {
                "use workflow";
                return 1;
            } catch (e) {
                env.error = e;
                env.hasError = true;
            } finally {
                dispose(env);
            }
        }
        """;

    @Test
    void loweredUsingWorkflowIsRegisteredInWorkflowMode() {
        String code = transform(LOWERED_USING, CompilationMode.WORKFLOW).code();

        assertThat(code).doesNotContain("\"use workflow\"");
        assertThat(code).contains("    try {\n        return 1;\n    }");
        assertThat(code).contains("globalThis.__private_workflows.set(\"workflow//./src/jobs//sync\", sync);");
    }

    @Test
    void loweredUsingWorkflowIsStubbedInStepAndClientModes() {
        for (CompilationMode mode : new CompilationMode[] {CompilationMode.STEP, CompilationMode.CLIENT}) {
            String code = transform(LOWERED_USING, mode).code();

            assertThat(code).doesNotContain("\"use workflow\"").doesNotContain("dispose(env)");
            assertThat(code).contains("You attempted to execute workflow sync function directly.");
            assertThat(code).contains("sync.workflowId = \"workflow//./src/jobs//sync\";");
        }
    }

    @Test
    void misspelledDirectiveIsNeverRegisteredInAnyMode() {
        String source = """
            export async function good() {
                "use step";
                return 1;
            }
            export async function typo() {
                "use steps";
                return 2;
            }
            """;

        for (CompilationMode mode : CompilationMode.values()) {
            var out = transform(source, mode);

            assertThat(out.code()).doesNotContain("step//./src/jobs//typo").contains("export async function typo()");
            assertThat(out.result().manifest().stepCount()).isEqualTo(1);
            assertThat(out.result().diagnostics())
                .anyMatch(diagnostic -> diagnostic.kind() == DiagnosticKind.MISSPELLED_DIRECTIVE);
        }
    }
}
