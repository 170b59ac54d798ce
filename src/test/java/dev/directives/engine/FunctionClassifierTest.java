package dev.directives.engine;

import dev.directives.model.CompilationMode;
import dev.directives.model.DiagnosticKind;
import dev.directives.model.FunctionShape;
import dev.directives.model.Placement;
import dev.directives.model.StepFunction;
import dev.directives.model.TransformConfig;
import dev.directives.model.WorkflowFunction;
import dev.directives.syntax.Parser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FunctionClassifierTest {

    private static final TransformConfig CONFIG = TransformConfig.of(CompilationMode.STEP, "src/jobs.js");

    private static ModuleFacts classify(String source) {
        return FunctionClassifier.classify(Parser.parse(source), CONFIG);
    }

    @Test
    void classifiesTopLevelStepsAndWorkflows() {
        ModuleFacts facts = classify("""
            export async function charge(amount) {
                "use step";
                return amount;
            }
            export const checkout = async (cart) => {
                "use workflow";
                return charge(cart.total);
            };
            """);

        assertThat(facts.steps().values()).singleElement().satisfies(step -> {
            assertThat(step.qualifiedName()).isEqualTo("charge");
            assertThat(step.id()).isEqualTo("step//./src/jobs//charge");
            assertThat(step.placement()).isEqualTo(Placement.TOP_LEVEL);
            assertThat(step.shape()).isEqualTo(FunctionShape.DECLARATION);
        });
        assertThat(facts.workflows().values()).singleElement().satisfies(workflow -> {
            assertThat(workflow.exportKey()).isEqualTo("checkout");
            assertThat(workflow.id()).isEqualTo("workflow//./src/jobs//checkout");
            assertThat(workflow.shape()).isEqualTo(FunctionShape.ARROW);
        });
        assertThat(facts.diagnostics()).isEmpty();
    }

    @Test
    void namesNestedStepsByEnclosingChain() {
        ModuleFacts facts = classify("""
            export async function run(items) {
                "use workflow";
                const multiplier = 2;
                const scale = async (x) => {
                    "use step";
                    return x * multiplier;
                };
                return scale(items);
            }
            """);

        StepFunction step = facts.steps().values().iterator().next();
        assertThat(step.qualifiedName()).isEqualTo("run/scale");
        assertThat(step.id()).isEqualTo("step//./src/jobs//run/scale");
        assertThat(step.placement()).isEqualTo(Placement.NESTED);
        assertThat(step.closureVariables()).containsExactly("multiplier");
        assertThat(step.enclosingWorkflow()).isEqualTo("run");
        assertThat(facts.refs().values()).contains(new FunctionRef.Binding("run$scale"));
    }

    @Test
    void namesObjectPropertyStepsByKeyPath() {
        ModuleFacts facts = classify("""
            export async function run() {
                "use workflow";
                const tools = {
                    fetch: {
                        user: async (id) => {
                            "use step";
                            return id;
                        }
                    }
                };
                return tools.fetch.user(1);
            }
            """);

        StepFunction step = facts.steps().values().iterator().next();
        assertThat(step.qualifiedName()).isEqualTo("run/tools/fetch/user");
        assertThat(step.shape()).isEqualTo(FunctionShape.OBJECT_PROPERTY);
    }

    @Test
    void numbersAnonymousSteps() {
        ModuleFacts facts = classify("""
            export async function run(list) {
                "use workflow";
                await Promise.all(list.map(async (x) => {
                    "use step";
                    return x;
                }));
            }
            """);

        assertThat(facts.steps().values()).extracting(StepFunction::qualifiedName)
            .containsExactly("run/_anonymousStep0");
    }

    @Test
    void classifiesStaticAndInstanceMethods() {
        ModuleFacts facts = classify("""
            export class Account {
                static async open(owner) {
                    "use workflow";
                    return owner;
                }
                async refresh() {
                    "use step";
                    return 1;
                }
            }
            """);

        WorkflowFunction workflow = facts.workflows().values().iterator().next();
        assertThat(workflow.qualifiedName()).isEqualTo("Account.open");
        assertThat(workflow.binding()).isEqualTo("Account.open");
        StepFunction step = facts.steps().values().iterator().next();
        assertThat(step.qualifiedName()).isEqualTo("Account#refresh");
        assertThat(step.placement()).isEqualTo(Placement.INSTANCE_METHOD);
        assertThat(facts.classes()).singleElement().satisfies(entry -> {
            assertThat(entry.className()).isEqualTo("Account");
            assertThat(entry.ownsStepMethods()).isTrue();
            assertThat(entry.customSerialization()).isFalse();
        });
    }

    @Test
    void stepsInsideStepsAreTracked() {
        ModuleFacts facts = classify("""
            export async function outer() {
                "use step";
                const inner = async () => {
                    "use step";
                    return 1;
                };
                return inner();
            }
            """);

        assertThat(facts.stepOrder()).hasSize(2);
        assertThat(facts.step(facts.stepOrder().get(0)).qualifiedName()).isEqualTo("outer/inner");
        assertThat(facts.liveSteps(CompilationMode.WORKFLOW)).hasSize(1);
        assertThat(facts.liveSteps(CompilationMode.STEP)).hasSize(2);
    }

    @Test
    void reportsNonAsyncFunctions() {
        ModuleFacts facts = classify("""
            export function sync() {
                "use step";
            }
            """);

        assertThat(facts.steps()).isEmpty();
        assertThat(facts.diagnostics()).extracting(d -> d.kind()).containsExactly(DiagnosticKind.NON_ASYNC_FUNCTION);
    }

    @Test
    void reportsThisInsideWorkflow() {
        ModuleFacts facts = classify("""
            export async function run() {
                "use workflow";
                return this.value;
            }
            """);

        assertThat(facts.workflows()).isEmpty();
        assertThat(facts.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.FORBIDDEN_EXPRESSION);
            assertThat(d.message()).startsWith("`this` is not allowed in workflow functions");
        });
    }

    @Test
    void thisInsideNestedRegularFunctionIsAllowed() {
        ModuleFacts facts = classify("""
            export async function run() {
                "use workflow";
                const o = { read() { return this.x; } };
                return o.read();
            }
            """);

        assertThat(facts.workflows()).hasSize(1);
        assertThat(facts.diagnostics()).isEmpty();
    }

    @Test
    void reportsMisplacedWorkflows() {
        ModuleFacts facts = classify("""
            export async function outer() {
                const inner = async () => {
                    "use workflow";
                };
            }
            export class Job {
                async run() {
                    "use workflow";
                }
            }
            """);

        assertThat(facts.workflows()).isEmpty();
        assertThat(facts.diagnostics()).extracting(d -> d.kind())
            .containsExactly(DiagnosticKind.MISPLACED_DIRECTIVE, DiagnosticKind.MISPLACED_DIRECTIVE);
    }

    @Test
    void moduleDirectiveMarksExportedFunctions() {
        ModuleFacts facts = classify("""
            "use step";
            export async function a() {
                return 1;
            }
            export const b = 1;
            """);

        assertThat(facts.steps().values()).extracting(StepFunction::qualifiedName).containsExactly("a");
        assertThat(facts.moduleDirectives()).hasSize(1);
        assertThat(facts.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.INVALID_EXPORT);
            assertThat(d.message()).contains("Export 'b' is not an async function");
        });
    }

    @Test
    void anonymousDefaultExportGetsSynthesizedBinding() {
        ModuleFacts facts = classify("""
            export default async function () {
                "use workflow";
                return 1;
            }
            """);

        assertThat(facts.defaultBinding()).isEqualTo("__default");
        WorkflowFunction workflow = facts.workflows().values().iterator().next();
        assertThat(workflow.exportKey()).isEqualTo("default");
        assertThat(workflow.id()).isEqualTo("workflow//./src/jobs//default");
    }

    @Test
    void exportSpecifierRenamesExportKey() {
        ModuleFacts facts = classify("""
            async function internalName() {
                "use workflow";
            }
            export { internalName as publicName };
            """);

        assertThat(facts.workflows().values()).extracting(WorkflowFunction::exportKey).containsExactly("publicName");
    }
}
