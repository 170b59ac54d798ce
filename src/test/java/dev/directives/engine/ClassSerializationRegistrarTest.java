package dev.directives.engine;

import dev.directives.ast.ClassDef;
import dev.directives.ast.Program;
import dev.directives.ast.Statement.ClassDeclaration;
import dev.directives.ast.Statement.ExportNamedDeclaration;
import dev.directives.model.ClassSerializationEntry;
import dev.directives.model.CompilationMode;
import dev.directives.model.TransformConfig;
import dev.directives.syntax.Parser;
import dev.directives.syntax.SourcePrinter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClassSerializationRegistrarTest {

    private static ClassDef lastClass(Program program) {
        var export = (ExportNamedDeclaration) program.body().get(program.body().size() - 1);
        return ((ClassDeclaration) export.declaration()).definition();
    }

    @Test
    void detectsImportedHookNames() {
        Program program = Parser.parse("""
            import { WORKFLOW_SERIALIZE as S, WORKFLOW_DESERIALIZE } from "workflow";
            export class Point {
                static [S](p) {
                    return { x: p.x };
                }
                static [WORKFLOW_DESERIALIZE](d) {
                    return new Point(d.x);
                }
            }
            """);

        var aliases = ClassSerializationRegistrar.collectAliases(program.body());

        assertThat(aliases.serialize()).containsExactly("S");
        assertThat(ClassSerializationRegistrar.hasCustomSerialization(lastClass(program), aliases)).isTrue();
    }

    @Test
    void detectsSymbolForKeysAndConstants() {
        Program program = Parser.parse("""
            const DESERIALIZE = Symbol.for("workflow-deserialize");
            export class Money {
                static [Symbol.for("workflow-serialize")](m) {
                    return m.cents;
                }
                static [DESERIALIZE](cents) {
                    return new Money(cents);
                }
            }
            """);

        var aliases = ClassSerializationRegistrar.collectAliases(program.body());

        assertThat(ClassSerializationRegistrar.hasCustomSerialization(lastClass(program), aliases)).isTrue();
    }

    @Test
    void oneHookIsNotEnough() {
        Program program = Parser.parse("""
            export class Half {
                static [Symbol.for("workflow-serialize")](h) {
                    return h;
                }
            }
            """);

        var aliases = ClassSerializationRegistrar.collectAliases(program.body());

        assertThat(ClassSerializationRegistrar.hasCustomSerialization(lastClass(program), aliases)).isFalse();
    }

    @Test
    void instanceHooksDoNotCount() {
        Program program = Parser.parse("""
            export class Wrong {
                [Symbol.for("workflow-serialize")]() {}
                [Symbol.for("workflow-deserialize")]() {}
            }
            """);

        var aliases = ClassSerializationRegistrar.collectAliases(program.body());

        assertThat(ClassSerializationRegistrar.hasCustomSerialization(lastClass(program), aliases)).isFalse();
    }

    @Test
    void buildsRegistrationCalls() {
        var statements = ClassSerializationRegistrar.registrations(
            List.of(new ClassSerializationEntry("Point", "class//./src/geo//Point", true, false)));

        assertThat(statements).extracting(SourcePrinter::print)
            .containsExactly("registerSerializationClass(\"class//./src/geo//Point\", Point);");
    }

    @Test
    void registeredInEveryMode() {
        String source = """
            export class Point {
                static [Symbol.for("workflow-serialize")](p) {
                    return p;
                }
                static [Symbol.for("workflow-deserialize")](p) {
                    return p;
                }
            }
            """;

        for (CompilationMode mode : CompilationMode.values()) {
            String code = WorkflowTransformer.transformSource(source, TransformConfig.of(mode, "src/geo.js")).code();

            assertThat(code)
                .startsWith("import { registerSerializationClass } from \"workflow/internal/class-serialization\";\n")
                .endsWith("registerSerializationClass(\"class//./src/geo//Point\", Point);\n");
        }
    }
}
