package dev.directives.engine;

import dev.directives.ast.Program;
import dev.directives.ast.Statement;
import dev.directives.syntax.Parser;
import dev.directives.syntax.SourcePrinter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DeadCodeEliminatorTest {

    private static String eliminate(String source, Set<String> keep) {
        List<Statement> body = DeadCodeEliminator.eliminate(Parser.parse(source).body(), keep);
        return SourcePrinter.print(Program.module(body));
    }

    @Test
    void removesUnusedDeclarationsAndImports() {
        String result = eliminate("""
            import { unused, used } from "./lib";
            import "./side-effect";
            const dead = 1;
            function helper() {
                return used();
            }
            export function live() {
                return helper();
            }
            """, Set.of());

        assertThat(result).isEqualTo("""
            import { used } from "./lib";
            import "./side-effect";
            function helper() {
                return used();
            }
            export function live() {
                return helper();
            }
            """);
    }

    @Test
    void removesChainsOfDeadFunctions() {
        String result = eliminate("""
            function a() {
                return b();
            }
            function b() {
                return 1;
            }
            """, Set.of());

        assertThat(result).isEmpty();
    }

    @Test
    void removesUnusedDeclarationsWhateverTheirInitializer() {
        String result = eliminate("""
            import { connect } from "db";
            import { port } from "./config";
            const client = connect();
            const config = { port };
            export const name = "jobs";
            """, Set.of());

        assertThat(result).isEqualTo("export const name = \"jobs\";\n");
    }

    @Test
    void keepsCallsWhoseResultIsNotBound() {
        String result = eliminate("""
            import { startServer } from "./server";
            const unused = 1;
            startServer();
            """, Set.of());

        assertThat(result).isEqualTo("""
            import { startServer } from "./server";
            startServer();
            """);
    }

    @Test
    void keepsRequestedNames() {
        String result = eliminate("""
            function run$scale() {}
            """, Set.of("run$scale"));

        assertThat(result).isEqualTo("function run$scale() {}\n");
    }

    @Test
    void dropsInertExpressionStatements() {
        String result = eliminate("""
            value;
            42;
            call();
            """, Set.of());

        assertThat(result).isEqualTo("call();\n");
    }

    @Test
    void selfReferenceDoesNotKeepAFunctionAlive() {
        String result = eliminate("""
            function loop(n) {
                return n > 0 ? loop(n - 1) : 0;
            }
            """, Set.of());

        assertThat(result).isEmpty();
    }

    @Test
    void isIdempotent() {
        String source = """
            import { a, b } from "./lib";
            const x = a;
            function f() {
                return x;
            }
            export default f;
            """;

        String once = eliminate(source, Set.of());
        String twice = eliminate(once, Set.of());

        assertThat(twice).isEqualTo(once);
        assertThat(once).doesNotContain(" b ");
    }
}
