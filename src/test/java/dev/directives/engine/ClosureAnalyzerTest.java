package dev.directives.engine;

import dev.directives.ast.Expression.ArrowFunctionExpression;
import dev.directives.ast.Function;
import dev.directives.ast.Statement.FunctionDeclaration;
import dev.directives.ast.Statement.VariableDeclaration;
import dev.directives.syntax.Parser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClosureAnalyzerTest {

    private static Function firstFunction(String source) {
        return ((FunctionDeclaration) Parser.parse(source).body().get(0)).function();
    }

    @Test
    void reportsFreeVariablesSortedWithoutGlobals() {
        Function function = firstFunction("""
            async function scale(x) {
                const y = x * factor;
                console.log(y);
                return helper(y) + Math.max(offset, y);
            }
            """);

        assertThat(ClosureAnalyzer.freeVariables(function)).containsExactly("factor", "helper", "offset");
    }

    @Test
    void nestedHelpersBelongToTheirParent() {
        Function function = firstFunction("""
            async function outer(items) {
                function format(item) {
                    return prefix + item;
                }
                return items.map((i) => format(i));
            }
            """);

        assertThat(ClosureAnalyzer.freeVariables(function)).containsExactly("prefix");
    }

    @Test
    void skipsNestedDirectiveFunctions() {
        Function function = firstFunction("""
            async function outer() {
                const inner = async () => {
                    "use step";
                    return captured;
                };
                return inner();
            }
            """);

        assertThat(ClosureAnalyzer.freeVariables(function)).isEmpty();
    }

    @Test
    void arrowParametersAndDestructuringBind() {
        var declaration = (VariableDeclaration) Parser.parse(
            "const f = async ({ a, b: [c] }, ...rest) => a + c + rest.length + d;").body().get(0);
        var arrow = (ArrowFunctionExpression) declaration.declarations().get(0).init();

        assertThat(ClosureAnalyzer.freeVariables(arrow)).containsExactly("d");
    }

    @Test
    void declaredNamesStopAtNestedFunctions() {
        Function function = firstFunction("""
            function f(a, { b }) {
                var c;
                let d = 1;
                function g() {
                    var h;
                }
                try {
                    d++;
                } catch (e) {
                    c = e;
                }
            }
            """);

        assertThat(ClosureAnalyzer.declaredNames(function)).containsExactlyInAnyOrder("f", "a", "b", "c", "d", "g", "e");
    }

    @Test
    void detectsWritesToCapturedNames() {
        Function assigns = firstFunction("""
            async function add(n) {
                total = total + n;
            }
            """);
        Function increments = firstFunction("""
            async function tick() {
                const bump = () => {
                    count++;
                };
                bump();
            }
            """);

        assertThat(ClosureAnalyzer.reassignsFreeVariable(assigns)).isTrue();
        assertThat(ClosureAnalyzer.reassignsFreeVariable(increments)).isTrue();
    }

    @Test
    void localWritesAndMemberWritesAreNotReassignments() {
        Function function = firstFunction("""
            async function record(n) {
                let sum = 0;
                sum += n;
                n = n + 1;
                state.total = sum;
                return state;
            }
            """);

        assertThat(ClosureAnalyzer.reassignsFreeVariable(function)).isFalse();
    }
}
