package dev.directives.ast;

import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Expression.StringLiteral;
import dev.directives.ast.Statement.VariableDeclaration;
import dev.directives.syntax.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class NodesTest {

    @Test
    void boundNamesFollowSourceOrder() {
        var declaration = (VariableDeclaration) Parser.parse("const { a, b: [c, , d = 1], ...rest } = o;").body().get(0);

        assertThat(Nodes.boundNames(declaration.declarations().get(0).id())).containsExactly("a", "c", "d", "rest");
    }

    @Test
    void propertyNamesOnlyForStaticKeys() {
        assertThat(Nodes.propertyName(Identifier.of("run"), false)).isEqualTo("run");
        assertThat(Nodes.propertyName(StringLiteral.of("my key"), true)).isEqualTo("my key");
        assertThat(Nodes.propertyName(Identifier.of("key"), true)).isNull();
    }

    @Test
    void walkCanSkipSubtrees() {
        Program program = Parser.parse("""
            const a = 1;
            function f() {
                const b = 2;
            }
            """);
        var names = new ArrayList<String>();

        for (Statement statement : program.body()) {
            Nodes.walk(statement, node -> {
                if (node instanceof Identifier id) {
                    names.add(id.name());
                }
                return !(node instanceof Function);
            });
        }

        assertThat(names).contains("a").doesNotContain("b");
    }
}
