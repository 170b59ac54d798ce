package dev.directives.engine;

import dev.directives.ast.Function;
import dev.directives.ast.Program;
import dev.directives.ast.Statement.FunctionDeclaration;
import dev.directives.model.DiagnosticKind;
import dev.directives.model.Directive;
import dev.directives.syntax.Parser;
import dev.directives.syntax.SourcePrinter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DirectiveScannerTest {

    private static Function firstFunction(String source) {
        return ((FunctionDeclaration) Parser.parse(source).body().get(0)).function();
    }

    @Test
    void findsDirectiveInFirstPosition() {
        var scan = DirectiveScanner.scanFunction(firstFunction("""
            async function load() {
                "use step";
                return 1;
            }
            """));

        assertThat(scan.found()).isTrue();
        assertThat(scan.directive()).isEqualTo(Directive.USE_STEP);
        assertThat(scan.diagnostics()).isEmpty();
    }

    @Test
    void reportsDirectiveAfterOtherPrologueStrings() {
        var scan = DirectiveScanner.scanFunction(firstFunction("""
            async function load() {
                "use strict";
                "use workflow";
            }
            """));

        assertThat(scan.found()).isFalse();
        assertThat(scan.diagnostics()).extracting(d -> d.kind()).containsExactly(DiagnosticKind.MISPLACED_DIRECTIVE);
    }

    @Test
    void reportsNearMisses() {
        var scan = DirectiveScanner.scanFunction(firstFunction("""
            async function load() {
                "use steps";
            }
            """));

        assertThat(scan.found()).isFalse();
        assertThat(scan.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(DiagnosticKind.MISSPELLED_DIRECTIVE);
            assertThat(d.message()).contains("Did you mean \"use step\"?");
        });
    }

    @Test
    void ignoresUnrelatedStrings() {
        var scan = DirectiveScanner.scanFunction(firstFunction("""
            async function load() {
                "hello world";
            }
            """));

        assertThat(scan.found()).isFalse();
        assertThat(scan.diagnostics()).isEmpty();
    }

    @Test
    void looksInsideResourceCleanupLowering() {
        Function function = firstFunction("""
            async function load() {
                const env = { stack: [], error: undefined, hasError: false };
                try {
                    "use step";
                    return 1;
                } catch (e) {
                    env.error = e;
                    env.hasError = true;
                } finally {
                    dispose(env);
                }
            }
            """);

        assertThat(DirectiveScanner.hasDirective(function)).isTrue();
        String stripped = SourcePrinter.print(DirectiveScanner.stripDirective(function.body()));
        assertThat(stripped).doesNotContain("use step").contains("return 1;");
    }

    @Test
    void scansModulePrologueAfterImports() {
        Program program = Parser.parse("""
            import { db } from "./db";
            "use workflow";
            export async function run() {}
            """);

        var scan = DirectiveScanner.scanModule(program.body());

        assertThat(scan.directive()).isEqualTo(Directive.USE_WORKFLOW);
        assertThat(scan.honoredStatements()).hasSize(1);
        assertThat(scan.diagnostics()).isEmpty();
    }

    @Test
    void reportsConflictingModuleDirectives() {
        Program program = Parser.parse("""
            "use step";
            "use workflow";
            """);

        var scan = DirectiveScanner.scanModule(program.body());

        assertThat(scan.directive()).isEqualTo(Directive.USE_STEP);
        assertThat(scan.diagnostics()).extracting(d -> d.kind()).containsExactly(DiagnosticKind.MISPLACED_DIRECTIVE);
    }

    @Test
    void measuresEditDistance() {
        assertThat(DirectiveScanner.editDistance("use step", "use steps")).isEqualTo(1);
        assertThat(DirectiveScanner.editDistance("use step", "use step")).isZero();
        assertThat(DirectiveScanner.editDistance("use wrkflow", "use workflow")).isEqualTo(1);
    }
}
