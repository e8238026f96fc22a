package org.pragmatica.minilang.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.minilang.MiniLang;
import org.pragmatica.minilang.tree.SourceLocation;
import org.pragmatica.minilang.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticTest {

    private static SyntaxError errorOf(String source) {
        return MiniLang.parse(source).error();
    }

    @Test
    void format_unexpectedToken_rendersRustStyle() {
        var source = "x = 1 + ;";

        var formatted = errorOf(source).toDiagnostic().format(source, "main.ml");

        assertThat(formatted).isEqualTo("""
            error: unexpected token
              --> main.ml:1:9
              |
            1 | x = 1 + ;
              |         ^ found ';'
              |
              = help: expected expression
            """);
    }

    @Test
    void format_endOfInput_marksPositionPastLastCharacter() {
        var source = "x = 1";

        var formatted = errorOf(source).toDiagnostic().format(source, "main.ml");

        assertThat(formatted)
            .contains("error: unexpected end of input")
            .contains("--> main.ml:1:6")
            .contains("1 | x = 1\n  |      ^ input ends here")
            .contains("= help: expected ';'");
    }

    @Test
    void format_laterLine_showsThatLineOnly() {
        var source = "int x = 1;\nx = ;";

        var formatted = errorOf(source).toDiagnostic().format(source, "in.ml");

        assertThat(formatted)
            .contains("--> in.ml:2:5")
            .contains("2 | x = ;")
            .doesNotContain("int x = 1;");
    }

    @Test
    void format_invalidDeclaration_labelsWithMessage() {
        var source = "int a = 1, 2;";

        var formatted = errorOf(source).toDiagnostic().format(source, null);

        assertThat(formatted)
            .startsWith("error: invalid declaration\n  --> 1:10\n")
            .contains("^ More initializers than the 1 declared names at 1:10");
    }

    @Test
    void formatSimple_isSingleLine() {
        var diagnostic = errorOf("x = 1 + ;").toDiagnostic();

        assertThat(diagnostic.formatSimple("main.ml")).isEqualTo("main.ml:1:9: error: unexpected token");
    }

    @Test
    void format_multiCharacterSpan_underlinesWholeToken() {
        var span = SourceSpan.of(SourceLocation.at(1, 5, 4), SourceLocation.at(1, 10, 9));
        var diagnostic = Diagnostic.error("unexpected token", span)
                                   .withLabel("found 'while'")
                                   .withNote("blocks hold assignments only");

        var formatted = diagnostic.format("x = while;", "f.ml");

        assertThat(formatted)
            .contains("  |     ^^^^^ found 'while'")
            .contains("  = blocks hold assignments only");
    }

    @Test
    void formatError_matchesDiagnostic() {
        var source = "print(1;";
        var error = errorOf(source);

        assertThat(MiniLang.formatError(error, source, "p.ml"))
            .isEqualTo(error.toDiagnostic().format(source, "p.ml"))
            .contains("found ';'");
    }
}
