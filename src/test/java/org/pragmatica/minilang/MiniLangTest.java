package org.pragmatica.minilang;

import org.junit.jupiter.api.Test;
import org.pragmatica.minilang.error.SyntaxError;
import org.pragmatica.minilang.error.SyntaxException;
import org.pragmatica.minilang.lexer.TokenStream;
import org.pragmatica.minilang.parser.ParserConfig;
import org.pragmatica.minilang.parser.RecursiveDescentParser;
import org.pragmatica.minilang.tree.AstNode.Assignment;
import org.pragmatica.minilang.tree.AstNode.BinaryOp;
import org.pragmatica.minilang.tree.AstNode.Declaration;
import org.pragmatica.minilang.tree.AstNode.IfStmt;
import org.pragmatica.minilang.tree.AstNode.UnaryOp;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks through the public entry point.
 */
class MiniLangTest {

    private static final String PROGRAM = """
        // running sum
        int i, sum = 0, 0;
        bool done = false;
        for (i = 0; i < 10; i += 1): begin
            sum = sum + i ^ 2;
        end
        while sum > 100 && done == 0: begin
            sum -= 7;
        end
        if sum % 2 == 0: begin
            done = true;
            sum = sum / 2;
        end elif sum < 0: begin
            sum = -(sum);
        end else: begin
            done = sum >= 3;
        end
        i++;
        print(sum);
        """;

    @Test
    void parse_exponent_isRightAssociative() {
        var assignment = (Assignment) MiniLang.parse("x = 2^3^2;").unwrap().statements().get(0);

        var pow = assertInstanceOf(BinaryOp.class, assignment.value().orElseThrow());
        assertEquals(BinaryOp.Operator.POW, pow.operator());
        assertInstanceOf(BinaryOp.class, pow.right());
        assertEquals("(= x (^ 2 (^ 3 2)))", MiniLang.print(assignment));
    }

    @Test
    void parse_subtraction_isLeftAssociative() {
        assertEquals("(program (= x (- (- 8 3) 2)))", MiniLang.print(MiniLang.parse("x = 8-3-2;").unwrap()));
    }

    @Test
    void parse_declaration_pairsNamesWithInitializers() {
        var declaration = (Declaration) MiniLang.parse("int a, b = 1, 2;").unwrap().statements().get(0);

        assertEquals(List.of("a", "b"), declaration.names());
        assertEquals("1", MiniLang.print(declaration.initializers().get(0)));
        assertEquals("2", MiniLang.print(declaration.initializers().get(1)));

        assertInstanceOf(SyntaxError.InvalidDeclaration.class, MiniLang.parse("int a, b = 1;").error());
    }

    @Test
    void parse_increment_standaloneAndEmbedded() {
        var standalone = MiniLang.parse("x++;").unwrap().statements().get(0);
        var embedded = (Assignment) MiniLang.parse("x = y++;").unwrap().statements().get(0);

        assertInstanceOf(UnaryOp.class, standalone);
        assertEquals("y", ((UnaryOp) embedded.value().orElseThrow()).identifier());
    }

    @Test
    void parse_missingTerminator_failsWithCursorAtEnd() {
        var tokens = TokenStream.tokenize("x = 1 y = 2;");

        var result = MiniLang.parse(tokens);

        assertTrue(result.isFailure());
        assertTrue(tokens.isAtEnd());
        assertThrows(SyntaxException.class, result::unwrap);
    }

    @Test
    void parse_ifChain_hasOneAssignmentPerBranch() {
        var statement = (IfStmt) MiniLang.parse(
            "if true: begin x = 1; end elif false: begin x = 2; end else: begin x = 3; end").unwrap()
                                         .statements()
                                         .get(0);

        assertEquals(1, statement.thenBranch().size());
        assertEquals(1, statement.elifClauses().size());
        assertEquals(1, statement.elifClauses().get(0).body().size());
        assertEquals(1, statement.elseBranch().size());
    }

    @Test
    void parse_completeProgram() {
        var program = MiniLang.parse(PROGRAM).unwrap();

        assertThat(program.statements()).hasSize(7);
        assertThat(MiniLang.print(program))
            .startsWith("(program (decl int (i sum) (0 0)) (decl bool (done) (false))")
            .contains("(for (= i 0) (< i 10) (+= i 1) (do (= sum (+ sum (^ i 2)))))")
            .contains("(elif (< sum 0) (= sum (neg sum)))")
            .contains("(else (= done (>= sum 3)))")
            .endsWith("(i++) (print sum))");
    }

    @Test
    void format_roundTripsCompleteProgram() {
        var program = MiniLang.parse(PROGRAM).unwrap();

        var reparsed = MiniLang.parse(MiniLang.format(program)).unwrap();

        assertEquals(MiniLang.print(program), MiniLang.print(reparsed));
    }

    @Test
    void builder_appliesLimits() {
        var parser = MiniLang.builder()
                             .maxInputSize(64)
                             .maxNestingDepth(4)
                             .build();

        var config = ((RecursiveDescentParser) parser).config();
        assertEquals(new ParserConfig(64, 4), config);
        assertInstanceOf(SyntaxError.NestingTooDeep.class, parser.parse("x = (((((1)))));").error());
    }

    @Test
    void formatError_rendersAgainstSource() {
        var source = "print(1 +);";

        var error = MiniLang.parse(source).error();

        assertThat(MiniLang.formatError(error, source, "demo.ml"))
            .contains("--> demo.ml:1:10")
            .contains("found ')'")
            .contains("help: expected expression");
    }
}
