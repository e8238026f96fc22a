package org.pragmatica.minilang.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.minilang.error.SyntaxError;
import org.pragmatica.minilang.tree.AstNode.IfStmt;
import org.pragmatica.minilang.tree.AstPrinter;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowParserTest {

    private static final Parser PARSER = RecursiveDescentParser.create();

    private static String print(String source) {
        return AstPrinter.print(PARSER.parse(source).unwrap());
    }

    private static SyntaxError error(String source) {
        var result = PARSER.parse(source);
        assertTrue(result.isFailure(), "expected failure for " + source);
        return result.error();
    }

    // === if ===

    @Test
    void if_withElifAndElse_buildsOneStatement() {
        var program = PARSER.parse("if true: begin x = 1; end elif false: begin x = 2; end else: begin x = 3; end")
                            .unwrap();

        assertEquals(1, program.statements().size());
        var statement = assertInstanceOf(IfStmt.class, program.statements().get(0));
        assertEquals(1, statement.thenBranch().size());
        assertEquals(1, statement.elifClauses().size());
        assertEquals(1, statement.elifClauses().get(0).body().size());
        assertEquals(1, statement.elseBranch().size());
        assertEquals("(program (if true (then (= x 1)) (elif false (= x 2)) (else (= x 3))))",
                     AstPrinter.print(program));
    }

    @Test
    void if_withoutElse_hasEmptyElseBranch() {
        var statement = (IfStmt) PARSER.parse("if a > 0: begin a -= 1; b = a; end").unwrap().statements().get(0);

        assertTrue(statement.elifClauses().isEmpty());
        assertTrue(statement.elseBranch().isEmpty());
        assertEquals("(if (> a 0) (then (-= a 1) (= b (ref a))))", AstPrinter.print(statement));
    }

    @Test
    void if_severalElifs_keepOrder() {
        assertEquals("(program (if (== n 1) (then) (elif (== n 2) (= r 2)) (elif (== n 3) (= r 3))))",
                     print("if n == 1: begin end elif n == 2: begin r = 2; end elif n == 3: begin r = 3; end"));
    }

    @Test
    void if_elseOnly() {
        assertEquals("(program (if (ref a) (then) (else (= b 1))))", print("if a: begin end else: begin b = 1; end"));
    }

    @Test
    void if_conditionWithParenthesizedOperand() {
        assertEquals("(program (if (&& (> (+ a 1) 2) (ref b)) (then)))", print("if (a + 1) > 2 && b: begin end"));
    }

    @Test
    void if_followedByStatement_consumesOwnEnd() {
        assertEquals("(program (if (ref a) (then (= x 1))) (= y 2))", print("if a: begin x = 1; end y = 2;"));
    }

    // === while ===

    @Test
    void while_parsesConditionAndBody() {
        assertEquals("(program (while (< i 10) (do (+= i 1))))", print("while i < 10: begin i += 1; end"));
    }

    @Test
    void while_emptyBody() {
        assertEquals("(program (while (ref x) (do)))", print("while x: begin end"));
    }

    // === for ===

    @Test
    void for_parsesHeaderAndBody() {
        assertEquals("(program (for (= i 0) (< i 3) (+= i 1) (do (= s (+ s i)))))",
                     print("for (i = 0; i < 3; i += 1): begin s = s + i; end"));
    }

    @Test
    void for_stepMayAssignCondition() {
        assertEquals("(program (for (= i 0) (<= i n) (= done (== i n)) (do)))",
                     print("for (i = 0; i <= n; done = i == n): begin end"));
    }

    @Test
    void for_missingSeparator_fails() {
        var error = assertInstanceOf(SyntaxError.UnexpectedToken.class, error("for (i = 0 i < 3; i += 1): begin end"));

        assertEquals("i", error.found());
        assertEquals("';'", error.expected());
    }

    // === blocks ===

    @Test
    void block_nestedStatement_isRejected() {
        var error = assertInstanceOf(SyntaxError.UnexpectedToken.class, error("if x: begin if y: begin end end"));

        assertEquals("if", error.found());
        assertEquals("assignment or 'end'", error.expected());
    }

    @Test
    void block_missingEnd_reportsEndOfInput() {
        var error = assertInstanceOf(SyntaxError.UnexpectedEndOfInput.class, error("while x: begin a = 1;"));

        assertEquals("assignment or 'end'", error.expected());
    }

    @Test
    void block_missingColon_fails() {
        var error = assertInstanceOf(SyntaxError.UnexpectedToken.class, error("while x begin end"));

        assertEquals("begin", error.found());
        assertEquals("':'", error.expected());
    }

    @Test
    void block_assignmentWithoutTerminator_fails() {
        var error = assertInstanceOf(SyntaxError.UnexpectedToken.class, error("while x: begin a = 1 end"));

        assertEquals("end", error.found());
        assertEquals("';'", error.expected());
    }
}
