package org.pragmatica.minilang.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.minilang.tree.AstNode.Assignment;
import org.pragmatica.minilang.tree.AstNode.BinaryOp;
import org.pragmatica.minilang.tree.AstNode.Comparison;
import org.pragmatica.minilang.tree.AstNode.Declaration;
import org.pragmatica.minilang.tree.AstNode.ElifClause;
import org.pragmatica.minilang.tree.AstNode.Final;
import org.pragmatica.minilang.tree.AstNode.IfStmt;
import org.pragmatica.minilang.tree.AstNode.LogicalExpr;
import org.pragmatica.minilang.tree.AstNode.NegExpr;
import org.pragmatica.minilang.tree.AstNode.Program;
import org.pragmatica.minilang.tree.AstNode.SignedNumber;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstPrinterTest {

    private static final SourceSpan SPAN = SourceSpan.at(SourceLocation.START);

    private static Final ident(String name) {
        return new Final(SPAN, Final.Kind.IDENT, name);
    }

    private static Final number(String digits) {
        return new Final(SPAN, Final.Kind.NUMBER, digits);
    }

    private static Assignment assign(String name, String digits) {
        return Assignment.arithmetic(SPAN, ident(name), Assignment.Operator.ASSIGN, number(digits));
    }

    @Test
    void print_identifierReference_differsFromArithmeticIdentifier() {
        var bool = Assignment.bool(SPAN, ident("x"), Comparison.atom(SPAN, Comparison.Operator.IDENT_REF, "y"));
        var arithmetic = Assignment.arithmetic(SPAN, ident("x"), Assignment.Operator.ASSIGN, ident("y"));

        assertEquals("(= x (ref y))", AstPrinter.print(bool));
        assertEquals("(= x y)", AstPrinter.print(arithmetic));
    }

    @Test
    void print_binaryOp_isPrefixForm() {
        var expr = new BinaryOp(SPAN, BinaryOp.Operator.SUB,
                                new BinaryOp(SPAN, BinaryOp.Operator.SUB, number("8"), number("3")),
                                number("2"));

        assertEquals("(- (- 8 3) 2)", AstPrinter.print(expr));
    }

    @Test
    void print_signedAndNegated() {
        var neg = new NegExpr(SPAN, new BinaryOp(SPAN, BinaryOp.Operator.ADD,
                                                 ident("a"),
                                                 new SignedNumber(SPAN, SignedNumber.Sign.MINUS, "5")));

        assertEquals("(neg (+ a -5))", AstPrinter.print(neg));
    }

    @Test
    void print_logicalOfComparisons() {
        var condition = new LogicalExpr(SPAN, LogicalExpr.Operator.OR,
                                        Comparison.relational(SPAN, Comparison.Operator.NOT_EQUAL, ident("a"), number("0")),
                                        Comparison.atom(SPAN, Comparison.Operator.LITERAL_FALSE, "false"));

        assertEquals("(|| (!= a 0) false)", AstPrinter.print(condition));
    }

    @Test
    void print_declaration_withAndWithoutInitializers() {
        var bare = new Declaration(SPAN, Declaration.Type.INT, List.of("a", "b"), List.of());
        var initialized = new Declaration(SPAN, Declaration.Type.BOOL, List.of("f"),
                                          List.of(Comparison.atom(SPAN, Comparison.Operator.LITERAL_TRUE, "true")));

        assertEquals("(decl int (a b))", AstPrinter.print(bare));
        assertEquals("(decl bool (f) (true))", AstPrinter.print(initialized));
    }

    @Test
    void print_ifStatement_omitsEmptyElse() {
        var condition = Comparison.atom(SPAN, Comparison.Operator.IDENT_REF, "c");
        var statement = new IfStmt(SPAN, condition,
                                   List.of(assign("x", "1")),
                                   List.of(new ElifClause(SPAN, condition, List.of())),
                                   List.of());

        assertEquals("(if (ref c) (then (= x 1)) (elif (ref c)))", AstPrinter.print(statement));
    }

    @Test
    void print_program_wrapsStatements() {
        var program = new Program(SPAN, List.of(assign("x", "1"), assign("y", "2")));

        assertEquals("(program (= x 1) (= y 2))", AstPrinter.print(program));
        assertEquals("(program)", AstPrinter.print(new Program(SPAN, List.of())));
    }
}
