package org.pragmatica.minilang.tree;

import org.pragmatica.minilang.tree.AstNode.Assignment;
import org.pragmatica.minilang.tree.AstNode.BinaryOp;
import org.pragmatica.minilang.tree.AstNode.Comparison;
import org.pragmatica.minilang.tree.AstNode.Declaration;
import org.pragmatica.minilang.tree.AstNode.ElifClause;
import org.pragmatica.minilang.tree.AstNode.Final;
import org.pragmatica.minilang.tree.AstNode.ForStmt;
import org.pragmatica.minilang.tree.AstNode.IfStmt;
import org.pragmatica.minilang.tree.AstNode.LogicalExpr;
import org.pragmatica.minilang.tree.AstNode.NegExpr;
import org.pragmatica.minilang.tree.AstNode.PrintStmt;
import org.pragmatica.minilang.tree.AstNode.Program;
import org.pragmatica.minilang.tree.AstNode.SignedNumber;
import org.pragmatica.minilang.tree.AstNode.UnaryOp;
import org.pragmatica.minilang.tree.AstNode.WhileStmt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree as a single-line S-expression, e.g. {@code (= x (+ 1 (* 2 3)))}.
 *
 * <p>Spans are not printed, so two trees print the same exactly when they have the same shape.
 */
public final class AstPrinter implements AstVisitor<String> {
    private static final AstPrinter INSTANCE = new AstPrinter();

    private AstPrinter() {}

    public static String print(AstNode node) {
        return node.accept(INSTANCE);
    }

    @Override
    public String visitProgram(Program program) {
        return list("program", program.statements());
    }

    @Override
    public String visitDeclaration(Declaration declaration) {
        var sb = new StringBuilder("(decl ")
            .append(declaration.type().keyword())
            .append(" (")
            .append(String.join(" ", declaration.names()))
            .append(")");
        if (declaration.hasInitializers()) {
            sb.append(" (").append(join(declaration.initializers())).append(")");
        }
        return sb.append(")").toString();
    }

    @Override
    public String visitAssignment(Assignment assignment) {
        var right = assignment.value()
                              .map(AstPrinter::print)
                              .orElseGet(() -> print(assignment.condition().orElseThrow()));
        return "(" + assignment.operator().symbol() + " " + assignment.target().text() + " " + right + ")";
    }

    @Override
    public String visitIfStmt(IfStmt statement) {
        var sb = new StringBuilder("(if ")
            .append(print(statement.condition()))
            .append(" ")
            .append(list("then", statement.thenBranch()));
        for (var clause : statement.elifClauses()) {
            sb.append(" ").append(print(clause));
        }
        if (!statement.elseBranch().isEmpty()) {
            sb.append(" ").append(list("else", statement.elseBranch()));
        }
        return sb.append(")").toString();
    }

    @Override
    public String visitElifClause(ElifClause clause) {
        var sb = new StringBuilder("(elif ").append(print(clause.condition()));
        if (!clause.body().isEmpty()) {
            sb.append(" ").append(join(clause.body()));
        }
        return sb.append(")").toString();
    }

    @Override
    public String visitWhileStmt(WhileStmt statement) {
        return "(while " + print(statement.condition()) + " " + list("do", statement.body()) + ")";
    }

    @Override
    public String visitForStmt(ForStmt statement) {
        return "(for " + print(statement.init())
            + " " + print(statement.condition())
            + " " + print(statement.step())
            + " " + list("do", statement.body()) + ")";
    }

    @Override
    public String visitPrintStmt(PrintStmt statement) {
        return "(print " + print(statement.expression()) + ")";
    }

    @Override
    public String visitFinal(Final node) {
        return node.text();
    }

    @Override
    public String visitSignedNumber(SignedNumber node) {
        return node.sign().symbol() + node.text();
    }

    @Override
    public String visitNegExpr(NegExpr node) {
        return "(neg " + print(node.operand()) + ")";
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return "(" + node.identifier() + node.operator().symbol() + ")";
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return "(" + node.operator().symbol() + " " + print(node.left()) + " " + print(node.right()) + ")";
    }

    @Override
    public String visitComparison(Comparison node) {
        if (node.operator() == Comparison.Operator.IDENT_REF) {
            return "(ref " + node.text() + ")";
        }
        if (!node.operator().isRelational()) {
            return node.text();
        }
        return "(" + node.operator().symbol()
            + " " + print(node.left().orElseThrow())
            + " " + print(node.right().orElseThrow()) + ")";
    }

    @Override
    public String visitLogicalExpr(LogicalExpr node) {
        return "(" + node.operator().symbol() + " " + print(node.left()) + " " + print(node.right()) + ")";
    }

    private static String list(String head, List<? extends AstNode> nodes) {
        return nodes.isEmpty()
               ? "(" + head + ")"
               : "(" + head + " " + join(nodes) + ")";
    }

    private static String join(List<? extends AstNode> nodes) {
        return nodes.stream()
                    .map(AstPrinter::print)
                    .collect(Collectors.joining(" "));
    }
}
