package org.pragmatica.minilang.tree;

import org.pragmatica.minilang.tree.AstNode.Assignment;
import org.pragmatica.minilang.tree.AstNode.BinaryOp;
import org.pragmatica.minilang.tree.AstNode.Comparison;
import org.pragmatica.minilang.tree.AstNode.Condition;
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
import org.pragmatica.minilang.tree.AstNode.Statement;
import org.pragmatica.minilang.tree.AstNode.UnaryOp;
import org.pragmatica.minilang.tree.AstNode.WhileStmt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree back into MiniLang source.
 *
 * <p>Binary arithmetic is fully parenthesized and nested logical operands are wrapped, so
 * re-parsing the output of a parsed tree yields a tree of the same shape.
 */
public final class SourceFormatter implements AstVisitor<String> {
    private static final String INDENT = "    ";

    private int depth;

    private SourceFormatter() {}

    public static String format(AstNode node) {
        return node.accept(new SourceFormatter());
    }

    @Override
    public String visitProgram(Program program) {
        return program.statements()
                      .stream()
                      .map(statement -> statementText(statement) + "\n")
                      .collect(Collectors.joining());
    }

    // increments print as expressions; the statement form adds the terminator
    private String statementText(Statement statement) {
        var text = statement.accept(this);
        return statement instanceof UnaryOp
               ? text + ";"
               : text;
    }

    @Override
    public String visitDeclaration(Declaration declaration) {
        var sb = new StringBuilder(declaration.type().keyword())
            .append(' ')
            .append(String.join(", ", declaration.names()));
        if (declaration.hasInitializers()) {
            sb.append(" = ")
              .append(declaration.initializers()
                                 .stream()
                                 .map(initializer -> initializer.accept(this))
                                 .collect(Collectors.joining(", ")));
        }
        return sb.append(';').toString();
    }

    @Override
    public String visitAssignment(Assignment assignment) {
        return assignmentText(assignment) + ";";
    }

    @Override
    public String visitIfStmt(IfStmt statement) {
        var sb = new StringBuilder("if ")
            .append(statement.condition().accept(this))
            .append(block(statement.thenBranch()));
        for (var clause : statement.elifClauses()) {
            sb.append(' ').append(clause.accept(this));
        }
        if (!statement.elseBranch().isEmpty()) {
            sb.append(" else").append(block(statement.elseBranch()));
        }
        return sb.toString();
    }

    @Override
    public String visitElifClause(ElifClause clause) {
        return "elif " + clause.condition().accept(this) + block(clause.body());
    }

    @Override
    public String visitWhileStmt(WhileStmt statement) {
        return "while " + statement.condition().accept(this) + block(statement.body());
    }

    @Override
    public String visitForStmt(ForStmt statement) {
        return "for (" + assignmentText(statement.init())
            + "; " + statement.condition().accept(this)
            + "; " + assignmentText(statement.step())
            + ")" + block(statement.body());
    }

    @Override
    public String visitPrintStmt(PrintStmt statement) {
        return "print(" + statement.expression().accept(this) + ");";
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
        return "-(" + node.operand().accept(this) + ")";
    }

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return node.identifier() + node.operator().symbol();
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        return "(" + node.left().accept(this)
            + " " + node.operator().symbol()
            + " " + node.right().accept(this) + ")";
    }

    @Override
    public String visitComparison(Comparison node) {
        if (!node.operator().isRelational()) {
            return node.text();
        }
        return node.left().orElseThrow().accept(this)
            + " " + node.operator().symbol()
            + " " + node.right().orElseThrow().accept(this);
    }

    @Override
    public String visitLogicalExpr(LogicalExpr node) {
        return operand(node.left()) + " " + node.operator().symbol() + " " + operand(node.right());
    }

    private String operand(Condition condition) {
        var text = condition.accept(this);
        return condition instanceof LogicalExpr
               ? "(" + text + ")"
               : text;
    }

    private String assignmentText(Assignment assignment) {
        var right = assignment.value()
                              .map(value -> value.accept(this))
                              .orElseGet(() -> assignment.condition().orElseThrow().accept(this));
        return assignment.target().text() + " " + assignment.operator().symbol() + " " + right;
    }

    private String block(List<Assignment> body) {
        var outer = INDENT.repeat(depth);
        depth++;
        var inner = INDENT.repeat(depth);
        var sb = new StringBuilder(": begin\n");
        for (var assignment : body) {
            sb.append(inner).append(assignment.accept(this)).append('\n');
        }
        depth--;
        return sb.append(outer).append("end").toString();
    }
}
