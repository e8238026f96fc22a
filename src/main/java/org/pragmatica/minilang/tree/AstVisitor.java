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

/**
 * Double-dispatch traversal over the AST. Later stages (code generation, printing,
 * analysis) implement this instead of inspecting node types.
 *
 * @param <R> result of visiting a node; {@link Void} for side-effecting visitors
 */
public interface AstVisitor<R> {

    /**
     * Visits every statement in order. Returns null unless overridden.
     */
    default R visitProgram(Program program) {
        for (var statement : program.statements()) {
            statement.accept(this);
        }
        return null;
    }

    // --- Statements ---
    R visitDeclaration(Declaration declaration);

    R visitAssignment(Assignment assignment);

    R visitIfStmt(IfStmt statement);

    R visitElifClause(ElifClause clause);

    R visitWhileStmt(WhileStmt statement);

    R visitForStmt(ForStmt statement);

    R visitPrintStmt(PrintStmt statement);

    // --- Expressions ---
    R visitFinal(Final node);

    R visitSignedNumber(SignedNumber node);

    R visitNegExpr(NegExpr node);

    R visitUnaryOp(UnaryOp node);

    R visitBinaryOp(BinaryOp node);

    // --- Conditions ---
    R visitComparison(Comparison node);

    R visitLogicalExpr(LogicalExpr node);
}
