package org.pragmatica.minilang.parser;

import org.pragmatica.minilang.tree.AstNode.Assignment;
import org.pragmatica.minilang.tree.AstNode.ElifClause;
import org.pragmatica.minilang.tree.AstNode.ForStmt;
import org.pragmatica.minilang.tree.AstNode.IfStmt;
import org.pragmatica.minilang.tree.AstNode.WhileStmt;

import java.util.ArrayList;
import java.util.List;

import static org.pragmatica.minilang.lexer.TokenKind.BEGIN;
import static org.pragmatica.minilang.lexer.TokenKind.COLON;
import static org.pragmatica.minilang.lexer.TokenKind.ELIF;
import static org.pragmatica.minilang.lexer.TokenKind.ELSE;
import static org.pragmatica.minilang.lexer.TokenKind.END;
import static org.pragmatica.minilang.lexer.TokenKind.FOR;
import static org.pragmatica.minilang.lexer.TokenKind.IDENT;
import static org.pragmatica.minilang.lexer.TokenKind.IF;
import static org.pragmatica.minilang.lexer.TokenKind.LPAREN;
import static org.pragmatica.minilang.lexer.TokenKind.RPAREN;
import static org.pragmatica.minilang.lexer.TokenKind.SEMICOLON;
import static org.pragmatica.minilang.lexer.TokenKind.WHILE;

/**
 * {@code if}, {@code while} and {@code for}. Bodies are blocks of assignments only:
 *
 * <pre>
 * block := ':' 'begin' (assignment ';')* 'end'
 * </pre>
 */
public final class ControlFlowParser {

    private final ParsingContext ctx;
    private final ExpressionParser expressions;
    private final StatementParser statements;

    ControlFlowParser(ParsingContext ctx, ExpressionParser expressions, StatementParser statements) {
        this.ctx = ctx;
        this.expressions = expressions;
        this.statements = statements;
    }

    /**
     * {@code 'if' logic block ('elif' logic block)* ('else' block)?}
     */
    public ParseResult<IfStmt> parseIf() {
        var start = ctx.location();
        var keyword = ctx.expect(IF);
        if (keyword.isFailure()) {
            return keyword.propagate();
        }
        var condition = expressions.parseLogic();
        if (condition.isFailure()) {
            return condition.propagate();
        }
        var thenBranch = parseBlock();
        if (thenBranch.isFailure()) {
            return thenBranch.propagate();
        }

        var elifClauses = new ArrayList<ElifClause>();
        while (ctx.check(ELIF)) {
            var clauseStart = ctx.location();
            ctx.advance();
            var elifCondition = expressions.parseLogic();
            if (elifCondition.isFailure()) {
                return elifCondition.propagate();
            }
            var body = parseBlock();
            if (body.isFailure()) {
                return body.propagate();
            }
            elifClauses.add(new ElifClause(ctx.spanFrom(clauseStart), elifCondition.unwrap(), body.unwrap()));
        }

        List<Assignment> elseBranch = List.of();
        if (ctx.check(ELSE)) {
            ctx.advance();
            var body = parseBlock();
            if (body.isFailure()) {
                return body.propagate();
            }
            elseBranch = body.unwrap();
        }
        return ParseResult.success(new IfStmt(ctx.spanFrom(start),
                                              condition.unwrap(),
                                              thenBranch.unwrap(),
                                              elifClauses,
                                              elseBranch));
    }

    /**
     * {@code 'while' logic block}
     */
    public ParseResult<WhileStmt> parseWhile() {
        var start = ctx.location();
        var keyword = ctx.expect(WHILE);
        if (keyword.isFailure()) {
            return keyword.propagate();
        }
        var condition = expressions.parseLogic();
        if (condition.isFailure()) {
            return condition.propagate();
        }
        var body = parseBlock();
        if (body.isFailure()) {
            return body.propagate();
        }
        return ParseResult.success(new WhileStmt(ctx.spanFrom(start), condition.unwrap(), body.unwrap()));
    }

    /**
     * {@code 'for' '(' assignment ';' logic ';' assignment ')' block}
     */
    public ParseResult<ForStmt> parseFor() {
        var start = ctx.location();
        var keyword = ctx.expect(FOR);
        if (keyword.isFailure()) {
            return keyword.propagate();
        }
        var open = ctx.expect(LPAREN);
        if (open.isFailure()) {
            return open.propagate();
        }
        var init = statements.parseAssignment(SEMICOLON);
        if (init.isFailure()) {
            return init.propagate();
        }
        var firstSeparator = ctx.expect(SEMICOLON);
        if (firstSeparator.isFailure()) {
            return firstSeparator.propagate();
        }
        var condition = expressions.parseLogic();
        if (condition.isFailure()) {
            return condition.propagate();
        }
        var secondSeparator = ctx.expect(SEMICOLON);
        if (secondSeparator.isFailure()) {
            return secondSeparator.propagate();
        }
        var step = statements.parseAssignment(RPAREN);
        if (step.isFailure()) {
            return step.propagate();
        }
        var close = ctx.expect(RPAREN);
        if (close.isFailure()) {
            return close.propagate();
        }
        var body = parseBlock();
        if (body.isFailure()) {
            return body.propagate();
        }
        return ParseResult.success(new ForStmt(ctx.spanFrom(start),
                                               init.unwrap(),
                                               condition.unwrap(),
                                               step.unwrap(),
                                               body.unwrap()));
    }

    /**
     * A block body, consuming the closing {@code end}.
     */
    public ParseResult<List<Assignment>> parseBlock() {
        var colon = ctx.expect(COLON);
        if (colon.isFailure()) {
            return colon.propagate();
        }
        var begin = ctx.expect(BEGIN);
        if (begin.isFailure()) {
            return begin.propagate();
        }

        var body = new ArrayList<Assignment>();
        while (!ctx.check(END)) {
            if (!ctx.check(IDENT)) {
                return ctx.unexpected("assignment or 'end'");
            }
            var assignment = statements.parseAssignment(SEMICOLON);
            if (assignment.isFailure()) {
                return assignment.propagate();
            }
            var semicolon = ctx.expect(SEMICOLON);
            if (semicolon.isFailure()) {
                return semicolon.propagate();
            }
            body.add(assignment.unwrap());
        }
        ctx.advance();
        return ParseResult.success(List.copyOf(body));
    }
}
