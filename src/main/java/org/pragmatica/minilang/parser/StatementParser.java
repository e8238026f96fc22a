package org.pragmatica.minilang.parser;

import org.pragmatica.minilang.error.SyntaxError;
import org.pragmatica.minilang.lexer.TokenKind;
import org.pragmatica.minilang.tree.AstNode;
import org.pragmatica.minilang.tree.AstNode.Assignment;
import org.pragmatica.minilang.tree.AstNode.Declaration;
import org.pragmatica.minilang.tree.AstNode.Final;
import org.pragmatica.minilang.tree.AstNode.PrintStmt;
import org.pragmatica.minilang.tree.AstNode.Program;
import org.pragmatica.minilang.tree.AstNode.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.minilang.lexer.TokenKind.ASSIGN;
import static org.pragmatica.minilang.lexer.TokenKind.COMMA;
import static org.pragmatica.minilang.lexer.TokenKind.IDENT;
import static org.pragmatica.minilang.lexer.TokenKind.LPAREN;
import static org.pragmatica.minilang.lexer.TokenKind.PRINT;
import static org.pragmatica.minilang.lexer.TokenKind.RPAREN;
import static org.pragmatica.minilang.lexer.TokenKind.SEMICOLON;

/**
 * Top-level statements. Every statement parser consumes its own terminator: {@code ;} for
 * declarations, assignments, increments and prints, the closing {@code end} for control flow.
 */
public final class StatementParser {

    private final ParsingContext ctx;
    private final ExpressionParser expressions;
    private final ControlFlowParser controlFlow;

    public StatementParser(ParsingContext ctx, ExpressionParser expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
        this.controlFlow = new ControlFlowParser(ctx, expressions, this);
    }

    public ParseResult<Program> parseProgram() {
        var start = ctx.location();
        var statements = new ArrayList<Statement>();

        while (!ctx.isAtEnd()) {
            var statement = parseStatement();
            if (statement.isFailure()) {
                return statement.propagate();
            }
            statements.add(statement.unwrap());
        }
        return ParseResult.success(new Program(ctx.spanFrom(start), statements));
    }

    public ParseResult<Statement> parseStatement() {
        return switch (ctx.current().kind()) {
            case INT -> statement(parseDeclaration(Declaration.Type.INT));
            case BOOL -> statement(parseDeclaration(Declaration.Type.BOOL));
            case IDENT -> parseIdentStatement();
            case IF -> statement(controlFlow.parseIf());
            case WHILE -> statement(controlFlow.parseWhile());
            case FOR -> statement(controlFlow.parseFor());
            case PRINT -> statement(parsePrint());
            default -> ctx.unexpected("statement");
        };
    }

    // === Declarations ===

    /**
     * {@code ('int' | 'bool') IDENT (',' IDENT)* ('=' init (',' init)*)? ';'}
     */
    public ParseResult<Declaration> parseDeclaration(Declaration.Type type) {
        var start = ctx.location();
        var keyword = ctx.expect(keywordOf(type));
        if (keyword.isFailure()) {
            return keyword.propagate();
        }

        var names = new ArrayList<String>();
        var first = declaredName(names);
        if (first.isFailure()) {
            return first.propagate();
        }
        while (ctx.check(COMMA)) {
            ctx.advance();
            var next = declaredName(names);
            if (next.isFailure()) {
                return next.propagate();
            }
        }

        var initializers = new ArrayList<AstNode>();
        if (ctx.check(ASSIGN)) {
            ctx.advance();
            var initializer = parseInitializer(type);
            if (initializer.isFailure()) {
                return initializer.propagate();
            }
            initializers.add(initializer.unwrap());

            while (ctx.check(COMMA)) {
                if (initializers.size() == names.size()) {
                    return ctx.invalidDeclaration(ctx.current().span(),
                                                  "More initializers than the " + names.size() + " declared names");
                }
                ctx.advance();
                var next = parseInitializer(type);
                if (next.isFailure()) {
                    return next.propagate();
                }
                initializers.add(next.unwrap());
            }
            if (ctx.check(SEMICOLON) && initializers.size() < names.size()) {
                return ctx.invalidDeclaration(ctx.current().span(),
                                              names.size() + " names declared but only "
                                                  + initializers.size() + " initialized");
            }
        }

        var semicolon = ctx.expect(SEMICOLON);
        if (semicolon.isFailure()) {
            return semicolon.propagate();
        }
        return ParseResult.success(new Declaration(ctx.spanFrom(start), type, names, initializers));
    }

    private ParseResult<String> declaredName(List<String> names) {
        var name = ctx.expect(IDENT);
        if (name.isFailure()) {
            return name.propagate();
        }
        var token = name.unwrap();
        if (names.contains(token.text())) {
            return ctx.invalidDeclaration(token.span(), "Variable '" + token.text() + "' is declared twice");
        }
        names.add(token.text());
        return ParseResult.success(token.text());
    }

    private ParseResult<AstNode> parseInitializer(Declaration.Type type) {
        return type == Declaration.Type.INT
               ? expressions.parseExpr().map(AstNode.class::cast)
               : expressions.parseLogic().map(AstNode.class::cast);
    }

    private static TokenKind keywordOf(Declaration.Type type) {
        return type == Declaration.Type.INT
               ? TokenKind.INT
               : TokenKind.BOOL;
    }

    // === Identifier statements ===

    /**
     * {@code IDENT ('++' | '--') ';'} or an assignment statement.
     */
    public ParseResult<Statement> parseIdentStatement() {
        var mark = ctx.mark();
        var increment = expressions.parseIncrement();
        if (increment.isSuccess()) {
            var semicolon = ctx.expect(SEMICOLON);
            if (semicolon.isFailure()) {
                return semicolon.propagate();
            }
            return statement(increment);
        }
        ctx.rewind(mark, "identifier is not followed by '++' or '--'");

        var assignment = parseAssignment(SEMICOLON);
        if (assignment.isFailure()) {
            return assignment.propagate();
        }
        var semicolon = ctx.expect(SEMICOLON);
        if (semicolon.isFailure()) {
            return semicolon.propagate();
        }
        return statement(assignment);
    }

    /**
     * {@code IDENT op rhs}, without its terminator. Plain {@code =} takes a boolean right-hand
     * side when one parses and is followed by one of {@code terminators}, otherwise an arithmetic
     * one; compound operators take arithmetic only.
     */
    public ParseResult<Assignment> parseAssignment(TokenKind... terminators) {
        var start = ctx.location();
        var name = ctx.expect(IDENT);
        if (name.isFailure()) {
            return name.propagate();
        }
        var target = new Final(name.unwrap().span(), Final.Kind.IDENT, name.unwrap().text());

        var operator = assignmentOperator(ctx.current().kind());
        if (operator.isEmpty()) {
            return ctx.unexpected("assignment operator");
        }
        ctx.advance();

        SyntaxError booleanError = null;
        if (operator.get() == Assignment.Operator.ASSIGN) {
            var mark = ctx.mark();
            var condition = expressions.parseLogic();
            if (condition.isSuccess() && ctx.checkAny(terminators)) {
                return ParseResult.success(Assignment.bool(ctx.spanFrom(start), target, condition.unwrap()));
            }
            if (condition.isFailure()) {
                booleanError = condition.error();
            }
            ctx.rewind(mark, "right-hand side of '=' is arithmetic");
        }

        var value = expressions.parseExpr();
        if (value.isFailure()) {
            return booleanError == null
                   ? value.propagate()
                   : ParseResult.failure(ParsingContext.furthest(booleanError, value.error()));
        }
        // report whichever side got further
        if (booleanError != null && !ctx.checkAny(terminators) && ctx.isBeyondCurrent(booleanError)) {
            return ParseResult.failure(booleanError);
        }
        return ParseResult.success(Assignment.arithmetic(ctx.spanFrom(start), target, operator.get(), value.unwrap()));
    }

    private static Optional<Assignment.Operator> assignmentOperator(TokenKind kind) {
        return switch (kind) {
            case ASSIGN -> Optional.of(Assignment.Operator.ASSIGN);
            case PLUS_ASSIGN -> Optional.of(Assignment.Operator.ADD_ASSIGN);
            case MINUS_ASSIGN -> Optional.of(Assignment.Operator.SUB_ASSIGN);
            case STAR_ASSIGN -> Optional.of(Assignment.Operator.MUL_ASSIGN);
            case SLASH_ASSIGN -> Optional.of(Assignment.Operator.DIV_ASSIGN);
            default -> Optional.empty();
        };
    }

    // === Print ===

    /**
     * {@code 'print' '(' expr ')' ';'}
     */
    public ParseResult<PrintStmt> parsePrint() {
        var start = ctx.location();
        var keyword = ctx.expect(PRINT);
        if (keyword.isFailure()) {
            return keyword.propagate();
        }
        var open = ctx.expect(LPAREN);
        if (open.isFailure()) {
            return open.propagate();
        }
        var expression = expressions.parseExpr();
        if (expression.isFailure()) {
            return expression.propagate();
        }
        var close = ctx.expect(RPAREN);
        if (close.isFailure()) {
            return close.propagate();
        }
        var semicolon = ctx.expect(SEMICOLON);
        if (semicolon.isFailure()) {
            return semicolon.propagate();
        }
        return ParseResult.success(new PrintStmt(ctx.spanFrom(start), expression.unwrap()));
    }

    private static ParseResult<Statement> statement(ParseResult<? extends Statement> result) {
        return result.map(Statement.class::cast);
    }
}
