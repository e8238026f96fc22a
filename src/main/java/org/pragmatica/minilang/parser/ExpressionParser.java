package org.pragmatica.minilang.parser;

import org.pragmatica.minilang.lexer.Token;
import org.pragmatica.minilang.lexer.TokenKind;
import org.pragmatica.minilang.tree.AstNode.BinaryOp;
import org.pragmatica.minilang.tree.AstNode.Comparison;
import org.pragmatica.minilang.tree.AstNode.Condition;
import org.pragmatica.minilang.tree.AstNode.Expr;
import org.pragmatica.minilang.tree.AstNode.Final;
import org.pragmatica.minilang.tree.AstNode.LogicalExpr;
import org.pragmatica.minilang.tree.AstNode.NegExpr;
import org.pragmatica.minilang.tree.AstNode.SignedNumber;
import org.pragmatica.minilang.tree.AstNode.UnaryOp;

import static org.pragmatica.minilang.lexer.TokenKind.AND;
import static org.pragmatica.minilang.lexer.TokenKind.CARET;
import static org.pragmatica.minilang.lexer.TokenKind.FALSE;
import static org.pragmatica.minilang.lexer.TokenKind.IDENT;
import static org.pragmatica.minilang.lexer.TokenKind.LPAREN;
import static org.pragmatica.minilang.lexer.TokenKind.MINUS;
import static org.pragmatica.minilang.lexer.TokenKind.MINUS_MINUS;
import static org.pragmatica.minilang.lexer.TokenKind.NUMBER;
import static org.pragmatica.minilang.lexer.TokenKind.OR;
import static org.pragmatica.minilang.lexer.TokenKind.PERCENT;
import static org.pragmatica.minilang.lexer.TokenKind.PLUS;
import static org.pragmatica.minilang.lexer.TokenKind.PLUS_PLUS;
import static org.pragmatica.minilang.lexer.TokenKind.RPAREN;
import static org.pragmatica.minilang.lexer.TokenKind.SLASH;
import static org.pragmatica.minilang.lexer.TokenKind.STAR;
import static org.pragmatica.minilang.lexer.TokenKind.TRUE;

/**
 * Arithmetic and boolean expressions.
 *
 * <pre>
 * expr       := term (('+' | '-') term)*
 * term       := factor (('*' | '/' | '%') factor)*
 * factor     := final ('^' factor)?
 * final      := NUMBER | IDENT ('++' | '--')? | ('+' | '-') NUMBER | '-' '(' expr ')' | '(' expr ')'
 *
 * logic      := comparison (('&amp;&amp;' | '||') comparison)*
 * comparison := '(' logic ')' | 'true' | 'false' | IDENT | expr relop expr
 * </pre>
 *
 * The boolean chain knows nothing about statements; {@code &&} and {@code ||} share one
 * left-associative level.
 */
public final class ExpressionParser {

    private final ParsingContext ctx;

    public ExpressionParser(ParsingContext ctx) {
        this.ctx = ctx;
    }

    // === Arithmetic ===

    public ParseResult<Expr> parseExpr() {
        var start = ctx.location();
        var first = parseTerm();
        if (first.isFailure()) {
            return first;
        }
        var expr = first.unwrap();

        var levels = 0;
        try {
            while (ctx.checkAny(PLUS, MINUS)) {
                var tooDeep = ctx.deepen();
                if (tooDeep.isPresent()) {
                    return ParseResult.failure(tooDeep.get());
                }
                levels++;
                var operator = ctx.advance().is(PLUS)
                               ? BinaryOp.Operator.ADD
                               : BinaryOp.Operator.SUB;
                var right = parseTerm();
                if (right.isFailure()) {
                    return right;
                }
                expr = new BinaryOp(ctx.spanFrom(start), operator, expr, right.unwrap());
            }
        } finally {
            ctx.release(levels);
        }
        return ParseResult.success(expr);
    }

    public ParseResult<Expr> parseTerm() {
        var start = ctx.location();
        var first = parseFactor();
        if (first.isFailure()) {
            return first;
        }
        var expr = first.unwrap();

        var levels = 0;
        try {
            while (ctx.checkAny(STAR, SLASH, PERCENT)) {
                var tooDeep = ctx.deepen();
                if (tooDeep.isPresent()) {
                    return ParseResult.failure(tooDeep.get());
                }
                levels++;
                var operator = multiplicative(ctx.advance());
                var right = parseFactor();
                if (right.isFailure()) {
                    return right;
                }
                expr = new BinaryOp(ctx.spanFrom(start), operator, expr, right.unwrap());
            }
        } finally {
            ctx.release(levels);
        }
        return ParseResult.success(expr);
    }

    /**
     * Exponentiation, right-associative: {@code 2^3^2} is {@code 2^(3^2)}.
     */
    public ParseResult<Expr> parseFactor() {
        var start = ctx.location();
        var base = parseFinal();
        if (base.isFailure() || !ctx.check(CARET)) {
            return base;
        }
        ctx.advance();

        var exponent = ctx.nested(this::parseFactor);
        if (exponent.isFailure()) {
            return exponent;
        }
        return ParseResult.success(new BinaryOp(ctx.spanFrom(start), BinaryOp.Operator.POW, base.unwrap(), exponent.unwrap()));
    }

    public ParseResult<Expr> parseFinal() {
        return switch (ctx.current().kind()) {
            case NUMBER -> number();
            case IDENT -> identifierOperand();
            case PLUS -> positiveNumber();
            case MINUS -> negative();
            case LPAREN -> ctx.nested(this::parenthesized);
            default -> ctx.unexpected("expression");
        };
    }

    /**
     * {@code IDENT ('++' | '--')}, the form an increment or decrement statement takes.
     */
    public ParseResult<UnaryOp> parseIncrement() {
        var name = ctx.expect(IDENT);
        if (name.isFailure()) {
            return name.propagate();
        }
        if (!ctx.checkAny(PLUS_PLUS, MINUS_MINUS)) {
            return ctx.unexpected("'++' or '--'");
        }
        return ParseResult.success(unaryOp(name.unwrap(), ctx.advance()));
    }

    private ParseResult<Expr> number() {
        var token = ctx.advance();
        return ParseResult.success(new Final(token.span(), Final.Kind.NUMBER, token.text()));
    }

    private ParseResult<Expr> identifierOperand() {
        var name = ctx.advance();
        if (ctx.checkAny(PLUS_PLUS, MINUS_MINUS)) {
            return ParseResult.success(unaryOp(name, ctx.advance()));
        }
        return ParseResult.success(new Final(name.span(), Final.Kind.IDENT, name.text()));
    }

    private ParseResult<Expr> positiveNumber() {
        var sign = ctx.advance();
        var digits = ctx.expect(NUMBER);
        if (digits.isFailure()) {
            return digits.propagate();
        }
        return ParseResult.success(new SignedNumber(sign.span().to(digits.unwrap().span()),
                                                    SignedNumber.Sign.PLUS,
                                                    digits.unwrap().text()));
    }

    private ParseResult<Expr> negative() {
        var sign = ctx.advance();
        if (ctx.check(NUMBER)) {
            var digits = ctx.advance();
            return ParseResult.success(new SignedNumber(sign.span().to(digits.span()),
                                                        SignedNumber.Sign.MINUS,
                                                        digits.text()));
        }
        if (!ctx.check(LPAREN)) {
            return ctx.unexpected("number or '('");
        }
        var operand = ctx.nested(this::parenthesized);
        if (operand.isFailure()) {
            return operand;
        }
        return ParseResult.success(new NegExpr(ctx.spanFrom(sign.location()), operand.unwrap()));
    }

    private ParseResult<Expr> parenthesized() {
        ctx.advance();
        var inner = parseExpr();
        if (inner.isFailure()) {
            return inner;
        }
        var close = ctx.expect(RPAREN);
        if (close.isFailure()) {
            return close.propagate();
        }
        return inner;
    }

    private static UnaryOp unaryOp(Token name, Token operator) {
        return new UnaryOp(name.span().to(operator.span()),
                           name.text(),
                           operator.is(PLUS_PLUS)
                           ? UnaryOp.Operator.INCREMENT
                           : UnaryOp.Operator.DECREMENT);
    }

    private static BinaryOp.Operator multiplicative(Token token) {
        return switch (token.kind()) {
            case STAR -> BinaryOp.Operator.MUL;
            case SLASH -> BinaryOp.Operator.DIV;
            default -> BinaryOp.Operator.MOD;
        };
    }

    // === Boolean ===

    public ParseResult<Condition> parseLogic() {
        var start = ctx.location();
        var first = parseComparison();
        if (first.isFailure()) {
            return first;
        }
        var condition = first.unwrap();

        // each folded operator adds a level to the left-deep tree
        var levels = 0;
        try {
            while (ctx.checkAny(AND, OR)) {
                var tooDeep = ctx.deepen();
                if (tooDeep.isPresent()) {
                    return ParseResult.failure(tooDeep.get());
                }
                levels++;
                var operator = ctx.advance().is(AND)
                               ? LogicalExpr.Operator.AND
                               : LogicalExpr.Operator.OR;
                var right = parseComparison();
                if (right.isFailure()) {
                    return right;
                }
                condition = new LogicalExpr(ctx.spanFrom(start), operator, condition, right.unwrap());
            }
        } finally {
            ctx.release(levels);
        }
        return ParseResult.success(condition);
    }

    public ParseResult<Condition> parseComparison() {
        if (ctx.checkAny(TRUE, FALSE)) {
            var literal = ctx.advance();
            var operator = literal.is(TRUE)
                           ? Comparison.Operator.LITERAL_TRUE
                           : Comparison.Operator.LITERAL_FALSE;
            return ParseResult.success(Comparison.atom(literal.span(), operator, literal.text()));
        }
        if (!ctx.check(LPAREN)) {
            return relational();
        }

        // '(' may open a grouped condition or the left operand of a relational test
        var mark = ctx.mark();
        var grouped = ctx.nested(this::groupedCondition);
        if (grouped.isSuccess() && !continuesOperand(ctx.current().kind())) {
            return grouped;
        }
        ctx.rewind(mark, "parenthesis opens an arithmetic operand");
        var comparison = relational();
        if (comparison.isFailure() && grouped.isFailure()) {
            return ParseResult.failure(ParsingContext.furthest(grouped.error(), comparison.error()));
        }
        return comparison;
    }

    private ParseResult<Condition> groupedCondition() {
        ctx.advance();
        var inner = parseLogic();
        if (inner.isFailure()) {
            return inner;
        }
        var close = ctx.expect(RPAREN);
        if (close.isFailure()) {
            return close.propagate();
        }
        return inner;
    }

    private ParseResult<Condition> relational() {
        var start = ctx.location();
        var left = parseExpr();
        if (left.isFailure()) {
            return left.propagate();
        }
        if (ctx.current().kind().isRelational()) {
            var operator = relationalOperator(ctx.advance());
            var right = parseExpr();
            if (right.isFailure()) {
                return right.propagate();
            }
            return ParseResult.success(Comparison.relational(ctx.spanFrom(start), operator, left.unwrap(), right.unwrap()));
        }
        if (left.unwrap() instanceof Final name && name.isIdentifier()) {
            return ParseResult.success(Comparison.atom(name.span(), Comparison.Operator.IDENT_REF, name.text()));
        }
        return ctx.unexpected("comparison operator");
    }

    private static boolean continuesOperand(TokenKind kind) {
        return kind.isRelational() || kind.isArithmetic();
    }

    private static Comparison.Operator relationalOperator(Token token) {
        return switch (token.kind()) {
            case EQ -> Comparison.Operator.EQUAL;
            case NEQ -> Comparison.Operator.NOT_EQUAL;
            case GT -> Comparison.Operator.GT;
            case LT -> Comparison.Operator.LT;
            case GE -> Comparison.Operator.GE;
            case LE -> Comparison.Operator.LE;
            default -> throw new IllegalArgumentException("Not a relational operator: " + token.kind());
        };
    }
}
