package org.pragmatica.minilang.parser;

import org.pragmatica.minilang.error.SyntaxError;
import org.pragmatica.minilang.lexer.Token;
import org.pragmatica.minilang.lexer.TokenKind;
import org.pragmatica.minilang.lexer.TokenStream;
import org.pragmatica.minilang.tree.SourceLocation;
import org.pragmatica.minilang.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Mutable state of one parse: the token cursor, the end of the last consumed token
 * and the current nesting depth.
 *
 * <p>Depth counts both recursive rules entered through {@link #nested} and operators
 * folded into a chain, so it bounds the depth of the tree being built.
 */
public final class ParsingContext {
    private static final Logger LOG = LoggerFactory.getLogger(ParsingContext.class);

    private final TokenStream tokens;
    private final ParserConfig config;

    private SourceLocation previousEnd;
    private int depth;

    /**
     * Saved position for backtracking.
     */
    public record Mark(TokenStream.Checkpoint checkpoint, SourceLocation previousEnd) {}

    private ParsingContext(TokenStream tokens, ParserConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.previousEnd = tokens.current().location();
        this.depth = 0;
    }

    public static ParsingContext create(TokenStream tokens, ParserConfig config) {
        return new ParsingContext(tokens, config);
    }

    // === Token Access ===

    public Token current() {
        return tokens.current();
    }

    public boolean check(TokenKind kind) {
        return tokens.isKind(kind);
    }

    public boolean checkAny(TokenKind... kinds) {
        return tokens.isOneOf(kinds);
    }

    public boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    /**
     * Consume the current token and return it.
     */
    public Token advance() {
        var token = tokens.current();
        if (!token.is(TokenKind.EOF)) {
            previousEnd = token.span().end();
        }
        tokens.advance();
        return token;
    }

    /**
     * Consume a token of the given kind, or fail without moving.
     */
    public ParseResult<Token> expect(TokenKind kind) {
        if (check(kind)) {
            return ParseResult.success(advance());
        }
        return unexpected(kind.display());
    }

    // === Spans ===

    public SourceLocation location() {
        return tokens.current().location();
    }

    /**
     * Span from {@code start} to the end of the last consumed token.
     */
    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, previousEnd);
    }

    // === Backtracking ===

    public Mark mark() {
        return new Mark(tokens.checkpoint(), previousEnd);
    }

    public void rewind(Mark mark, String reason) {
        LOG.trace("Backtracking from {} to token {}: {}", location(), mark.checkpoint().position(), reason);
        tokens.rewind(mark.checkpoint());
        previousEnd = mark.previousEnd();
    }

    // === Nesting ===

    /**
     * Run a rule one nesting level deeper, failing once the configured limit is passed.
     */
    public <T> ParseResult<T> nested(Supplier<ParseResult<T>> rule) {
        if (depth >= config.maxNestingDepth()) {
            return ParseResult.failure(new SyntaxError.NestingTooDeep(current().span(), config.maxNestingDepth()));
        }
        depth++;
        try {
            return rule.get();
        } finally {
            depth--;
        }
    }

    /**
     * Claim one level for an operator about to be folded into a left-associative chain.
     * The caller gives its levels back with {@link #release(int)} once the chain is done.
     */
    public Optional<SyntaxError> deepen() {
        if (depth >= config.maxNestingDepth()) {
            return Optional.of(new SyntaxError.NestingTooDeep(current().span(), config.maxNestingDepth()));
        }
        depth++;
        return Optional.empty();
    }

    public void release(int levels) {
        depth -= levels;
    }

    // === Errors ===

    /**
     * Failure describing the current token as not being what {@code expected} names.
     */
    public <T> ParseResult<T> unexpected(String expected) {
        var token = current();
        if (token.is(TokenKind.EOF)) {
            return ParseResult.failure(new SyntaxError.UnexpectedEndOfInput(token.span(), expected));
        }
        if (token.is(TokenKind.ERROR)) {
            return ParseResult.failure(new SyntaxError.LexicalError(token.span(), token.text()));
        }
        return ParseResult.failure(new SyntaxError.UnexpectedToken(token.span(), token.describe(), expected));
    }

    public <T> ParseResult<T> invalidDeclaration(SourceSpan span, String reason) {
        return ParseResult.failure(new SyntaxError.InvalidDeclaration(span, reason));
    }

    /**
     * Of two failed alternatives, the one that got further into the input; ties go to {@code first}.
     */
    public static SyntaxError furthest(SyntaxError first, SyntaxError second) {
        return second.location().offset() > first.location().offset()
               ? second
               : first;
    }

    /**
     * Whether {@code error} lies past the current token.
     */
    public boolean isBeyondCurrent(SyntaxError error) {
        return error.location().offset() > location().offset();
    }
}
