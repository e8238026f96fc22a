package org.pragmatica.minilang.lexer;

import java.util.List;

/**
 * Token source consumed by the parser: a current token, forward movement and
 * checkpoints for bounded backtracking.
 *
 * <p>A stream always terminates in an {@link TokenKind#EOF} token; once reached,
 * {@link #advance()} leaves the stream there.
 */
public interface TokenStream {

    /**
     * Opaque saved cursor position.
     */
    record Checkpoint(int position) {}

    Token current();

    void advance();

    default boolean isKind(TokenKind kind) {
        return current().is(kind);
    }

    default boolean isOneOf(TokenKind... kinds) {
        var actual = current().kind();
        for (var kind : kinds) {
            if (actual == kind) {
                return true;
            }
        }
        return false;
    }

    default boolean isAtEnd() {
        return isKind(TokenKind.EOF);
    }

    Checkpoint checkpoint();

    void rewind(Checkpoint checkpoint);

    /**
     * Discard everything up to the end-of-input token.
     */
    default void skipToEnd() {
        while (!isAtEnd()) {
            advance();
        }
    }

    static TokenStream of(List<Token> tokens) {
        return TokenCursor.over(tokens);
    }

    static TokenStream tokenize(String source) {
        return TokenCursor.over(Lexer.tokenize(source));
    }
}
