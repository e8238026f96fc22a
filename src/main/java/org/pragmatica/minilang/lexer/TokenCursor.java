package org.pragmatica.minilang.lexer;

import java.util.List;

/**
 * {@link TokenStream} over an in-memory token list.
 */
public final class TokenCursor implements TokenStream {

    private final List<Token> tokens;
    private int pos;

    private TokenCursor(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Create a cursor positioned at the first token.
     *
     * @throws IllegalArgumentException if the list is empty or does not end in exactly one EOF token
     */
    public static TokenCursor over(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token list must end with an EOF token");
        }
        for (int i = 0; i < tokens.size() - 1; i++) {
            if (tokens.get(i).is(TokenKind.EOF)) {
                throw new IllegalArgumentException("EOF token at index " + i + " is not the last token");
            }
        }
        return new TokenCursor(List.copyOf(tokens));
    }

    @Override
    public Token current() {
        return tokens.get(pos);
    }

    @Override
    public void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    @Override
    public Checkpoint checkpoint() {
        return new Checkpoint(pos);
    }

    @Override
    public void rewind(Checkpoint checkpoint) {
        if (checkpoint.position() < 0 || checkpoint.position() >= tokens.size()) {
            throw new IllegalArgumentException("Checkpoint " + checkpoint.position() + " is outside the stream");
        }
        pos = checkpoint.position();
    }

    @Override
    public void skipToEnd() {
        pos = tokens.size() - 1;
    }

    /**
     * Number of tokens, including the terminating EOF.
     */
    public int size() {
        return tokens.size();
    }
}
