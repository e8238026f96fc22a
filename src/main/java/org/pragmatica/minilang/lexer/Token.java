package org.pragmatica.minilang.lexer;

import org.pragmatica.minilang.tree.SourceLocation;
import org.pragmatica.minilang.tree.SourceSpan;

/**
 * A classified lexical unit: kind, literal source text and where it came from.
 * For {@link TokenKind#ERROR} tokens the text is the scanner's message.
 */
public record Token(TokenKind kind, String text, SourceSpan span) {

    public static Token of(TokenKind kind, String text, SourceSpan span) {
        return new Token(kind, text, span);
    }

    public static Token eof(SourceLocation location) {
        return new Token(TokenKind.EOF, "", SourceSpan.at(location));
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public SourceLocation location() {
        return span.start();
    }

    /**
     * Description for error messages: the literal text where there is one, otherwise the kind.
     */
    public String describe() {
        return switch (kind) {
            case EOF -> "end of input";
            case ERROR -> "invalid input";
            default -> text;
        };
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + span.start();
    }
}
