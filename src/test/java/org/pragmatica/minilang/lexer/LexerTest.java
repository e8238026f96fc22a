package org.pragmatica.minilang.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.minilang.lexer.TokenKind.*;

class LexerTest {

    @Test
    void tokenize_declaration_producesKindsAndEof() {
        var tokens = Lexer.tokenize("int x = 10;");

        assertEquals(List.of(INT, IDENT, ASSIGN, NUMBER, SEMICOLON, EOF), kinds(tokens));
        assertEquals("x", tokens.get(1).text());
        assertEquals("10", tokens.get(3).text());
    }

    @Test
    void tokenize_operators_takesLongestMatch() {
        var tokens = Lexer.tokenize("++ += + -- -= - *= * /= / == = != >= > <= < && || % ^");

        assertEquals(List.of(PLUS_PLUS, PLUS_ASSIGN, PLUS,
                             MINUS_MINUS, MINUS_ASSIGN, MINUS,
                             STAR_ASSIGN, STAR, SLASH_ASSIGN, SLASH,
                             EQ, ASSIGN, NEQ, GE, GT, LE, LT,
                             AND, OR, PERCENT, CARET, EOF),
                     kinds(tokens));
    }

    @Test
    void tokenize_keywords_areReservedOnlyAsWholeWords() {
        var tokens = Lexer.tokenize("while whilex true false_ begin end");

        assertEquals(List.of(WHILE, IDENT, TRUE, IDENT, BEGIN, END, EOF), kinds(tokens));
    }

    @Test
    void tokenize_lineComment_isSkipped() {
        var tokens = Lexer.tokenize("x // ignored ; 1 2\ny");

        assertEquals(List.of(IDENT, IDENT, EOF), kinds(tokens));
        var y = tokens.get(1);
        assertEquals(2, y.location().line());
        assertEquals(1, y.location().column());
    }

    @Test
    void tokenize_tracksSpans() {
        var tokens = Lexer.tokenize("ab  12");

        var word = tokens.get(0).span();
        assertEquals(1, word.start().column());
        assertEquals(3, word.end().column());
        assertEquals(0, word.start().offset());
        assertEquals(2, word.end().offset());
        assertEquals(5, tokens.get(1).location().column());
    }

    @Test
    void tokenize_eof_sitsAfterLastCharacter() {
        var eof = Lexer.tokenize("x\n").get(1);

        assertTrue(eof.is(EOF));
        assertEquals(2, eof.location().line());
        assertEquals(1, eof.location().column());
        assertEquals(2, eof.location().offset());
    }

    @Test
    void tokenize_emptyInput_producesOnlyEof() {
        assertEquals(List.of(EOF), kinds(Lexer.tokenize("   \n\t")));
    }

    @Test
    void tokenize_singleAmpersand_producesErrorTokenWithHint() {
        var tokens = Lexer.tokenize("a & b");

        assertEquals(List.of(IDENT, ERROR, IDENT, EOF), kinds(tokens));
        assertEquals("Unexpected character '&', did you mean '&&'?", tokens.get(1).text());
        assertEquals("invalid input", tokens.get(1).describe());
    }

    @Test
    void tokenize_unknownCharacter_producesErrorToken() {
        var token = Lexer.tokenize("@").get(0);

        assertTrue(token.is(ERROR));
        assertEquals("Unexpected character: @", token.text());
    }

    @Test
    void tokenize_inputOverLimit_isRejected() {
        var error = assertThrows(IllegalArgumentException.class, () -> Lexer.tokenize("abc", 2));

        assertTrue(error.getMessage().contains("maximum size of 2"));
    }

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream()
                     .map(Token::kind)
                     .toList();
    }
}
