package org.pragmatica.minilang.parser;

import org.pragmatica.minilang.lexer.TokenStream;
import org.pragmatica.minilang.tree.AstNode.Program;

/**
 * Parser interface - turns MiniLang tokens into a program tree.
 */
public interface Parser {

    /**
     * Parse a whole token stream. On failure the stream is left at its end-of-input token.
     */
    ParseResult<Program> parse(TokenStream tokens);

    /**
     * Scan and parse source text.
     */
    ParseResult<Program> parse(String source);
}
