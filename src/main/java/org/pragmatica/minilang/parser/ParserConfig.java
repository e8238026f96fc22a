package org.pragmatica.minilang.parser;

import org.pragmatica.minilang.lexer.Lexer;

/**
 * Parser limits.
 *
 * @param maxInputSize    largest source text, in characters, the scanner accepts
 * @param maxNestingDepth deepest expression tree accepted, counting parentheses, negations,
 *                        exponents and operators folded into a chain
 */
public record ParserConfig(int maxInputSize, int maxNestingDepth) {

    public static final ParserConfig DEFAULT = new ParserConfig(Lexer.DEFAULT_MAX_INPUT_SIZE, 256);

    public ParserConfig {
        if (maxInputSize < 1) {
            throw new IllegalArgumentException("maxInputSize must be positive, got " + maxInputSize);
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
    }

    public ParserConfig withMaxInputSize(int size) {
        return new ParserConfig(size, maxNestingDepth);
    }

    public ParserConfig withMaxNestingDepth(int depth) {
        return new ParserConfig(maxInputSize, depth);
    }
}
