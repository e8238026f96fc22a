package org.pragmatica.minilang;

import org.pragmatica.minilang.error.SyntaxError;
import org.pragmatica.minilang.lexer.TokenStream;
import org.pragmatica.minilang.parser.ParseResult;
import org.pragmatica.minilang.parser.Parser;
import org.pragmatica.minilang.parser.ParserConfig;
import org.pragmatica.minilang.parser.RecursiveDescentParser;
import org.pragmatica.minilang.tree.AstNode;
import org.pragmatica.minilang.tree.AstNode.Program;
import org.pragmatica.minilang.tree.AstPrinter;
import org.pragmatica.minilang.tree.SourceFormatter;

/**
 * Entry point for parsing MiniLang.
 *
 * <p>Example usage:
 * <pre>{@code
 * var program = MiniLang.parse("""
 *     int x = 1;
 *     if x > 0: begin x += 1; end
 *     """).unwrap();
 *
 * System.out.println(MiniLang.print(program));
 * }</pre>
 */
public final class MiniLang {
    private MiniLang() {}

    /**
     * Scan and parse source text with the default configuration.
     */
    public static ParseResult<Program> parse(String source) {
        return parser().parse(source);
    }

    /**
     * Parse an already scanned token stream with the default configuration.
     */
    public static ParseResult<Program> parse(TokenStream tokens) {
        return parser().parse(tokens);
    }

    public static Parser parser() {
        return RecursiveDescentParser.create();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * S-expression rendering of a tree, e.g. {@code (program (= x (+ 1 2)))}.
     */
    public static String print(AstNode node) {
        return AstPrinter.print(node);
    }

    /**
     * MiniLang source rendering of a tree.
     */
    public static String format(AstNode node) {
        return SourceFormatter.format(node);
    }

    /**
     * Render an error against the source it came from.
     */
    public static String formatError(SyntaxError error, String source, String filename) {
        return error.toDiagnostic()
                    .format(source, filename);
    }

    /**
     * Builder for a configured parser.
     */
    public static final class Builder {
        private ParserConfig config = ParserConfig.DEFAULT;

        private Builder() {}

        public Builder maxInputSize(int size) {
            config = config.withMaxInputSize(size);
            return this;
        }

        public Builder maxNestingDepth(int depth) {
            config = config.withMaxNestingDepth(depth);
            return this;
        }

        public Parser build() {
            return RecursiveDescentParser.create(config);
        }
    }
}
