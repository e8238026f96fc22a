package org.pragmatica.minilang.parser;

import org.pragmatica.minilang.error.SyntaxError;
import org.pragmatica.minilang.lexer.Lexer;
import org.pragmatica.minilang.lexer.TokenKind;
import org.pragmatica.minilang.lexer.TokenStream;
import org.pragmatica.minilang.tree.AstNode.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hand-written recursive descent parser for MiniLang.
 *
 * <p>Parsing stops at the first syntax error. The failing rule's error is returned and the
 * remaining input is discarded in a single sweep, so no partial program is produced.
 */
public final class RecursiveDescentParser implements Parser {
    private static final Logger LOG = LoggerFactory.getLogger(RecursiveDescentParser.class);

    private final ParserConfig config;

    private RecursiveDescentParser(ParserConfig config) {
        this.config = config;
    }

    public static RecursiveDescentParser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static RecursiveDescentParser create(ParserConfig config) {
        return new RecursiveDescentParser(config);
    }

    @Override
    public ParseResult<Program> parse(TokenStream tokens) {
        LOG.debug("Parsing tokens from {}", tokens.current().location());
        var ctx = ParsingContext.create(tokens, config);
        var result = new StatementParser(ctx, new ExpressionParser(ctx)).parseProgram();

        if (result.isFailure()) {
            tokens.skipToEnd();
            LOG.debug("Parse failed: {}", result.error().message());
            return result;
        }
        LOG.debug("Parsed program with {} statements", result.unwrap().statements().size());
        return result;
    }

    /**
     * Scan and parse source text. A scanner error anywhere in the input fails the parse
     * before any statement is examined.
     */
    @Override
    public ParseResult<Program> parse(String source) {
        var tokens = Lexer.tokenize(source, config.maxInputSize());
        for (var token : tokens) {
            if (token.is(TokenKind.ERROR)) {
                LOG.debug("Scan failed: {} at {}", token.text(), token.location());
                return ParseResult.failure(new SyntaxError.LexicalError(token.span(), token.text()));
            }
        }
        return parse(TokenStream.of(tokens));
    }

    public ParserConfig config() {
        return config;
    }
}
