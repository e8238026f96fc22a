package org.pragmatica.minilang.lexer;

import org.pragmatica.minilang.tree.SourceLocation;
import org.pragmatica.minilang.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scanner for MiniLang source text.
 *
 * <p>Unrecognized input does not stop scanning: it becomes an {@link TokenKind#ERROR}
 * token whose text is the message, and the parser reports it when it gets there.
 */
public final class Lexer {
    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    public static final int DEFAULT_MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private final String input;
    private int pos;
    private int line;
    private int column;

    private Lexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) {
        return tokenize(input, DEFAULT_MAX_INPUT_SIZE);
    }

    public static List<Token> tokenize(String input, int maxInputSize) {
        if (input.length() > maxInputSize) {
            throw new IllegalArgumentException(
                "Source exceeds maximum size of " + maxInputSize + " characters");
        }
        var tokens = new Lexer(input).tokenizeAll();
        LOG.trace("Scanned {} tokens", tokens.size());
        return tokens;
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (!isAtEnd()) {
            skipWhitespaceAndComments();
            if (!isAtEnd()) {
                tokens.add(nextToken());
            }
        }
        tokens.add(Token.eof(currentLocation()));
        return tokens;
    }

    private Token nextToken() {
        var start = currentLocation();
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanWord(start);
        }
        if (isDigit(c)) {
            return scanNumber(start);
        }
        return scanOperator(start);
    }

    private Token scanWord(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var word = sb.toString();
        var kind = TokenKind.keyword(word).orElse(TokenKind.IDENT);
        return Token.of(kind, word, span(start));
    }

    private Token scanNumber(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        return Token.of(TokenKind.NUMBER, sb.toString(), span(start));
    }

    private Token scanOperator(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case ';' -> token(TokenKind.SEMICOLON, start);
            case ',' -> token(TokenKind.COMMA, start);
            case ':' -> token(TokenKind.COLON, start);
            case '(' -> token(TokenKind.LPAREN, start);
            case ')' -> token(TokenKind.RPAREN, start);
            case '%' -> token(TokenKind.PERCENT, start);
            case '^' -> token(TokenKind.CARET, start);
            case '+' -> {
                if (match('+')) {
                    yield token(TokenKind.PLUS_PLUS, start);
                }
                yield match('=')
                      ? token(TokenKind.PLUS_ASSIGN, start)
                      : token(TokenKind.PLUS, start);
            }
            case '-' -> {
                if (match('-')) {
                    yield token(TokenKind.MINUS_MINUS, start);
                }
                yield match('=')
                      ? token(TokenKind.MINUS_ASSIGN, start)
                      : token(TokenKind.MINUS, start);
            }
            case '*' -> match('=')
                        ? token(TokenKind.STAR_ASSIGN, start)
                        : token(TokenKind.STAR, start);
            case '/' -> match('=')
                        ? token(TokenKind.SLASH_ASSIGN, start)
                        : token(TokenKind.SLASH, start);
            case '=' -> match('=')
                        ? token(TokenKind.EQ, start)
                        : token(TokenKind.ASSIGN, start);
            case '>' -> match('=')
                        ? token(TokenKind.GE, start)
                        : token(TokenKind.GT, start);
            case '<' -> match('=')
                        ? token(TokenKind.LE, start)
                        : token(TokenKind.LT, start);
            case '!' -> match('=')
                        ? token(TokenKind.NEQ, start)
                        : error(start, "Unexpected character '!', did you mean '!='?");
            case '&' -> match('&')
                        ? token(TokenKind.AND, start)
                        : error(start, "Unexpected character '&', did you mean '&&'?");
            case '|' -> match('|')
                        ? token(TokenKind.OR, start)
                        : error(start, "Unexpected character '|', did you mean '||'?");
            default -> error(start, "Unexpected character: " + c);
        };
    }

    private Token token(TokenKind kind, SourceLocation start) {
        var span = span(start);
        return Token.of(kind, span.extract(input), span);
    }

    private Token error(SourceLocation start, String message) {
        return Token.of(TokenKind.ERROR, message, span(start));
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
                // Line comment
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean match(char expected) {
        if (isAtEnd() || peek() != expected) {
            return false;
        }
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
