package org.pragmatica.minilang.lexer;

import java.util.Map;
import java.util.Optional;

/**
 * Token kinds of MiniLang.
 */
public enum TokenKind {
    // Names and literals
    IDENT("identifier"),
    NUMBER("number"),
    TRUE("'true'"),
    FALSE("'false'"),

    // Keywords
    INT("'int'"),
    BOOL("'bool'"),
    IF("'if'"),
    ELIF("'elif'"),
    ELSE("'else'"),
    WHILE("'while'"),
    FOR("'for'"),
    PRINT("'print'"),
    BEGIN("'begin'"),
    END("'end'"),

    // Punctuation
    SEMICOLON("';'"),
    COMMA("','"),
    COLON("':'"),
    LPAREN("'('"),
    RPAREN("')'"),

    // Assignment
    ASSIGN("'='"),
    PLUS_ASSIGN("'+='"),
    MINUS_ASSIGN("'-='"),
    STAR_ASSIGN("'*='"),
    SLASH_ASSIGN("'/='"),

    // Arithmetic
    PLUS("'+'"),
    MINUS("'-'"),
    STAR("'*'"),
    SLASH("'/'"),
    PERCENT("'%'"),
    CARET("'^'"),
    PLUS_PLUS("'++'"),
    MINUS_MINUS("'--'"),

    // Relational
    EQ("'=='"),
    NEQ("'!='"),
    GT("'>'"),
    LT("'<'"),
    GE("'>='"),
    LE("'<='"),

    // Logical
    AND("'&&'"),
    OR("'||'"),

    // Special
    EOF("end of input"),
    ERROR("invalid input");

    private static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
        Map.entry("int", INT),
        Map.entry("bool", BOOL),
        Map.entry("if", IF),
        Map.entry("elif", ELIF),
        Map.entry("else", ELSE),
        Map.entry("while", WHILE),
        Map.entry("for", FOR),
        Map.entry("print", PRINT),
        Map.entry("begin", BEGIN),
        Map.entry("end", END),
        Map.entry("true", TRUE),
        Map.entry("false", FALSE)
    );

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    /**
     * Human-readable form used in error messages, e.g. {@code ';'} or {@code identifier}.
     */
    public String display() {
        return display;
    }

    public boolean isRelational() {
        return this == EQ || this == NEQ || this == GT || this == LT || this == GE || this == LE;
    }

    public boolean isArithmetic() {
        return this == PLUS || this == MINUS || this == STAR || this == SLASH
            || this == PERCENT || this == CARET;
    }

    /**
     * Keyword kind for a reserved word, or empty for an ordinary identifier.
     */
    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }
}
