package org.pragmatica.minilang.error;

import org.pragmatica.minilang.tree.SourceLocation;
import org.pragmatica.minilang.tree.SourceSpan;

/**
 * The single error kind of the front end. Every variant is fatal to the current parse.
 */
public sealed interface SyntaxError {

    /**
     * Source range of the offending token.
     */
    SourceSpan span();

    String message();

    default SourceLocation location() {
        return span().start();
    }

    /**
     * Short headline for diagnostics, without location.
     */
    String title();

    default Diagnostic toDiagnostic() {
        return Diagnostic.error(title(), span())
                         .withLabel(message());
    }

    /**
     * A token other than the one the grammar requires here.
     */
    record UnexpectedToken(SourceSpan span, String found, String expected) implements SyntaxError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location() + ", expected " + expected;
        }

        @Override
        public String title() {
            return "unexpected token";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(title(), span)
                             .withLabel("found '" + found + "'")
                             .withHelp("expected " + expected);
        }
    }

    /**
     * Input ended while a construct was still open.
     */
    record UnexpectedEndOfInput(SourceSpan span, String expected) implements SyntaxError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location() + ", expected " + expected;
        }

        @Override
        public String title() {
            return "unexpected end of input";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error(title(), span)
                             .withLabel("input ends here")
                             .withHelp("expected " + expected);
        }
    }

    /**
     * Declaration whose names and initializers do not line up.
     */
    record InvalidDeclaration(SourceSpan span, String reason) implements SyntaxError {
        @Override
        public String message() {
            return reason + " at " + location();
        }

        @Override
        public String title() {
            return "invalid declaration";
        }
    }

    /**
     * Parenthesized or exponent chains deeper than the configured limit.
     */
    record NestingTooDeep(SourceSpan span, int limit) implements SyntaxError {
        @Override
        public String message() {
            return "Expression nesting exceeds " + limit + " levels at " + location();
        }

        @Override
        public String title() {
            return "expression too deeply nested";
        }
    }

    /**
     * Input the scanner could not classify.
     */
    record LexicalError(SourceSpan span, String reason) implements SyntaxError {
        @Override
        public String message() {
            return reason + " at " + location();
        }

        @Override
        public String title() {
            return "invalid input";
        }
    }
}
