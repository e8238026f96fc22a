package org.pragmatica.minilang.error;

import org.pragmatica.minilang.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Syntax error rendered against its source text.
 *
 * <p>Example output:
 * <pre>
 * error: unexpected token
 *   --> main.ml:2:9
 *   |
 * 2 | x = 1 + ;
 *   |         ^ found ';'
 *   |
 *   = help: expected expression
 * </pre>
 *
 * @param message primary message
 * @param span    where the error occurred
 * @param labels  underlined spans
 * @param notes   trailing notes and help lines
 */
public record Diagnostic(String message, SourceSpan span, List<Label> labels, List<String> notes) {

    /**
     * An underlined span with its caption.
     */
    public record Label(SourceSpan span, String message) {}

    public Diagnostic {
        labels = List.copyOf(labels);
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String caption) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(span, caption));
        return new Diagnostic(message, span, newLabels, notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, labels, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Render with source excerpt and underlines.
     *
     * @param source   the text the span points into
     * @param filename shown after {@code -->}; may be null
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        for (var label : labels) {
            minLine = Math.min(minLine, label.span().start().line());
            maxLine = Math.max(maxLine, label.span().end().line());
        }
        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append("\n");

            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ");
                sb.append(underlines(lineNum, lineContent, lineLabels));
                sb.append("\n");
            }
        }
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code file:line:column: error: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: error: %s", filename, loc.line(), loc.column(), message);
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && span.start().line() <= lineNum && span.end().line() >= lineNum) {
            result.add(new Label(span, ""));
        }
        for (var label : labels) {
            if (label.span().start().line() <= lineNum && label.span().end().line() >= lineNum) {
                result.add(label);
            }
        }
        return result;
    }

    private String underlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        var sorted = lineLabels.stream()
                               .sorted(Comparator.comparingInt(label -> label.span().start().column()))
                               .toList();
        for (var label : sorted) {
            int startCol = label.span().start().line() == lineNum
                           ? label.span().start().column()
                           : 1;
            int endCol = label.span().end().line() == lineNum
                         ? label.span().end().column()
                         : lineContent.length() + 1;
            while (currentCol < startCol) {
                sb.append(' ');
                currentCol++;
            }
            // Zero-width spans (end of input) still get one marker
            int width = Math.max(1, endCol - startCol);
            sb.append("^".repeat(width));
            currentCol += width;
            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
            }
        }
        return sb.toString();
    }
}
