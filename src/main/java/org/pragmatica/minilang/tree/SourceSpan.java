package org.pragmatica.minilang.tree;

/**
 * Source range covered by a token or node, start inclusive, end exclusive.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * Span from the start of this one to the end of {@code last}.
     */
    public SourceSpan to(SourceSpan last) {
        return new SourceSpan(start, last.end);
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
