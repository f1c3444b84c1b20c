package org.hdlscore.compiler.model;

/**
 * A half-open character range {@code [begin, end)} within a named source.
 *
 * @param source The name of the source file the range belongs to.
 * @param begin  The offset of the first character.
 * @param end    The offset one past the last character.
 */
public record Span(String source, int begin, int end) {

    /** Placeholder span for definitions that have no source text, such as builtin types. */
    public static final Span BUILTIN = new Span("<builtin>", 0, 0);

    public Span {
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("Invalid span [" + begin + ", " + end + ") in " + source);
        }
    }

    /**
     * Returns the smallest span covering both this and {@code other}.
     * Both spans must refer to the same source.
     *
     * @param other The span to merge with.
     * @return The covering span.
     */
    public Span union(Span other) {
        if (!source.equals(other.source)) {
            throw new IllegalArgumentException("Cannot merge spans of " + source + " and " + other.source);
        }
        return new Span(source, Math.min(begin, other.begin), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return source + ":" + begin + "-" + end;
    }
}
