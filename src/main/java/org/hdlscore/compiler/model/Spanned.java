package org.hdlscore.compiler.model;

/**
 * Attaches a source span to a value.
 *
 * @param value The wrapped value.
 * @param span  Where the value appears in the source.
 * @param <T>   The value type.
 */
public record Spanned<T>(T value, Span span) {

    @Override
    public String toString() {
        return value + "@" + span;
    }
}
