package org.hdlscore.compiler.model;

import java.util.Locale;

/**
 * A name that can be looked up in a definitions table: either an identifier or a
 * character literal such as {@code '0'}.
 * <p>
 * Identifiers are case-insensitive and stored folded to lower case. Character
 * literals are case-sensitive and kept verbatim.
 *
 * @param text      The folded identifier, or the single character of a character literal.
 * @param character {@code true} for a character literal.
 */
public record ResolvableName(String text, boolean character) {

    public ResolvableName {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Name must not be empty");
        }
        if (character && text.length() != 1) {
            throw new IllegalArgumentException("Character literal must be a single character: " + text);
        }
    }

    /**
     * Creates an identifier name, folding it to lower case.
     */
    public static ResolvableName ident(String text) {
        return new ResolvableName(text.toLowerCase(Locale.ROOT), false);
    }

    /**
     * Creates a character literal name.
     */
    public static ResolvableName bit(char c) {
        return new ResolvableName(String.valueOf(c), true);
    }

    @Override
    public String toString() {
        return character ? "'" + text + "'" : text;
    }
}
