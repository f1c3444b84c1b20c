package org.hdlscore.compiler.frontend.score.id;

/**
 * A literal of a predefined enumeration type.
 *
 * @param type  The predefined enumeration type.
 * @param index The position of the literal within the type.
 */
public record BuiltinEnumRef(BuiltinTypeRef type, int index) implements Def {

    @Override
    public boolean isOverloadable() {
        return true;
    }
}
