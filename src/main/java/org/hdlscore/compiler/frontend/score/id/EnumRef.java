package org.hdlscore.compiler.frontend.score.id;

/**
 * One literal of an enumeration type.
 *
 * @param type  The enumeration type declaring the literal.
 * @param index The position of the literal within the type.
 */
public record EnumRef(TypeDeclRef type, int index) implements Def {

    @Override
    public boolean isOverloadable() {
        return true;
    }
}
