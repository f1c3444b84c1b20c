package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies one constant introduced by a constant declaration.
 */
public record ConstDeclRef(int id) implements NodeRef, Def, ObjectDeclRef {

    @Override
    public NodeKind kind() {
        return NodeKind.CONST_DECL;
    }
}
