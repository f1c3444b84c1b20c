package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies one variable introduced by a variable declaration.
 */
public record VarDeclRef(int id) implements NodeRef, Def, ObjectDeclRef {

    @Override
    public NodeKind kind() {
        return NodeKind.VAR_DECL;
    }
}
