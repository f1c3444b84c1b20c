package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies one file introduced by a file declaration.
 */
public record FileDeclRef(int id) implements NodeRef, Def, ObjectDeclRef {

    @Override
    public NodeKind kind() {
        return NodeKind.FILE_DECL;
    }
}
