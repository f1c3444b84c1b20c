package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a type declaration.
 */
public record TypeDeclRef(int id) implements NodeRef, Def, DeclInPkgRef, DeclInBlockRef, TypeMarkRef {

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_DECL;
    }
}
