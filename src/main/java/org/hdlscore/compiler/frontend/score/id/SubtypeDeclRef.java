package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a subtype declaration.
 */
public record SubtypeDeclRef(int id) implements NodeRef, Def, DeclInPkgRef, DeclInBlockRef, TypeMarkRef {

    @Override
    public NodeKind kind() {
        return NodeKind.SUBTYPE_DECL;
    }
}
