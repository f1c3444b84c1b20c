package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a package instantiation.
 */
public record PkgInstRef(int id) implements NodeRef, ScopeRef, Def, DeclInPkgRef {

    @Override
    public NodeKind kind() {
        return NodeKind.PKG_INST;
    }
}
