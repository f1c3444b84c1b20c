package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a package declaration, either a design unit or nested in another package.
 */
public record PkgDeclRef(int id) implements NodeRef, ScopeRef, Def, DeclInPkgRef {

    @Override
    public NodeKind kind() {
        return NodeKind.PKG_DECL;
    }
}
