package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a package body.
 */
public record PkgBodyRef(int id) implements NodeRef {

    @Override
    public NodeKind kind() {
        return NodeKind.PKG_BODY;
    }
}
