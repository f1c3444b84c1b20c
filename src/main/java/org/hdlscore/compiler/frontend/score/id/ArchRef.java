package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies an architecture body.
 */
public record ArchRef(int id) implements NodeRef, ScopeRef {

    @Override
    public NodeKind kind() {
        return NodeKind.ARCH;
    }
}
