package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a library.
 */
public record LibRef(int id) implements NodeRef, ScopeRef, Def {

    @Override
    public NodeKind kind() {
        return NodeKind.LIB;
    }
}
