package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies an entity declaration.
 */
public record EntityRef(int id) implements NodeRef, ScopeRef, Def {

    @Override
    public NodeKind kind() {
        return NodeKind.ENTITY;
    }
}
