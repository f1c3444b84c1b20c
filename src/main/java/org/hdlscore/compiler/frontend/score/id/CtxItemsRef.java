package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies the context items preceding one design unit.
 */
public record CtxItemsRef(int id) implements NodeRef, ScopeRef {

    @Override
    public NodeKind kind() {
        return NodeKind.CTX_ITEMS;
    }
}
