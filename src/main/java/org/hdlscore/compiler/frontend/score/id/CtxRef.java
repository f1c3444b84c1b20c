package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a context declaration.
 */
public record CtxRef(int id) implements NodeRef, Def {

    @Override
    public NodeKind kind() {
        return NodeKind.CTX;
    }
}
