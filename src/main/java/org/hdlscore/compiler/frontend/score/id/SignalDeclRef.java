package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies one signal introduced by a signal declaration.
 */
public record SignalDeclRef(int id) implements NodeRef, Def, ObjectDeclRef {

    @Override
    public NodeKind kind() {
        return NodeKind.SIGNAL_DECL;
    }
}
