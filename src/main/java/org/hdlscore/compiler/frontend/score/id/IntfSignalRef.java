package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies one port of an entity.
 */
public record IntfSignalRef(int id) implements NodeRef {

    @Override
    public NodeKind kind() {
        return NodeKind.INTF_SIGNAL;
    }
}
