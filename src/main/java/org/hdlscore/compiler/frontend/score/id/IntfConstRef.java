package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies one generic constant of an entity.
 */
public record IntfConstRef(int id) implements NodeRef {

    @Override
    public NodeKind kind() {
        return NodeKind.INTF_CONST;
    }
}
