package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a subtype indication.
 */
public record SubtypeIndRef(int id) implements NodeRef {

    @Override
    public NodeKind kind() {
        return NodeKind.SUBTYPE_IND;
    }
}
