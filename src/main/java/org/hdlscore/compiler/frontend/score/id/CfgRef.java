package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a configuration declaration.
 */
public record CfgRef(int id) implements NodeRef, Def {

    @Override
    public NodeKind kind() {
        return NodeKind.CFG;
    }
}
