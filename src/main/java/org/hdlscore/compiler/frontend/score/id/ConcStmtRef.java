package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies a concurrent statement.
 */
public record ConcStmtRef(int id) implements NodeRef {

    @Override
    public NodeKind kind() {
        return NodeKind.CONC_STMT;
    }
}
