package org.hdlscore.compiler.frontend.score.id;

/**
 * Identifies an expression.
 */
public record ExprRef(int id) implements NodeRef {

    @Override
    public NodeKind kind() {
        return NodeKind.EXPR;
    }
}
