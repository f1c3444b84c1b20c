package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * An expression as parsed.
 */
public sealed interface ExprNode permits ExprNode.NameExpr, ExprNode.IntLit, ExprNode.RealLit, ExprNode.Unary,
        ExprNode.Binary, ExprNode.Range, ExprNode.Paren {

    Span span();

    /** A name, including character literals and selected or attribute names. */
    record NameExpr(CompoundName name) implements ExprNode {
        @Override
        public Span span() {
            return name.span();
        }
    }

    record IntLit(Span span, BigInteger value) implements ExprNode {}

    record RealLit(Span span, BigDecimal value) implements ExprNode {}

    record Unary(Span span, UnaryOp op, ExprNode arg) implements ExprNode {}

    record Binary(Span span, BinaryOp op, ExprNode lhs, ExprNode rhs) implements ExprNode {}

    /** {@code <lo> to|downto <hi>} */
    record Range(Span span, Dir dir, ExprNode lo, ExprNode hi) implements ExprNode {}

    record Paren(Span span, ExprNode inner) implements ExprNode {}
}
