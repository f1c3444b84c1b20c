package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.parser.ast.BinaryOp;
import org.hdlscore.compiler.frontend.parser.ast.Dir;
import org.hdlscore.compiler.frontend.parser.ast.UnaryOp;
import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * The payload of an {@link Expr}. Sub-expressions are referenced by id, never embedded.
 */
public sealed interface ExprData permits ExprData.Name, ExprData.OverloadedName, ExprData.Select, ExprData.Attr,
        ExprData.IntegerLiteral, ExprData.FloatLiteral, ExprData.Unary, ExprData.Binary, ExprData.Range {

    /**
     * A name resolved to exactly one definition.
     *
     * @param span The span of the name in the expression.
     */
    record Name(Def def, Span span) implements ExprData {}

    /**
     * A name denoting several overloadable definitions. Picking one is left to type checking.
     */
    record OverloadedName(List<Spanned<Def>> candidates, Span span) implements ExprData {
        public OverloadedName {
            candidates = List.copyOf(candidates);
        }
    }

    /** A selection, e.g. {@code a.b}. */
    record Select(ExprRef prefix, Spanned<ResolvableName> name) implements ExprData {}

    /** An attribute name, e.g. {@code a'b}. */
    record Attr(ExprRef prefix, Spanned<ResolvableName> name) implements ExprData {}

    record IntegerLiteral(BigInteger value) implements ExprData {}

    record FloatLiteral(BigDecimal value) implements ExprData {}

    record Unary(UnaryOp op, ExprRef arg) implements ExprData {}

    record Binary(BinaryOp op, ExprRef lhs, ExprRef rhs) implements ExprData {}

    record Range(Dir dir, ExprRef lo, ExprRef hi) implements ExprData {}
}
