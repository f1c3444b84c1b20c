package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * A constraint following a type mark.
 */
public sealed interface ConstraintNode permits ConstraintNode.RangeConstraint, ConstraintNode.ArrayConstraint, ConstraintNode.RecordConstraint {

    Span span();

    /** {@code range <range expression>} */
    record RangeConstraint(Span span, ExprNode range) implements ConstraintNode {}

    /**
     * {@code (<index>, ...)(<element constraint>)}
     *
     * @param index   The index ranges, or {@code null} for {@code (open)}.
     * @param element The element constraint (array or record), or {@code null}.
     */
    record ArrayConstraint(Span span, List<ExprNode> index, ConstraintNode element) implements ConstraintNode {
        public ArrayConstraint {
            index = index == null ? null : List.copyOf(index);
        }
    }

    /** {@code (<field> <constraint>, ...)} */
    record RecordConstraint(Span span, List<ElementConstraint> elements) implements ConstraintNode {
        public RecordConstraint {
            elements = List.copyOf(elements);
        }
    }

    /** One field of a record constraint. */
    record ElementConstraint(AstIdent field, ConstraintNode constraint) {}
}
