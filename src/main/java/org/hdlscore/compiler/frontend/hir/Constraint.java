package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The constraint part of a subtype indication.
 */
public sealed interface Constraint permits Constraint.None, Constraint.Range, Constraint.Array, Constraint.Record {

    /** The absence of a constraint. */
    Constraint NONE = new None();

    record None() implements Constraint {}

    /**
     * A range constraint. The expression evaluates to a range.
     */
    record Range(Span span, ExprRef range) implements Constraint {}

    /**
     * An array constraint.
     *
     * @param index   The index constraints, or empty for {@code open}. Each expression evaluates to a
     *                range or denotes a discrete subtype.
     * @param element The constraint of the array elements, if any.
     */
    record Array(Span span, Optional<List<ExprRef>> index, Optional<Constraint> element) implements Constraint {
        public Array {
            index = index.map(List::copyOf);
        }
    }

    /**
     * A record constraint: one constraint per constrained element, in source order.
     */
    record Record(Span span, Map<ResolvableName, Constraint> elements) implements Constraint {
        public Record {
            elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        }
    }
}
