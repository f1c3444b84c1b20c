package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * A subtype indication: a type mark with an optional constraint.
 *
 * @param constraint The constraint, or {@code null}.
 */
public record SubtypeIndNode(Span span, CompoundName typeMark, ConstraintNode constraint) {
}
