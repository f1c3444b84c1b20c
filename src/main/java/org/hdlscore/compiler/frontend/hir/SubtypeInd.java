package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.TypeMarkRef;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;

/**
 * A subtype indication: a resolved type mark plus an optional constraint.
 */
public record SubtypeInd(Span span, Spanned<TypeMarkRef> typeMark, Constraint constraint) {
}
