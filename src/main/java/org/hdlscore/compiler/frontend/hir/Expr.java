package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.model.Span;

/**
 * An expression.
 *
 * @param parent The scope names in the expression are resolved in.
 */
public record Expr(ScopeRef parent, Span span, ExprData data) {
}
