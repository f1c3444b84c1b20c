package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * A concurrent statement. Only its location and optional label are modelled.
 *
 * @param label The statement label, or {@code null}.
 */
public record ConcStmtNode(Span span, AstIdent label) {
}
