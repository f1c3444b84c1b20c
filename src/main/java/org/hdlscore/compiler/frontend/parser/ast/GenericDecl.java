package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * An interface constant declaration in an entity's generic clause.
 *
 * @param init The default value, or {@code null}.
 */
public record GenericDecl(Span span, List<AstIdent> names, SubtypeIndNode subtype, ExprNode init) {
    public GenericDecl {
        names = List.copyOf(names);
    }
}
