package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * An interface signal declaration in an entity's port clause.
 *
 * @param init The default value, or {@code null}.
 */
public record PortDecl(Span span, List<AstIdent> names, IntfMode mode, SubtypeIndNode subtype, boolean bus, ExprNode init) {
    public PortDecl {
        names = List.copyOf(names);
    }
}
