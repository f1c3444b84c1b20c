package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * {@code package body <name> is <decls> end;}
 */
public record PkgBody(Span span, AstIdent name, List<DeclItem> decls) implements DesignUnit {
    public PkgBody {
        decls = List.copyOf(decls);
    }
}
