package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * {@code context <name> is <items> end;}
 */
public record CtxDecl(Span span, AstIdent name, List<CtxItem> items) implements DesignUnit {
    public CtxDecl {
        items = List.copyOf(items);
    }
}
