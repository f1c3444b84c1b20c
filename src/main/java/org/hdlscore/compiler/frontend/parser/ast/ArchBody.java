package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * {@code architecture <name> of <entity> is <decls> begin <stmts> end;}
 */
public record ArchBody(Span span, AstIdent name, AstIdent entity, List<DeclItem> decls, List<ConcStmtNode> stmts) implements DesignUnit {
    public ArchBody {
        decls = List.copyOf(decls);
        stmts = List.copyOf(stmts);
    }
}
