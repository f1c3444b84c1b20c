package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * {@code package <name> is [generic (...);] <decls> end;} Appears as a design unit or nested in
 * another package.
 */
public record PkgDecl(Span span, AstIdent name, List<GenericDecl> generics, List<DeclItem> decls)
        implements DesignUnit, DeclItem {
    public PkgDecl {
        generics = List.copyOf(generics);
        decls = List.copyOf(decls);
    }
}
