package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * A library unit: the part of a design unit that follows its context items.
 */
public sealed interface DesignUnit permits EntityDecl, ArchBody, PkgDecl, PkgBody, PkgInst, CfgDecl, CtxDecl {

    AstIdent name();

    Span span();
}
