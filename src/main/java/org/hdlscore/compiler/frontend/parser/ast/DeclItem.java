package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * A declaration inside a package or a declarative region of an architecture.
 */
public sealed interface DeclItem permits TypeDeclNode, SubtypeDeclNode, ObjectDeclNode, PkgDecl, PkgInst {

    Span span();
}
