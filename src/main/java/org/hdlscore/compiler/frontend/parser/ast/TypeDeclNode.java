package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * {@code type <name> [is <definition>];}
 *
 * @param definition The type definition, or {@code null} for an incomplete type declaration.
 */
public record TypeDeclNode(Span span, AstIdent name, TypeDefNode definition) implements DeclItem {
}
