package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * {@code configuration <name> of <entity> is ... end;} The body is opaque here.
 */
public record CfgDecl(Span span, AstIdent name, AstIdent entity) implements DesignUnit {
}
