package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * {@code package <name> is new <target> generic map (...);}
 */
public record PkgInst(Span span, AstIdent name, CompoundName target) implements DesignUnit, DeclItem {
}
