package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * {@code subtype <name> is <subtype indication>;}
 */
public record SubtypeDeclNode(Span span, AstIdent name, SubtypeIndNode subtype) implements DeclItem {
}
