package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * The definition part of a type declaration.
 */
public sealed interface TypeDefNode permits TypeDefNode.EnumDef, TypeDefNode.RangeDef {

    Span span();

    /** {@code (A, B, '0')} */
    record EnumDef(Span span, List<AstIdent> literals) implements TypeDefNode {
        public EnumDef {
            literals = List.copyOf(literals);
        }
    }

    /** {@code range <lo> to|downto <hi>} */
    record RangeDef(Span span, Dir dir, ExprNode lo, ExprNode hi) implements TypeDefNode {}
}
