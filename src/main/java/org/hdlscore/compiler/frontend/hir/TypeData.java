package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.parser.ast.Dir;
import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;

import java.util.List;

/**
 * The definition part of a type declaration.
 */
public sealed interface TypeData permits TypeData.RangeType, TypeData.EnumType {

    Span span();

    /**
     * An integer, floating point or physical type.
     */
    record RangeType(Span span, Dir dir, ExprRef lo, ExprRef hi) implements TypeData {}

    /**
     * An enumeration type. Literals are identifiers or character literals.
     */
    record EnumType(Span span, List<Spanned<ResolvableName>> literals) implements TypeData {
        public EnumType {
            literals = List.copyOf(literals);
        }
    }
}
