package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;

/**
 * An identifier or character literal as it appears in the source.
 *
 * @param span The location of the identifier.
 * @param name The (case-folded) name.
 */
public record AstIdent(Span span, ResolvableName name) {

    public static AstIdent ident(Span span, String text) {
        return new AstIdent(span, ResolvableName.ident(text));
    }

    public static AstIdent bit(Span span, char c) {
        return new AstIdent(span, ResolvableName.bit(c));
    }

    public Spanned<ResolvableName> spanned() {
        return new Spanned<>(name, span);
    }
}
