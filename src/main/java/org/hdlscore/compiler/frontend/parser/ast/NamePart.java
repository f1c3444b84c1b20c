package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

/**
 * One suffix of a {@link CompoundName} following its primary name.
 */
public sealed interface NamePart permits NamePart.Select, NamePart.SelectAll, NamePart.Attribute, NamePart.Call {

    Span span();

    /** A selected name, e.g. {@code .foo}. */
    record Select(AstIdent ident) implements NamePart {
        @Override
        public Span span() {
            return ident.span();
        }
    }

    /** The {@code .all} suffix. */
    record SelectAll(Span span) implements NamePart {}

    /** An attribute name, e.g. {@code 'length}. */
    record Attribute(AstIdent ident) implements NamePart {
        @Override
        public Span span() {
            return ident.span();
        }
    }

    /** A parenthesized suffix: function call, index or slice. Its contents are opaque here. */
    record Call(Span span) implements NamePart {}
}
