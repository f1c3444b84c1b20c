package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * A possibly dotted name such as {@code work.pkg.all}.
 *
 * @param span    The location of the whole name.
 * @param primary The leading simple name.
 * @param parts   The suffixes in source order.
 */
public record CompoundName(Span span, AstIdent primary, List<NamePart> parts) {
    public CompoundName {
        parts = List.copyOf(parts);
    }

    /**
     * @return The name as written, with call arguments elided.
     */
    public String text() {
        StringBuilder sb = new StringBuilder(primary.name().toString());
        for (NamePart part : parts) {
            if (part instanceof NamePart.Select select) {
                sb.append('.').append(select.ident().name());
            } else if (part instanceof NamePart.SelectAll) {
                sb.append(".all");
            } else if (part instanceof NamePart.Attribute attribute) {
                sb.append('\'').append(attribute.ident().name());
            } else {
                sb.append("(...)");
            }
        }
        return sb.toString();
    }
}
