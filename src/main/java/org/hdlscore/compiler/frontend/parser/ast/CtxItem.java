package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * A context item preceding a design unit.
 */
public sealed interface CtxItem permits CtxItem.LibClause, CtxItem.UseClause, CtxItem.ContextRef {

    Span span();

    /** {@code library a, b;} */
    record LibClause(Span span, List<AstIdent> names) implements CtxItem {
        public LibClause {
            names = List.copyOf(names);
        }
    }

    /** {@code use a.b.all, c.d;} */
    record UseClause(Span span, List<CompoundName> names) implements CtxItem {
        public UseClause {
            names = List.copyOf(names);
        }
    }

    /** {@code context lib.ctx;} */
    record ContextRef(Span span, List<CompoundName> names) implements CtxItem {
        public ContextRef {
            names = List.copyOf(names);
        }
    }
}
