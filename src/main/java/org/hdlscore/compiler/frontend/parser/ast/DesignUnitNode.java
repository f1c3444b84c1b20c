package org.hdlscore.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A design unit as parsed: its context items and the library unit they precede.
 *
 * @param ctxItems The library and use clauses preceding the unit.
 * @param unit     The library unit.
 */
public record DesignUnitNode(List<CtxItem> ctxItems, DesignUnit unit) {
    public DesignUnitNode {
        ctxItems = List.copyOf(ctxItems);
    }
}
