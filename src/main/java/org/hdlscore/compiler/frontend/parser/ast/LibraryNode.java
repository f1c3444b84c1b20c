package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.ResolvableName;

import java.util.List;

/**
 * The design units compiled into one library, in source order.
 */
public record LibraryNode(ResolvableName name, List<DesignUnitNode> units) {
    public LibraryNode {
        units = List.copyOf(units);
    }
}
