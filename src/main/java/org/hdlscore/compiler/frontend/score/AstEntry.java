package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.frontend.score.id.ScopeRef;

import java.util.Optional;

/**
 * A syntax node together with the scope it appears in.
 *
 * @param parent The enclosing scope; absent for libraries only.
 * @param node   The syntax node.
 * @param <T>    The node type.
 */
public record AstEntry<T>(Optional<ScopeRef> parent, T node) {

    /**
     * @throws IllegalStateException if the node has no parent.
     */
    public ScopeRef requireParent() {
        return parent.orElseThrow(() -> new IllegalStateException("Node has no parent: " + node));
    }
}
