package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.frontend.score.id.CtxItemsRef;
import org.hdlscore.compiler.frontend.score.id.NodeRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps node references to the syntax they were created for. Design units additionally know
 * the context items preceding them, and context items know their design unit.
 */
public final class SyntaxTable {

    private final Map<NodeRef, AstEntry<?>> entries = new HashMap<>();
    private final Map<NodeRef, CtxItemsRef> contexts = new HashMap<>();
    private final Map<CtxItemsRef, NodeRef> owners = new HashMap<>();

    /**
     * @throws IllegalStateException if the reference was registered before.
     */
    public void register(NodeRef ref, ScopeRef parent, Object node) {
        AstEntry<?> previous = entries.putIfAbsent(ref, new AstEntry<>(Optional.ofNullable(parent), node));
        if (previous != null) {
            throw new IllegalStateException("Node " + ref + " is already registered");
        }
    }

    /**
     * Links a design unit to the context items preceding it.
     */
    public void registerContext(NodeRef unit, CtxItemsRef ctxItems) {
        contexts.put(unit, ctxItems);
        owners.put(ctxItems, unit);
    }

    /**
     * @throws IllegalStateException if the reference is unknown or denotes another kind of node.
     */
    public <T> AstEntry<T> get(NodeRef ref, Class<T> type) {
        AstEntry<?> entry = entries.get(ref);
        if (entry == null) {
            throw new IllegalStateException("Node " + ref + " was never registered");
        }
        if (!type.isInstance(entry.node())) {
            throw new IllegalStateException("Node " + ref + " is a " + entry.node().getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return new AstEntry<>(entry.parent(), type.cast(entry.node()));
    }

    /**
     * @return The node of the reference, if registered.
     */
    public Optional<Object> find(NodeRef ref) {
        return Optional.ofNullable(entries.get(ref)).map(AstEntry::node);
    }

    /**
     * @throws IllegalStateException if the unit has no context items registered.
     */
    public CtxItemsRef contextOf(NodeRef unit) {
        CtxItemsRef ctx = contexts.get(unit);
        if (ctx == null) {
            throw new IllegalStateException("Node " + unit + " is not a design unit");
        }
        return ctx;
    }

    /**
     * @throws IllegalStateException if the context items were never registered.
     */
    public NodeRef ownerOf(CtxItemsRef ctxItems) {
        NodeRef unit = owners.get(ctxItems);
        if (unit == null) {
            throw new IllegalStateException("Context items " + ctxItems + " were never registered");
        }
        return unit;
    }
}
