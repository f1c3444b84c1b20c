package org.hdlscore.compiler.frontend.semantics;

import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One level of the scope chain used to resolve names.
 *
 * @param parent       The enclosing scope, consulted when nothing at this level binds a name.
 * @param visible      The definition tables made visible at this level, in order.
 * @param explicitDefs Names imported one by one, such as through {@code use work.pkg.x;}.
 */
public record Scope(
        Optional<ScopeRef> parent,
        List<ScopeRef> visible,
        Map<ResolvableName, List<Spanned<Def>>> explicitDefs
) {
    public Scope {
        visible = List.copyOf(visible);
        Map<ResolvableName, List<Spanned<Def>>> copy = new LinkedHashMap<>();
        explicitDefs.forEach((name, defs) -> copy.put(name, List.copyOf(defs)));
        explicitDefs = Collections.unmodifiableMap(copy);
    }

    /**
     * A scope that only makes the given table visible.
     */
    public static Scope of(Optional<ScopeRef> parent, ScopeRef self) {
        return new Scope(parent, List.of(self), Map.of());
    }
}
