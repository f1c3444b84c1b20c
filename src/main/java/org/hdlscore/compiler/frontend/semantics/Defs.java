package org.hdlscore.compiler.frontend.semantics;

import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The definitions a scope-introducing construct makes: a read-only, insertion-ordered map from
 * name to the definitions it denotes. More than one definition under a name only occurs for
 * overloadable definitions.
 */
public final class Defs {

    private final Map<ResolvableName, List<Spanned<Def>>> entries;

    public Defs(Map<ResolvableName, List<Spanned<Def>>> entries) {
        Map<ResolvableName, List<Spanned<Def>>> copy = new LinkedHashMap<>();
        entries.forEach((name, defs) -> copy.put(name, List.copyOf(defs)));
        this.entries = Collections.unmodifiableMap(copy);
    }

    /**
     * @return The definitions bound to the name, in declaration order, or an empty list.
     */
    public List<Spanned<Def>> get(ResolvableName name) {
        return entries.getOrDefault(name, List.of());
    }

    public boolean contains(ResolvableName name) {
        return entries.containsKey(name);
    }

    public Set<ResolvableName> names() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Defs" + entries;
    }
}
