package org.hdlscore.compiler.frontend.semantics;

import org.hdlscore.compiler.api.ScoreException;
import org.hdlscore.compiler.api.UnsupportedConstructException;
import org.hdlscore.compiler.diagnostics.Diagnostic;
import org.hdlscore.compiler.frontend.parser.ast.CompoundName;
import org.hdlscore.compiler.frontend.parser.ast.NamePart;
import org.hdlscore.compiler.frontend.score.ScoreContext;
import org.hdlscore.compiler.frontend.score.id.ArchRef;
import org.hdlscore.compiler.frontend.score.id.BuiltinPkgRef;
import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.frontend.score.id.PkgInstRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves simple and compound names against a scope chain.
 * <p>
 * Lookup starts at the innermost scope and moves outward; the first level binding the name
 * wins. Within a level, explicit imports come first, followed by the visible tables in order.
 * Tables whose definitions cannot be built yet (entities, architectures and package
 * instances) are skipped.
 */
public final class NameResolver {

    private final ScoreContext ctx;

    public NameResolver(ScoreContext ctx) {
        this.ctx = ctx;
    }

    /**
     * @return The definitions bound to the name, or an empty list if none is visible.
     */
    public List<Spanned<Def>> lookup(ResolvableName name, Scope scope) throws ScoreException {
        Scope current = scope;
        while (true) {
            List<Spanned<Def>> found = lookupLocal(name, current);
            if (!found.isEmpty()) {
                return found;
            }
            if (current.parent().isEmpty()) {
                return List.of();
            }
            current = ctx.scope(current.parent().get());
        }
    }

    private List<Spanned<Def>> lookupLocal(ResolvableName name, Scope scope) throws ScoreException {
        // A name imported explicitly may also be visible through its package.
        Set<Spanned<Def>> found = new LinkedHashSet<>(scope.explicitDefs().getOrDefault(name, List.of()));
        for (ScopeRef table : scope.visible()) {
            if (isSearchable(table)) {
                found.addAll(ctx.definitions(table).get(name));
            }
        }
        return new ArrayList<>(found);
    }

    static boolean isSearchable(ScopeRef table) {
        return !(table instanceof EntityRef || table instanceof ArchRef || table instanceof PkgInstRef);
    }

    /**
     * Looks a simple name up and reports it if nothing is visible under that name.
     *
     * @return The definitions bound to the name, never empty.
     */
    public List<Spanned<Def>> resolve(Spanned<ResolvableName> name, Scope scope) throws ScoreException {
        List<Spanned<Def>> found = lookup(name.value(), scope);
        if (found.isEmpty()) {
            ctx.emit(Diagnostic.error("`" + name.value() + "` is not declared").span(name.span()));
            throw new ScoreException();
        }
        return found;
    }

    /**
     * Resolves the longest prefix of a compound name. The primary is looked up in the scope,
     * each following {@code .ident} is selected from the single definition denoted so far as
     * long as that definition has a definitions table. The first part that cannot be consumed
     * that way ends the prefix.
     *
     * @throws ScoreException if the primary is not declared or a selection finds nothing.
     */
    public ResolvedName resolveCompound(CompoundName name, Scope scope) throws ScoreException {
        List<Spanned<Def>> defs = resolve(name.primary().spanned(), scope);
        ResolvableName last = name.primary().name();
        Span valid = name.primary().span();
        StringBuilder text = new StringBuilder(last.toString());

        int consumed = 0;
        for (NamePart part : name.parts()) {
            if (!(part instanceof NamePart.Select select) || defs.size() != 1) {
                break;
            }
            Optional<ScopeRef> table = tableOf(defs.get(0).value(), text, select);
            if (table.isEmpty()) {
                break;
            }
            ResolvableName selected = select.ident().name();
            List<Spanned<Def>> found = ctx.definitions(table.get()).get(selected);
            if (found.isEmpty()) {
                ctx.emit(Diagnostic.error("no `" + selected + "` in `" + text + "`").span(select.span()));
                throw new ScoreException();
            }
            defs = found;
            last = selected;
            valid = valid.union(select.span());
            text.append('.').append(selected);
            consumed++;
        }
        return new ResolvedName(last, defs, valid, text.toString(), name.parts().subList(consumed, name.parts().size()));
    }

    /**
     * @return The table selection continues in, or empty if the definition has none.
     */
    private Optional<ScopeRef> tableOf(Def def, CharSequence text, NamePart.Select select) throws ScoreException {
        if (def instanceof LibRef lib) {
            return Optional.of(lib);
        }
        if (def instanceof PkgDeclRef pkg) {
            return Optional.of(pkg);
        }
        if (def instanceof BuiltinPkgRef builtin) {
            return Optional.of(builtin);
        }
        if (def instanceof PkgInstRef) {
            ctx.emit(Diagnostic.error("selecting from package instance `" + text + "` is not yet supported")
                    .span(select.span()));
            throw new UnsupportedConstructException("package instance");
        }
        return Optional.empty();
    }
}
