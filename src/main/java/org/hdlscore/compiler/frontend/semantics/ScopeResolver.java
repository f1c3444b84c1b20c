package org.hdlscore.compiler.frontend.semantics;

import org.hdlscore.compiler.api.ScoreException;
import org.hdlscore.compiler.api.UnsupportedConstructException;
import org.hdlscore.compiler.diagnostics.Diagnostic;
import org.hdlscore.compiler.frontend.hir.Arch;
import org.hdlscore.compiler.frontend.hir.Entity;
import org.hdlscore.compiler.frontend.hir.Package;
import org.hdlscore.compiler.frontend.parser.ast.CompoundName;
import org.hdlscore.compiler.frontend.parser.ast.CtxItem;
import org.hdlscore.compiler.frontend.parser.ast.DesignUnitNode;
import org.hdlscore.compiler.frontend.parser.ast.NamePart;
import org.hdlscore.compiler.frontend.parser.ast.PkgInst;
import org.hdlscore.compiler.frontend.score.ScoreContext;
import org.hdlscore.compiler.frontend.score.id.ArchRef;
import org.hdlscore.compiler.frontend.score.id.BuiltinPkgRef;
import org.hdlscore.compiler.frontend.score.id.CtxItemsRef;
import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.frontend.score.id.NodeRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.frontend.score.id.PkgInstRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the scope of a scope-introducing construct.
 * <p>
 * Design units chain to the scope of their context items. Use clauses in the context items
 * are resolved in order against the scope built so far and then its parent, never against
 * the finished context scope, so a use clause cannot depend on the scope it contributes to.
 */
public final class ScopeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ScopeResolver.class);

    private final ScoreContext ctx;
    private final NameResolver names;

    public ScopeResolver(ScoreContext ctx, NameResolver names) {
        this.ctx = ctx;
        this.names = names;
    }

    public Scope scope(ScopeRef ref) throws ScoreException {
        if (ref instanceof LibRef lib) {
            return store(Scope.of(Optional.empty(), lib));
        }
        if (ref instanceof CtxItemsRef ctxItems) {
            return store(contextScope(ctxItems));
        }
        if (ref instanceof EntityRef entity) {
            Entity hir = ctx.hir(entity);
            ctx.scope(hir.ctxItems());
            return store(Scope.of(Optional.of(hir.ctxItems()), entity));
        }
        if (ref instanceof ArchRef arch) {
            Arch hir = ctx.hir(arch);
            ctx.scope(hir.ctxItems());
            return store(Scope.of(Optional.of(hir.ctxItems()), arch));
        }
        if (ref instanceof PkgDeclRef pkg) {
            Package hir = ctx.hir(pkg);
            if (hir.parent() instanceof CtxItemsRef ctxItems) {
                ctx.scope(ctxItems);
            }
            return store(Scope.of(Optional.of(hir.parent()), pkg));
        }
        if (ref instanceof BuiltinPkgRef builtin) {
            return BuiltinPackages.scope(builtin);
        }
        if (ref instanceof PkgInstRef inst) {
            Spanned<ResolvableName> name = ctx.ast(inst, PkgInst.class).node().name().spanned();
            ctx.emit(Diagnostic.error("scope of package instance `" + name.value() + "` is not yet supported")
                    .span(name.span()));
            throw new UnsupportedConstructException("package instance");
        }
        throw new IllegalStateException("No scope for " + ref);
    }

    private Scope store(Scope scope) {
        return ctx.scoreboard().arenas().scopes().store(scope);
    }

    /**
     * The scope made by the context items of a design unit: the items themselves, the
     * {@code standard} package and every package imported with {@code .all}, plus the names
     * imported one by one. An architecture's context additionally chains to its entity.
     */
    private Scope contextScope(CtxItemsRef ref) throws ScoreException {
        DesignUnitNode unit = ctx.ast(ref, DesignUnitNode.class).node();
        NodeRef owner = ctx.scoreboard().syntax().ownerOf(ref);
        Optional<ScopeRef> parent = Optional.empty();
        if (owner instanceof ArchRef arch) {
            parent = Optional.of(ctx.hir(arch).entity());
        }

        List<ScopeRef> visible = new ArrayList<>(List.of(ref, BuiltinPkgRef.STANDARD));
        Map<ResolvableName, List<Spanned<Def>>> explicitDefs = new LinkedHashMap<>();
        boolean failed = false;
        for (CtxItem item : unit.ctxItems()) {
            if (!(item instanceof CtxItem.UseClause use)) {
                continue;
            }
            for (CompoundName name : use.names()) {
                Scope partial = new Scope(parent, visible, explicitDefs);
                if (!applyUseClause(name, partial, visible, explicitDefs)) {
                    failed = true;
                }
            }
        }
        if (failed) {
            throw new ScoreException();
        }
        LOG.debug("Context {} makes {} tables visible and imports {} names", ref, visible.size(), explicitDefs.size());
        return new Scope(parent, visible, explicitDefs);
    }

    /**
     * Applies one name of a use clause to the scope under construction.
     *
     * @return false if the clause was reported as erroneous.
     */
    private boolean applyUseClause(CompoundName name, Scope partial, List<ScopeRef> visible,
                                   Map<ResolvableName, List<Spanned<Def>>> explicitDefs) {
        ResolvedName resolved;
        try {
            resolved = names.resolveCompound(name, partial);
        } catch (ScoreException e) {
            LOG.debug("Use clause {} failed to resolve", name.text());
            return false;
        }

        List<NamePart> tail = resolved.tail();
        Span valid = resolved.validSpan();
        if (!tail.isEmpty() && tail.get(0) instanceof NamePart.SelectAll all) {
            Def last = resolved.defs().get(resolved.defs().size() - 1).value();
            if (!(last instanceof PkgDeclRef || last instanceof BuiltinPkgRef)) {
                ctx.emit(Diagnostic.error("`all` not possible on `" + resolved.text() + "`").span(all.span()));
                return false;
            }
            ScopeRef pkg = (ScopeRef) last;
            if (!visible.contains(pkg)) {
                visible.add(pkg);
            }
            valid = valid.union(all.span());
            tail = tail.subList(1, tail.size());
        } else if (tail.isEmpty()) {
            List<Spanned<Def>> imported = explicitDefs.computeIfAbsent(resolved.name(), n -> new ArrayList<>());
            for (Spanned<Def> def : resolved.defs()) {
                if (!imported.contains(def)) {
                    imported.add(def);
                }
            }
        }

        if (!tail.isEmpty()) {
            Span suffix = new Span(name.span().source(), valid.end(), name.span().end());
            ctx.emit(Diagnostic.error("invalid name suffix").span(suffix));
            return false;
        }
        return true;
    }
}
