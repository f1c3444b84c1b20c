package org.hdlscore.compiler.frontend.semantics;

import org.hdlscore.compiler.api.ScoreException;
import org.hdlscore.compiler.api.UnsupportedConstructException;
import org.hdlscore.compiler.diagnostics.Diagnostic;
import org.hdlscore.compiler.frontend.hir.Lib;
import org.hdlscore.compiler.frontend.hir.Package;
import org.hdlscore.compiler.frontend.hir.TypeData;
import org.hdlscore.compiler.frontend.hir.TypeDecl;
import org.hdlscore.compiler.frontend.parser.ast.AstIdent;
import org.hdlscore.compiler.frontend.parser.ast.CtxItem;
import org.hdlscore.compiler.frontend.parser.ast.DesignUnit;
import org.hdlscore.compiler.frontend.parser.ast.DesignUnitNode;
import org.hdlscore.compiler.frontend.parser.ast.ObjectDeclNode;
import org.hdlscore.compiler.frontend.parser.ast.PkgDecl;
import org.hdlscore.compiler.frontend.parser.ast.PkgInst;
import org.hdlscore.compiler.frontend.parser.ast.SubtypeDeclNode;
import org.hdlscore.compiler.frontend.score.AstEntry;
import org.hdlscore.compiler.frontend.score.ScoreContext;
import org.hdlscore.compiler.frontend.score.id.ArchRef;
import org.hdlscore.compiler.frontend.score.id.BuiltinPkgRef;
import org.hdlscore.compiler.frontend.score.id.CfgRef;
import org.hdlscore.compiler.frontend.score.id.CtxItemsRef;
import org.hdlscore.compiler.frontend.score.id.CtxRef;
import org.hdlscore.compiler.frontend.score.id.DeclInPkgRef;
import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.EnumRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.frontend.score.id.NodeRef;
import org.hdlscore.compiler.frontend.score.id.ObjectDeclRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.frontend.score.id.PkgInstRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeDeclRef;
import org.hdlscore.compiler.frontend.score.id.TypeDeclRef;
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
 * Builds the definitions table of a scope-introducing construct.
 * <p>
 * All problems of one table are reported before the table fails, so a single query surfaces
 * every conflicting declaration at once.
 */
public final class DefsResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DefsResolver.class);

    /** The name that denotes the library a design unit is compiled into. */
    public static final ResolvableName WORK = ResolvableName.ident("work");

    private final ScoreContext ctx;

    public DefsResolver(ScoreContext ctx) {
        this.ctx = ctx;
    }

    public Defs definitions(ScopeRef ref) throws ScoreException {
        if (ref instanceof LibRef lib) {
            return store(libraryDefs(lib));
        }
        if (ref instanceof CtxItemsRef ctxItems) {
            return store(contextDefs(ctxItems));
        }
        if (ref instanceof PkgDeclRef pkg) {
            return store(packageDefs(pkg));
        }
        if (ref instanceof BuiltinPkgRef builtin) {
            return BuiltinPackages.definitions(builtin);
        }
        if (ref instanceof EntityRef entity) {
            throw unsupported("entity", ctx.hir(entity).name());
        }
        if (ref instanceof ArchRef arch) {
            throw unsupported("architecture", ctx.hir(arch).name());
        }
        if (ref instanceof PkgInstRef inst) {
            throw unsupported("package instance", ctx.ast(inst, PkgInst.class).node().name().spanned());
        }
        throw new IllegalStateException("No definitions for " + ref);
    }

    private Defs store(Defs defs) {
        return ctx.scoreboard().arenas().defs().store(defs);
    }

    private UnsupportedConstructException unsupported(String construct, Spanned<ResolvableName> name) {
        ctx.emit(Diagnostic.error("declarations in " + construct + " `" + name.value() + "` are not yet supported")
                .span(name.span()));
        return new UnsupportedConstructException(construct);
    }

    // === Library ===

    private Defs libraryDefs(LibRef ref) throws ScoreException {
        Lib lib = ctx.hir(ref);
        Map<ResolvableName, List<Spanned<Def>>> candidates = new LinkedHashMap<>();
        for (EntityRef entity : lib.entities()) {
            collect(candidates, entity, entity);
        }
        for (CfgRef cfg : lib.cfgs()) {
            collect(candidates, cfg, cfg);
        }
        for (PkgDeclRef pkg : lib.pkgDecls()) {
            collect(candidates, pkg, pkg);
        }
        for (PkgInstRef inst : lib.pkgInsts()) {
            collect(candidates, inst, inst);
        }
        for (CtxRef context : lib.ctxs()) {
            collect(candidates, context, context);
        }

        boolean ignoreDuplicates = ctx.options().ignoreDuplicateDefs();
        Map<ResolvableName, List<Spanned<Def>>> defs = new LinkedHashMap<>();
        boolean hadDuplicates = false;
        for (Map.Entry<ResolvableName, List<Spanned<Def>>> entry : candidates.entrySet()) {
            List<Spanned<Def>> found = entry.getValue();
            if (found.size() > 1) {
                String message = "`" + entry.getKey() + "` declared multiple times";
                Diagnostic.Builder diagnostic = ignoreDuplicates ? Diagnostic.warning(message) : Diagnostic.error(message);
                found.forEach(def -> diagnostic.span(def.span()));
                ctx.emit(diagnostic);
                hadDuplicates = true;
                found = List.of(found.get(0));
            }
            defs.put(entry.getKey(), found);
            trace(entry.getKey(), found.get(0).value());
        }
        if (hadDuplicates && !ignoreDuplicates) {
            throw new ScoreException();
        }
        return new Defs(defs);
    }

    private void collect(Map<ResolvableName, List<Spanned<Def>>> candidates, NodeRef unit, Def def) {
        AstIdent name = ctx.ast(unit, DesignUnit.class).node().name();
        candidates.computeIfAbsent(name.name(), n -> new ArrayList<>()).add(new Spanned<>(def, name.span()));
    }

    // === Context items ===

    private Defs contextDefs(CtxItemsRef ref) throws ScoreException {
        AstEntry<DesignUnitNode> entry = ctx.ast(ref, DesignUnitNode.class);
        if (!(entry.requireParent() instanceof LibRef owner)) {
            throw new IllegalStateException("Context items " + ref + " are not part of a library");
        }

        Map<ResolvableName, List<Spanned<Def>>> defs = new LinkedHashMap<>();
        boolean failed = false;
        for (CtxItem item : entry.node().ctxItems()) {
            if (item instanceof CtxItem.LibClause clause) {
                for (AstIdent ident : clause.names()) {
                    Optional<LibRef> lib = WORK.equals(ident.name())
                            ? Optional.of(owner)
                            : ctx.scoreboard().libraries().lookup(ident.name());
                    if (lib.isEmpty()) {
                        ctx.emit(Diagnostic.error("no library named `" + ident.name() + "` found").span(ident.span()));
                        failed = true;
                        continue;
                    }
                    List<Spanned<Def>> existing = defs.get(ident.name());
                    if (existing != null) {
                        ctx.emit(Diagnostic.error("`" + ident.name() + "` has already been declared")
                                .span(ident.span())
                                .note("previous declaration was here:")
                                .span(existing.get(existing.size() - 1).span()));
                        failed = true;
                        continue;
                    }
                    defs.put(ident.name(), new ArrayList<>(List.of(new Spanned<>(lib.get(), ident.span()))));
                    trace(ident.name(), lib.get());
                }
            } else if (item instanceof CtxItem.ContextRef) {
                ctx.emit(Diagnostic.error("context references are not yet supported").span(item.span()));
                failed = true;
            }
        }
        if (failed) {
            throw new ScoreException();
        }
        if (!defs.containsKey(WORK)) {
            defs.put(WORK, List.of(new Spanned<>(owner, Span.BUILTIN)));
            trace(WORK, owner);
        }
        return new Defs(defs);
    }

    // === Package declaration ===

    private Defs packageDefs(PkgDeclRef ref) throws ScoreException {
        Package pkg = ctx.hir(ref);
        Map<ResolvableName, List<Spanned<Def>>> defs = new LinkedHashMap<>();
        boolean failed = false;
        for (DeclInPkgRef decl : pkg.decls()) {
            for (Declaration declaration : declarationsOf(decl)) {
                if (!declare(defs, declaration.name(), declaration.def())) {
                    failed = true;
                }
            }
        }
        if (failed) {
            throw new ScoreException();
        }
        return new Defs(defs);
    }

    private record Declaration(Spanned<ResolvableName> name, Def def) {}

    private List<Declaration> declarationsOf(DeclInPkgRef decl) throws ScoreException {
        if (decl instanceof PkgDeclRef pkg) {
            return List.of(new Declaration(ctx.ast(pkg, PkgDecl.class).node().name().spanned(), pkg));
        }
        if (decl instanceof PkgInstRef inst) {
            return List.of(new Declaration(ctx.ast(inst, PkgInst.class).node().name().spanned(), inst));
        }
        if (decl instanceof TypeDeclRef type) {
            TypeDecl hir = ctx.hir(type);
            List<Declaration> declarations = new ArrayList<>();
            declarations.add(new Declaration(hir.name(), type));
            if (hir.data().isPresent() && hir.data().get() instanceof TypeData.EnumType enumType) {
                for (int i = 0; i < enumType.literals().size(); i++) {
                    declarations.add(new Declaration(enumType.literals().get(i), new EnumRef(type, i)));
                }
            }
            return declarations;
        }
        if (decl instanceof SubtypeDeclRef subtype) {
            return List.of(new Declaration(ctx.ast(subtype, SubtypeDeclNode.class).node().name().spanned(), subtype));
        }
        if (decl instanceof ObjectDeclRef object) {
            AstIdent name = ctx.ast((NodeRef) object, ObjectDeclNode.class).node().names().get(0);
            return List.of(new Declaration(name.spanned(), (Def) object));
        }
        throw new IllegalStateException("Unknown declaration: " + decl);
    }

    /**
     * Adds a definition to the table. Overloadable definitions accumulate under one name as long
     * as every definition sharing the name is overloadable.
     *
     * @return false if the definition clashes with an earlier one.
     */
    private boolean declare(Map<ResolvableName, List<Spanned<Def>>> defs, Spanned<ResolvableName> name, Def def) {
        List<Spanned<Def>> existing = defs.get(name.value());
        if (existing == null) {
            defs.put(name.value(), new ArrayList<>(List.of(new Spanned<>(def, name.span()))));
            trace(name.value(), def);
            return true;
        }
        boolean overloads = def.isOverloadable() && existing.stream().allMatch(e -> e.value().isOverloadable());
        if (overloads) {
            existing.add(new Spanned<>(def, name.span()));
            trace(name.value(), def);
            return true;
        }
        ctx.emit(Diagnostic.error("`" + name.value() + "` has already been declared")
                .span(name.span())
                .note("previous declaration was here:")
                .span(existing.get(existing.size() - 1).span()));
        return false;
    }

    private void trace(ResolvableName name, Def def) {
        if (ctx.options().traceScoreboard()) {
            LOG.info("Declaring `{}` as {}", name, def);
        }
    }
}
