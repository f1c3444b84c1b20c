package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.api.ScoreException;
import org.hdlscore.compiler.api.UnsupportedConstructException;
import org.hdlscore.compiler.diagnostics.Diagnostic;
import org.hdlscore.compiler.frontend.hir.Arch;
import org.hdlscore.compiler.frontend.hir.ConstDecl;
import org.hdlscore.compiler.frontend.hir.Constraint;
import org.hdlscore.compiler.frontend.hir.Entity;
import org.hdlscore.compiler.frontend.hir.Expr;
import org.hdlscore.compiler.frontend.hir.ExprData;
import org.hdlscore.compiler.frontend.hir.FileDecl;
import org.hdlscore.compiler.frontend.hir.IntfConst;
import org.hdlscore.compiler.frontend.hir.IntfSignal;
import org.hdlscore.compiler.frontend.hir.Lib;
import org.hdlscore.compiler.frontend.hir.Package;
import org.hdlscore.compiler.frontend.hir.SignalDecl;
import org.hdlscore.compiler.frontend.hir.SubtypeDecl;
import org.hdlscore.compiler.frontend.hir.SubtypeInd;
import org.hdlscore.compiler.frontend.hir.TypeData;
import org.hdlscore.compiler.frontend.hir.TypeDecl;
import org.hdlscore.compiler.frontend.hir.VariableDecl;
import org.hdlscore.compiler.frontend.parser.ast.ArchBody;
import org.hdlscore.compiler.frontend.parser.ast.AstIdent;
import org.hdlscore.compiler.frontend.parser.ast.CfgDecl;
import org.hdlscore.compiler.frontend.parser.ast.CompoundName;
import org.hdlscore.compiler.frontend.parser.ast.ConcStmtNode;
import org.hdlscore.compiler.frontend.parser.ast.ConstraintNode;
import org.hdlscore.compiler.frontend.parser.ast.CtxDecl;
import org.hdlscore.compiler.frontend.parser.ast.DeclItem;
import org.hdlscore.compiler.frontend.parser.ast.DesignUnit;
import org.hdlscore.compiler.frontend.parser.ast.DesignUnitNode;
import org.hdlscore.compiler.frontend.parser.ast.EntityDecl;
import org.hdlscore.compiler.frontend.parser.ast.ExprNode;
import org.hdlscore.compiler.frontend.parser.ast.GenericDecl;
import org.hdlscore.compiler.frontend.parser.ast.LibraryNode;
import org.hdlscore.compiler.frontend.parser.ast.NamePart;
import org.hdlscore.compiler.frontend.parser.ast.ObjectDeclNode;
import org.hdlscore.compiler.frontend.parser.ast.ObjectDeclNode.ObjectKind;
import org.hdlscore.compiler.frontend.parser.ast.PkgBody;
import org.hdlscore.compiler.frontend.parser.ast.PkgDecl;
import org.hdlscore.compiler.frontend.parser.ast.PkgInst;
import org.hdlscore.compiler.frontend.parser.ast.PortDecl;
import org.hdlscore.compiler.frontend.parser.ast.SignalKind;
import org.hdlscore.compiler.frontend.parser.ast.SubtypeDeclNode;
import org.hdlscore.compiler.frontend.parser.ast.SubtypeIndNode;
import org.hdlscore.compiler.frontend.parser.ast.TypeDeclNode;
import org.hdlscore.compiler.frontend.parser.ast.TypeDefNode;
import org.hdlscore.compiler.frontend.score.arena.Arenas;
import org.hdlscore.compiler.frontend.score.id.ArchRef;
import org.hdlscore.compiler.frontend.score.id.CfgRef;
import org.hdlscore.compiler.frontend.score.id.ConcStmtRef;
import org.hdlscore.compiler.frontend.score.id.ConstDeclRef;
import org.hdlscore.compiler.frontend.score.id.CtxItemsRef;
import org.hdlscore.compiler.frontend.score.id.CtxRef;
import org.hdlscore.compiler.frontend.score.id.DeclInBlockRef;
import org.hdlscore.compiler.frontend.score.id.DeclInPkgRef;
import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.frontend.score.id.FileDeclRef;
import org.hdlscore.compiler.frontend.score.id.IntfConstRef;
import org.hdlscore.compiler.frontend.score.id.IntfSignalRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.frontend.score.id.NodeRef;
import org.hdlscore.compiler.frontend.score.id.ObjectDeclRef;
import org.hdlscore.compiler.frontend.score.id.PkgBodyRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.frontend.score.id.PkgInstRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.frontend.score.id.SignalDeclRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeDeclRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeIndRef;
import org.hdlscore.compiler.frontend.score.id.TypeDeclRef;
import org.hdlscore.compiler.frontend.score.id.TypeMarkRef;
import org.hdlscore.compiler.frontend.score.id.VarDeclRef;
import org.hdlscore.compiler.frontend.semantics.ResolvedName;
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
 * Lowers syntax into HIR, one node per call. Child nodes only receive a reference here; their
 * own HIR is built when it is asked for. The only names resolved while lowering are those the
 * node itself refers to: the entity of an architecture, the type mark of a subtype indication
 * and the names in an expression.
 */
final class HirBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(HirBuilder.class);

    private final ScoreContext ctx;

    HirBuilder(ScoreContext ctx) {
        this.ctx = ctx;
    }

    private Arenas arenas() {
        return ctx.scoreboard().arenas();
    }

    // === Design units ===

    Lib lowerLib(LibRef ref) {
        LibraryNode library = ctx.ast(ref, LibraryNode.class).node();
        List<EntityRef> entities = new ArrayList<>();
        List<CfgRef> cfgs = new ArrayList<>();
        List<PkgDeclRef> pkgDecls = new ArrayList<>();
        List<PkgInstRef> pkgInsts = new ArrayList<>();
        List<CtxRef> ctxs = new ArrayList<>();
        List<ArchRef> archs = new ArrayList<>();
        List<PkgBodyRef> pkgBodies = new ArrayList<>();

        for (DesignUnitNode unitNode : library.units()) {
            DesignUnit unit = unitNode.unit();
            NodeRef unitRef;
            if (unit instanceof EntityDecl) {
                EntityRef entity = ctx.allocate(EntityRef::new, ref, unit);
                entities.add(entity);
                unitRef = entity;
            } else if (unit instanceof CfgDecl) {
                CfgRef cfg = ctx.allocate(CfgRef::new, ref, unit);
                cfgs.add(cfg);
                unitRef = cfg;
            } else if (unit instanceof PkgDecl) {
                PkgDeclRef pkg = ctx.allocate(PkgDeclRef::new, ref, unit);
                pkgDecls.add(pkg);
                unitRef = pkg;
            } else if (unit instanceof PkgInst) {
                PkgInstRef inst = ctx.allocate(PkgInstRef::new, ref, unit);
                pkgInsts.add(inst);
                unitRef = inst;
            } else if (unit instanceof CtxDecl) {
                CtxRef context = ctx.allocate(CtxRef::new, ref, unit);
                ctxs.add(context);
                unitRef = context;
            } else if (unit instanceof ArchBody) {
                ArchRef arch = ctx.allocate(ArchRef::new, ref, unit);
                archs.add(arch);
                unitRef = arch;
            } else if (unit instanceof PkgBody) {
                PkgBodyRef body = ctx.allocate(PkgBodyRef::new, ref, unit);
                pkgBodies.add(body);
                unitRef = body;
            } else {
                throw new IllegalStateException("Unknown design unit: " + unit.getClass().getSimpleName());
            }
            CtxItemsRef ctxItems = ctx.allocate(CtxItemsRef::new, ref, unitNode);
            ctx.scoreboard().syntax().registerContext(unitRef, ctxItems);
        }

        LOG.debug("Library {}: {} entities, {} architectures, {} packages", library.name(),
                entities.size(), archs.size(), pkgDecls.size());
        return arenas().libs().store(
                new Lib(library.name(), entities, cfgs, pkgDecls, pkgInsts, ctxs, archs, pkgBodies));
    }

    Entity lowerEntity(EntityRef ref) {
        AstEntry<EntityDecl> entry = ctx.ast(ref, EntityDecl.class);
        EntityDecl decl = entry.node();

        List<IntfConstRef> generics = new ArrayList<>();
        for (GenericDecl generic : decl.generics()) {
            for (AstIdent name : generic.names()) {
                GenericDecl single = new GenericDecl(generic.span(), List.of(name), generic.subtype(), generic.init());
                generics.add(ctx.allocate(IntfConstRef::new, ref, single));
            }
        }
        List<IntfSignalRef> ports = new ArrayList<>();
        for (PortDecl port : decl.ports()) {
            for (AstIdent name : port.names()) {
                PortDecl single = new PortDecl(port.span(), List.of(name), port.mode(), port.subtype(), port.bus(), port.init());
                ports.add(ctx.allocate(IntfSignalRef::new, ref, single));
            }
        }
        return arenas().entities().store(new Entity(
                ctx.contextOf(ref), owningLib(entry, ref), decl.name().spanned(), generics, ports));
    }

    Arch lowerArch(ArchRef ref) throws ScoreException {
        AstEntry<ArchBody> entry = ctx.ast(ref, ArchBody.class);
        ArchBody body = entry.node();
        LibRef lib = owningLib(entry, ref);

        List<Spanned<Def>> candidates = ctx.definitions(lib).get(body.entity().name());
        if (candidates.size() != 1 || !(candidates.get(0).value() instanceof EntityRef entity)) {
            ctx.emit(Diagnostic.error("no entity named `" + body.entity().name() + "` in library `"
                    + ctx.hir(lib).name() + "`").span(body.entity().span()));
            throw new ScoreException();
        }

        List<DeclInBlockRef> decls = new ArrayList<>();
        for (DeclItem item : body.decls()) {
            if (item instanceof PkgDecl || item instanceof PkgInst) {
                ctx.emit(Diagnostic.error("packages in architectures are not yet supported").span(item.span()));
                throw new UnsupportedConstructException("package in architecture");
            }
            if (item instanceof TypeDeclNode) {
                decls.add(ctx.allocate(TypeDeclRef::new, ref, item));
            } else if (item instanceof SubtypeDeclNode) {
                decls.add(ctx.allocate(SubtypeDeclRef::new, ref, item));
            } else if (item instanceof ObjectDeclNode object) {
                decls.addAll(allocateObjects(object, ref));
            }
        }
        List<ConcStmtRef> stmts = new ArrayList<>();
        for (ConcStmtNode stmt : body.stmts()) {
            stmts.add(ctx.allocate(ConcStmtRef::new, ref, stmt));
        }
        return arenas().archs().store(new Arch(ctx.contextOf(ref), lib, body.name().spanned(), entity, decls, stmts));
    }

    Package lowerPackage(PkgDeclRef ref) {
        AstEntry<PkgDecl> entry = ctx.ast(ref, PkgDecl.class);
        PkgDecl pkg = entry.node();
        ScopeRef parent = entry.requireParent();
        if (parent instanceof LibRef) {
            parent = ctx.contextOf(ref);
        }

        List<IntfConstRef> generics = new ArrayList<>();
        for (GenericDecl generic : pkg.generics()) {
            for (AstIdent name : generic.names()) {
                GenericDecl single = new GenericDecl(generic.span(), List.of(name), generic.subtype(), generic.init());
                generics.add(ctx.allocate(IntfConstRef::new, ref, single));
            }
        }
        List<DeclInPkgRef> decls = new ArrayList<>();
        for (DeclItem item : pkg.decls()) {
            if (item instanceof PkgDecl) {
                decls.add(ctx.allocate(PkgDeclRef::new, ref, item));
            } else if (item instanceof PkgInst) {
                decls.add(ctx.allocate(PkgInstRef::new, ref, item));
            } else if (item instanceof TypeDeclNode) {
                decls.add(ctx.allocate(TypeDeclRef::new, ref, item));
            } else if (item instanceof SubtypeDeclNode) {
                decls.add(ctx.allocate(SubtypeDeclRef::new, ref, item));
            } else if (item instanceof ObjectDeclNode object) {
                decls.addAll(allocateObjects(object, ref));
            }
        }
        return arenas().packages().store(new Package(parent, pkg.name().spanned(), generics, decls));
    }

    /**
     * Allocates one reference per declared name, each registered with a copy of the
     * declaration narrowed to that name.
     */
    private List<ObjectDeclRef> allocateObjects(ObjectDeclNode decl, ScopeRef parent) {
        List<ObjectDeclRef> refs = new ArrayList<>();
        for (AstIdent name : decl.names()) {
            ObjectDeclNode single = new ObjectDeclNode(decl.span(), decl.kind(), List.of(name), decl.subtype(),
                    decl.init(), decl.signalKind(), decl.shared(), decl.fileOpen());
            refs.add(switch (decl.kind()) {
                case CONSTANT -> ctx.allocate(ConstDeclRef::new, parent, single);
                case SIGNAL -> ctx.allocate(SignalDeclRef::new, parent, single);
                case VARIABLE -> ctx.allocate(VarDeclRef::new, parent, single);
                case FILE -> ctx.allocate(FileDeclRef::new, parent, single);
            });
        }
        return refs;
    }

    private static LibRef owningLib(AstEntry<?> entry, NodeRef unit) {
        if (!(entry.requireParent() instanceof LibRef lib)) {
            throw new IllegalStateException("Design unit " + unit + " is not part of a library");
        }
        return lib;
    }

    // === Interface objects ===

    IntfSignal lowerIntfSignal(IntfSignalRef ref) {
        AstEntry<PortDecl> entry = ctx.ast(ref, PortDecl.class);
        PortDecl port = entry.node();
        ScopeRef scope = entry.requireParent();
        return arenas().intfSignals().store(new IntfSignal(
                port.names().get(0).spanned(),
                port.mode(),
                allocateSubtypeInd(port.subtype(), scope),
                port.bus(),
                allocateExpr(port.init(), scope)));
    }

    IntfConst lowerIntfConst(IntfConstRef ref) {
        AstEntry<GenericDecl> entry = ctx.ast(ref, GenericDecl.class);
        GenericDecl generic = entry.node();
        ScopeRef scope = entry.requireParent();
        return arenas().intfConsts().store(new IntfConst(
                generic.names().get(0).spanned(),
                allocateSubtypeInd(generic.subtype(), scope),
                allocateExpr(generic.init(), scope)));
    }

    // === Declarations ===

    TypeDecl lowerTypeDecl(TypeDeclRef ref) {
        AstEntry<TypeDeclNode> entry = ctx.ast(ref, TypeDeclNode.class);
        TypeDeclNode decl = entry.node();
        ScopeRef parent = entry.requireParent();

        Optional<TypeData> data = Optional.empty();
        if (decl.definition() instanceof TypeDefNode.EnumDef enumDef) {
            List<Spanned<ResolvableName>> literals = new ArrayList<>();
            for (AstIdent literal : enumDef.literals()) {
                literals.add(literal.spanned());
            }
            data = Optional.of(new TypeData.EnumType(enumDef.span(), literals));
        } else if (decl.definition() instanceof TypeDefNode.RangeDef range) {
            data = Optional.of(new TypeData.RangeType(range.span(), range.dir(),
                    ctx.allocate(ExprRef::new, parent, range.lo()),
                    ctx.allocate(ExprRef::new, parent, range.hi())));
        }
        return arenas().typeDecls().store(new TypeDecl(parent, decl.name().spanned(), data));
    }

    SubtypeDecl lowerSubtypeDecl(SubtypeDeclRef ref) {
        AstEntry<SubtypeDeclNode> entry = ctx.ast(ref, SubtypeDeclNode.class);
        ScopeRef parent = entry.requireParent();
        return arenas().subtypeDecls().store(new SubtypeDecl(
                parent, entry.node().name().spanned(), allocateSubtypeInd(entry.node().subtype(), parent)));
    }

    ConstDecl lowerConstDecl(ConstDeclRef ref) {
        AstEntry<ObjectDeclNode> entry = objectEntry(ref, ObjectKind.CONSTANT);
        ObjectDeclNode decl = entry.node();
        ScopeRef parent = entry.requireParent();
        return arenas().constDecls().store(new ConstDecl(parent, decl.names().get(0).spanned(),
                allocateSubtypeInd(decl.subtype(), parent), allocateExpr(decl.init(), parent)));
    }

    SignalDecl lowerSignalDecl(SignalDeclRef ref) {
        AstEntry<ObjectDeclNode> entry = objectEntry(ref, ObjectKind.SIGNAL);
        ObjectDeclNode decl = entry.node();
        ScopeRef parent = entry.requireParent();
        SignalKind kind = decl.signalKind() != null ? decl.signalKind() : SignalKind.NORMAL;
        return arenas().signalDecls().store(new SignalDecl(parent, decl.names().get(0).spanned(),
                allocateSubtypeInd(decl.subtype(), parent), kind, allocateExpr(decl.init(), parent)));
    }

    VariableDecl lowerVariableDecl(VarDeclRef ref) {
        AstEntry<ObjectDeclNode> entry = objectEntry(ref, ObjectKind.VARIABLE);
        ObjectDeclNode decl = entry.node();
        ScopeRef parent = entry.requireParent();
        return arenas().variableDecls().store(new VariableDecl(parent, decl.shared(), decl.names().get(0).spanned(),
                allocateSubtypeInd(decl.subtype(), parent), allocateExpr(decl.init(), parent)));
    }

    FileDecl lowerFileDecl(FileDeclRef ref) {
        AstEntry<ObjectDeclNode> entry = objectEntry(ref, ObjectKind.FILE);
        ObjectDeclNode decl = entry.node();
        ScopeRef parent = entry.requireParent();
        Optional<FileDecl.FileOpen> open = Optional.empty();
        if (decl.fileOpen() != null) {
            open = Optional.of(new FileDecl.FileOpen(
                    ctx.allocate(ExprRef::new, parent, decl.fileOpen().name()),
                    allocateExpr(decl.fileOpen().kind(), parent)));
        }
        return arenas().fileDecls().store(new FileDecl(parent, decl.names().get(0).spanned(),
                allocateSubtypeInd(decl.subtype(), parent), open));
    }

    private AstEntry<ObjectDeclNode> objectEntry(NodeRef ref, ObjectKind expected) {
        AstEntry<ObjectDeclNode> entry = ctx.ast(ref, ObjectDeclNode.class);
        if (entry.node().kind() != expected) {
            throw new IllegalStateException("Node " + ref + " declares a " + entry.node().kind() + ", not a " + expected);
        }
        return entry;
    }

    private SubtypeIndRef allocateSubtypeInd(SubtypeIndNode node, ScopeRef scope) {
        return ctx.allocate(SubtypeIndRef::new, scope, node);
    }

    private Optional<ExprRef> allocateExpr(ExprNode node, ScopeRef scope) {
        return Optional.ofNullable(node).map(expr -> ctx.allocate(ExprRef::new, scope, expr));
    }

    // === Subtype indications ===

    SubtypeInd lowerSubtypeInd(SubtypeIndRef ref) throws ScoreException {
        AstEntry<SubtypeIndNode> entry = ctx.ast(ref, SubtypeIndNode.class);
        SubtypeIndNode node = entry.node();
        ScopeRef scope = entry.requireParent();
        CompoundName mark = node.typeMark();

        ResolvedName resolved = ctx.resolveCompoundName(mark, scope);
        if (!resolved.tail().isEmpty() || resolved.defs().size() != 1
                || !(resolved.defs().get(0).value() instanceof TypeMarkRef type)) {
            ctx.emit(Diagnostic.error("`" + mark.text() + "` is not a type").span(mark.span()));
            throw new ScoreException();
        }
        Constraint constraint = node.constraint() != null ? lowerConstraint(node.constraint(), scope) : Constraint.NONE;
        return arenas().subtypeInds().store(new SubtypeInd(node.span(), new Spanned<>(type, mark.span()), constraint));
    }

    private Constraint lowerConstraint(ConstraintNode node, ScopeRef scope) {
        if (node instanceof ConstraintNode.RangeConstraint range) {
            return new Constraint.Range(range.span(), ctx.allocate(ExprRef::new, scope, range.range()));
        }
        if (node instanceof ConstraintNode.ArrayConstraint array) {
            Optional<List<ExprRef>> index = Optional.empty();
            if (array.index() != null) {
                List<ExprRef> refs = new ArrayList<>();
                for (ExprNode expr : array.index()) {
                    refs.add(ctx.allocate(ExprRef::new, scope, expr));
                }
                index = Optional.of(refs);
            }
            Optional<Constraint> element = Optional.ofNullable(array.element()).map(e -> lowerConstraint(e, scope));
            return new Constraint.Array(array.span(), index, element);
        }
        if (node instanceof ConstraintNode.RecordConstraint record) {
            Map<ResolvableName, Constraint> elements = new LinkedHashMap<>();
            for (ConstraintNode.ElementConstraint element : record.elements()) {
                elements.put(element.field().name(), lowerConstraint(element.constraint(), scope));
            }
            return new Constraint.Record(record.span(), elements);
        }
        throw new IllegalStateException("Unknown constraint: " + node.getClass().getSimpleName());
    }

    // === Expressions ===

    Expr lowerExpr(ExprRef ref) throws ScoreException {
        AstEntry<ExprNode> entry = ctx.ast(ref, ExprNode.class);
        ScopeRef scope = entry.requireParent();
        ExprData data = lowerExprData(entry.node(), scope);
        return arenas().exprs().store(new Expr(scope, entry.node().span(), data));
    }

    private ExprData lowerExprData(ExprNode node, ScopeRef scope) throws ScoreException {
        if (node instanceof ExprNode.NameExpr name) {
            return lowerName(name.name(), scope);
        }
        if (node instanceof ExprNode.IntLit lit) {
            return new ExprData.IntegerLiteral(lit.value());
        }
        if (node instanceof ExprNode.RealLit lit) {
            return new ExprData.FloatLiteral(lit.value());
        }
        if (node instanceof ExprNode.Unary unary) {
            return new ExprData.Unary(unary.op(), ctx.allocate(ExprRef::new, scope, unary.arg()));
        }
        if (node instanceof ExprNode.Binary binary) {
            return new ExprData.Binary(binary.op(),
                    ctx.allocate(ExprRef::new, scope, binary.lhs()),
                    ctx.allocate(ExprRef::new, scope, binary.rhs()));
        }
        if (node instanceof ExprNode.Range range) {
            return new ExprData.Range(range.dir(),
                    ctx.allocate(ExprRef::new, scope, range.lo()),
                    ctx.allocate(ExprRef::new, scope, range.hi()));
        }
        if (node instanceof ExprNode.Paren paren) {
            return lowerExprData(paren.inner(), scope);
        }
        throw new IllegalStateException("Unknown expression: " + node.getClass().getSimpleName());
    }

    /**
     * Resolves the longest prefix of the name and wraps every remaining selection or attribute
     * around it. Each wrapped prefix becomes an expression of its own.
     */
    private ExprData lowerName(CompoundName name, ScopeRef scope) throws ScoreException {
        ResolvedName resolved = ctx.resolveCompoundName(name, scope);
        Span span = resolved.validSpan();
        if (resolved.defs().size() > 1 && !resolved.defs().stream().allMatch(def -> def.value().isOverloadable())) {
            Diagnostic.Builder ambiguous = Diagnostic.error("`" + resolved.text() + "` is ambiguous")
                    .span(span).note("candidates:");
            for (Spanned<Def> candidate : resolved.defs()) {
                ambiguous.span(candidate.span());
            }
            ctx.emit(ambiguous);
            throw new ScoreException();
        }
        ExprData data = resolved.defs().size() == 1
                ? new ExprData.Name(resolved.defs().get(0).value(), span)
                : new ExprData.OverloadedName(resolved.defs(), span);

        int consumed = name.parts().size() - resolved.tail().size();
        for (NamePart part : resolved.tail()) {
            if (part instanceof NamePart.SelectAll) {
                ctx.emit(Diagnostic.error("dereferencing with `.all` is not yet supported").span(part.span()));
                throw new UnsupportedConstructException("dereference");
            }
            if (part instanceof NamePart.Call) {
                ctx.emit(Diagnostic.error("calls and indexed names are not yet supported").span(part.span()));
                throw new UnsupportedConstructException("call");
            }
            CompoundName prefixName = new CompoundName(span, name.primary(), name.parts().subList(0, consumed));
            ExprRef prefix = ctx.allocate(ExprRef::new, scope, new ExprNode.NameExpr(prefixName));
            ctx.scoreboard().hirTable().insert(prefix, arenas().exprs().store(new Expr(scope, span, data)));

            if (part instanceof NamePart.Select select) {
                data = new ExprData.Select(prefix, select.ident().spanned());
            } else if (part instanceof NamePart.Attribute attribute) {
                data = new ExprData.Attr(prefix, attribute.ident().spanned());
            }
            span = span.union(part.span());
            consumed++;
        }
        return data;
    }
}
