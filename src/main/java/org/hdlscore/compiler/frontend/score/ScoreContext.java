package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.api.ScoreException;
import org.hdlscore.compiler.config.SessionOptions;
import org.hdlscore.compiler.diagnostics.Diagnostic;
import org.hdlscore.compiler.diagnostics.DiagnosticSink;
import org.hdlscore.compiler.frontend.hir.Arch;
import org.hdlscore.compiler.frontend.hir.ConstDecl;
import org.hdlscore.compiler.frontend.hir.Entity;
import org.hdlscore.compiler.frontend.hir.Expr;
import org.hdlscore.compiler.frontend.hir.FileDecl;
import org.hdlscore.compiler.frontend.hir.IntfConst;
import org.hdlscore.compiler.frontend.hir.IntfSignal;
import org.hdlscore.compiler.frontend.hir.Lib;
import org.hdlscore.compiler.frontend.hir.Package;
import org.hdlscore.compiler.frontend.hir.SignalDecl;
import org.hdlscore.compiler.frontend.hir.SubtypeDecl;
import org.hdlscore.compiler.frontend.hir.SubtypeInd;
import org.hdlscore.compiler.frontend.hir.TypeDecl;
import org.hdlscore.compiler.frontend.hir.VariableDecl;
import org.hdlscore.compiler.frontend.parser.ast.AstIdent;
import org.hdlscore.compiler.frontend.parser.ast.CompoundName;
import org.hdlscore.compiler.frontend.parser.ast.DesignUnit;
import org.hdlscore.compiler.frontend.parser.ast.DesignUnitNode;
import org.hdlscore.compiler.frontend.parser.ast.GenericDecl;
import org.hdlscore.compiler.frontend.parser.ast.LibraryNode;
import org.hdlscore.compiler.frontend.parser.ast.ObjectDeclNode;
import org.hdlscore.compiler.frontend.parser.ast.PortDecl;
import org.hdlscore.compiler.frontend.parser.ast.SubtypeDeclNode;
import org.hdlscore.compiler.frontend.parser.ast.TypeDeclNode;
import org.hdlscore.compiler.frontend.score.id.ArchRef;
import org.hdlscore.compiler.frontend.score.id.ConstDeclRef;
import org.hdlscore.compiler.frontend.score.id.CtxItemsRef;
import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.frontend.score.id.FileDeclRef;
import org.hdlscore.compiler.frontend.score.id.IntfConstRef;
import org.hdlscore.compiler.frontend.score.id.IntfSignalRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.frontend.score.id.NodeRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.frontend.score.id.SignalDeclRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeDeclRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeIndRef;
import org.hdlscore.compiler.frontend.score.id.TypeDeclRef;
import org.hdlscore.compiler.frontend.score.id.VarDeclRef;
import org.hdlscore.compiler.frontend.semantics.Defs;
import org.hdlscore.compiler.frontend.semantics.DefsResolver;
import org.hdlscore.compiler.frontend.semantics.NameResolver;
import org.hdlscore.compiler.frontend.semantics.ResolvedName;
import org.hdlscore.compiler.frontend.semantics.Scope;
import org.hdlscore.compiler.frontend.semantics.ScopeResolver;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * The entry point to the scoreboard of one compilation session. Every artifact is computed
 * on first request and cached: asking twice for the HIR, scope or definitions of the same
 * node yields the identical object, and a failed computation stays failed without reporting
 * its diagnostics again.
 * <p>
 * Failures are signalled with a {@link ScoreException}; the reason has been sent to the
 * {@link DiagnosticSink} by the time it is thrown. Misuse, such as passing a reference that
 * was not produced by this context, raises an {@link IllegalStateException}.
 * <p>
 * A context is confined to one thread.
 */
public final class ScoreContext {

    private static final Logger LOG = LoggerFactory.getLogger(ScoreContext.class);

    private final SessionOptions options;
    private final DiagnosticSink sink;
    private final Scoreboard scoreboard;
    private final HirBuilder hirBuilder;
    private final DefsResolver defsResolver;
    private final NameResolver nameResolver;
    private final ScopeResolver scopeResolver;

    public ScoreContext(SessionOptions options, DiagnosticSink sink) {
        this(options, sink, ScoreboardListener.NONE);
    }

    public ScoreContext(SessionOptions options, DiagnosticSink sink, ScoreboardListener listener) {
        this.options = options;
        this.sink = sink;
        this.scoreboard = new Scoreboard(listener, this::reportCycle);
        this.hirBuilder = new HirBuilder(this);
        this.defsResolver = new DefsResolver(this);
        this.nameResolver = new NameResolver(this);
        this.scopeResolver = new ScopeResolver(this, nameResolver);
    }

    // === Session setup ===

    /**
     * Adds a library and makes it known to library clauses under its name.
     *
     * @param name  The library name.
     * @param units The design units of the library in source order.
     * @return The reference of the new library.
     * @throws IllegalArgumentException if a library of that name was added before.
     */
    public LibRef addLibrary(String name, List<DesignUnitNode> units) {
        ResolvableName libName = ResolvableName.ident(name);
        LibRef lib = new LibRef(scoreboard.allocateId());
        scoreboard.libraries().register(libName, lib);
        scoreboard.syntax().register(lib, null, new LibraryNode(libName, units));
        LOG.debug("Added library {} as {} with {} design units", libName, lib, units.size());
        return lib;
    }

    // === HIR ===

    public Lib hir(LibRef ref) throws ScoreException {
        return lower(ref, Lib.class, hirBuilder::lowerLib);
    }

    public Entity hir(EntityRef ref) throws ScoreException {
        return lower(ref, Entity.class, hirBuilder::lowerEntity);
    }

    public Arch hir(ArchRef ref) throws ScoreException {
        return lower(ref, Arch.class, hirBuilder::lowerArch);
    }

    public IntfSignal hir(IntfSignalRef ref) throws ScoreException {
        return lower(ref, IntfSignal.class, hirBuilder::lowerIntfSignal);
    }

    public IntfConst hir(IntfConstRef ref) throws ScoreException {
        return lower(ref, IntfConst.class, hirBuilder::lowerIntfConst);
    }

    public SubtypeInd hir(SubtypeIndRef ref) throws ScoreException {
        return lower(ref, SubtypeInd.class, hirBuilder::lowerSubtypeInd);
    }

    public Package hir(PkgDeclRef ref) throws ScoreException {
        return lower(ref, Package.class, hirBuilder::lowerPackage);
    }

    public TypeDecl hir(TypeDeclRef ref) throws ScoreException {
        return lower(ref, TypeDecl.class, hirBuilder::lowerTypeDecl);
    }

    public SubtypeDecl hir(SubtypeDeclRef ref) throws ScoreException {
        return lower(ref, SubtypeDecl.class, hirBuilder::lowerSubtypeDecl);
    }

    public Expr hir(ExprRef ref) throws ScoreException {
        return lower(ref, Expr.class, hirBuilder::lowerExpr);
    }

    public ConstDecl hir(ConstDeclRef ref) throws ScoreException {
        return lower(ref, ConstDecl.class, hirBuilder::lowerConstDecl);
    }

    public SignalDecl hir(SignalDeclRef ref) throws ScoreException {
        return lower(ref, SignalDecl.class, hirBuilder::lowerSignalDecl);
    }

    public VariableDecl hir(VarDeclRef ref) throws ScoreException {
        return lower(ref, VariableDecl.class, hirBuilder::lowerVariableDecl);
    }

    public FileDecl hir(FileDeclRef ref) throws ScoreException {
        return lower(ref, FileDecl.class, hirBuilder::lowerFileDecl);
    }

    private <R extends NodeRef, T> T lower(R ref, Class<T> type, IQuery<R, T> query) throws ScoreException {
        Object value = scoreboard.hirTable().get(ref, key -> query.compute(ref));
        if (!type.isInstance(value)) {
            throw new IllegalStateException("HIR of " + ref + " is a " + value.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    // === Definitions and scopes ===

    /**
     * @return The definitions made by a scope-introducing construct.
     * @throws ScoreException if the table cannot be built, or building it is not supported for the
     *                        kind of construct ({@link org.hdlscore.compiler.api.UnsupportedConstructException}).
     */
    public Defs definitions(ScopeRef ref) throws ScoreException {
        return scoreboard.defsTable().get(ref, defsResolver::definitions);
    }

    /**
     * @return The scope of a scope-introducing construct.
     */
    public Scope scope(ScopeRef ref) throws ScoreException {
        return scoreboard.scopeTable().get(ref, scopeResolver::scope);
    }

    /**
     * Looks a simple name up in a scope and its parents.
     *
     * @return The definitions the name denotes, never empty.
     * @throws ScoreException if the name is not declared.
     */
    public List<Spanned<Def>> resolveName(Spanned<ResolvableName> name, ScopeRef scope) throws ScoreException {
        return nameResolver.resolve(name, scope(scope));
    }

    /**
     * Resolves the longest prefix of a compound name that denotes something, starting in a scope.
     */
    public ResolvedName resolveCompoundName(CompoundName name, ScopeRef scope) throws ScoreException {
        return nameResolver.resolveCompound(name, scope(scope));
    }

    // === Syntax ===

    /**
     * @return The syntax node of a reference together with its parent scope.
     * @throws IllegalStateException if the reference is unknown or its node is not of the given type.
     */
    public <T> AstEntry<T> ast(NodeRef ref, Class<T> type) {
        return scoreboard.syntax().get(ref, type);
    }

    /**
     * Creates a reference for a syntax node.
     */
    <R extends NodeRef> R allocate(IntFunction<R> factory, ScopeRef parent, Object node) {
        R ref = factory.apply(scoreboard.allocateId());
        scoreboard.syntax().register(ref, parent, node);
        return ref;
    }

    // === Diagnostics ===

    public void emit(Diagnostic.Builder diagnostic) {
        sink.emit(diagnostic);
    }

    private void reportCycle(String query, Object key) {
        Optional<AstIdent> name = nameOf(key);
        String described = name.map(ident -> "`" + ident.name() + "`").orElse(String.valueOf(key));
        Diagnostic.Builder diagnostic = Diagnostic.error(
                "circular dependency: " + query + " of " + described + " depends on itself");
        diagnostic.span(name.map(AstIdent::span).orElse(Span.BUILTIN));
        sink.emit(diagnostic);
    }

    private Optional<AstIdent> nameOf(Object key) {
        if (!(key instanceof NodeRef ref)) {
            return Optional.empty();
        }
        Object node = scoreboard.syntax().find(ref).orElse(null);
        if (node instanceof DesignUnitNode unitNode) {
            node = unitNode.unit();
        }
        if (node instanceof DesignUnit unit) {
            return Optional.of(unit.name());
        }
        if (node instanceof TypeDeclNode type) {
            return Optional.of(type.name());
        }
        if (node instanceof SubtypeDeclNode subtype) {
            return Optional.of(subtype.name());
        }
        if (node instanceof ObjectDeclNode object) {
            return Optional.of(object.names().get(0));
        }
        if (node instanceof PortDecl port) {
            return Optional.of(port.names().get(0));
        }
        if (node instanceof GenericDecl generic) {
            return Optional.of(generic.names().get(0));
        }
        return Optional.empty();
    }

    // === Accessors ===

    public SessionOptions options() {
        return options;
    }

    public Scoreboard scoreboard() {
        return scoreboard;
    }

    /**
     * @return The context items preceding a design unit.
     */
    public CtxItemsRef contextOf(NodeRef unit) {
        return scoreboard.syntax().contextOf(unit);
    }
}
