package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.api.ScoreException;
import org.hdlscore.compiler.config.SessionOptions;
import org.hdlscore.compiler.diagnostics.Diagnostic;
import org.hdlscore.compiler.diagnostics.DiagnosticsEngine;
import org.hdlscore.compiler.frontend.hir.Lib;
import org.hdlscore.compiler.frontend.hir.TypeDecl;
import org.hdlscore.compiler.frontend.parser.ast.DesignUnitNode;
import org.hdlscore.compiler.frontend.parser.ast.EntityDecl;
import org.hdlscore.compiler.frontend.parser.ast.PkgDecl;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.frontend.score.id.TypeDeclRef;
import org.hdlscore.compiler.frontend.semantics.Defs;
import org.hdlscore.compiler.frontend.semantics.Scope;
import org.hdlscore.compiler.testutils.SyntaxFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
public class ScoreContextTest {

    @Mock
    private ScoreboardListener listener;

    private DiagnosticsEngine diagnostics;
    private SyntaxFixtures syntax;
    private ScoreContext ctx;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        syntax = new SyntaxFixtures("test.vhd");
        ctx = new ScoreContext(SessionOptions.defaults(), diagnostics, listener);
    }

    @Test
    @Tag("unit")
    void repeatedQueriesReturnTheCachedArtifact() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.entity("foo"))));

        Lib first = ctx.hir(lib);
        Lib second = ctx.hir(lib);
        Defs defs = ctx.definitions(lib);
        Scope scope = ctx.scope(lib);

        assertThat(second).isSameAs(first);
        assertThat(ctx.definitions(lib)).isSameAs(defs);
        assertThat(ctx.scope(lib)).isSameAs(scope);
        verify(listener, times(1)).onCompute(Scoreboard.HIR, lib);
        verify(listener, times(1)).onCompute(Scoreboard.DEFINITIONS, lib);
        verify(listener, times(1)).onCompute(Scoreboard.SCOPE, lib);
        assertThat(ctx.scoreboard().hirTable().computations()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void artifactsSurviveUnrelatedQueries() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p", syntax.enumType("t", "a", "b")))));
        PkgDeclRef pkg = ctx.hir(lib).pkgDecls().get(0);
        TypeDeclRef type = (TypeDeclRef) ctx.hir(pkg).decls().get(0);
        TypeDecl typeDecl = ctx.hir(type);

        List<DesignUnitNode> others = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            others.add(syntax.unit(syntax.pkg("q" + i, syntax.enumType("e" + i, "x", "y"))));
        }
        LibRef other = ctx.addLibrary("other", others);
        for (PkgDeclRef otherPkg : ctx.hir(other).pkgDecls()) {
            ctx.definitions(otherPkg);
            ctx.scope(otherPkg);
        }

        assertThat(ctx.hir(type)).isSameAs(typeDecl);
        assertThat(ctx.scoreboard().arenas().typeDecls().get(0)).isSameAs(typeDecl);
        assertThat(ctx.scoreboard().arenas().typeDecls().size()).isEqualTo(51);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void astLookupReturnsNodeAndParent() throws Exception {
        EntityDecl entity = syntax.entity("foo");
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(entity)));
        EntityRef ref = ctx.hir(lib).entities().get(0);

        AstEntry<EntityDecl> entry = ctx.ast(ref, EntityDecl.class);

        assertThat(entry.node()).isSameAs(entity);
        assertThat(entry.parent()).contains(lib);
    }

    @Test
    @Tag("unit")
    void foreignReferencesAreContractViolations() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.entity("foo"))));
        ctx.hir(lib);

        assertThatThrownBy(() -> ctx.ast(lib, PkgDecl.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("LibraryNode");
        assertThatThrownBy(() -> ctx.hir(new EntityRef(lib.id())))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ctx.hir(new EntityRef(9999)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("never registered");
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void libraryNamesAreUnique() {
        ctx.addLibrary("work", List.of());

        assertThatThrownBy(() -> ctx.addLibrary("WORK", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void reentrantQueryReportsCircularDependency() throws Exception {
        AtomicReference<PkgDeclRef> target = new AtomicReference<>();
        AtomicReference<ScoreContext> holder = new AtomicReference<>();
        List<ScoreException> failures = new ArrayList<>();
        ScoreboardListener reentering = (query, key) -> {
            if (Scoreboard.SCOPE.equals(query) && key.equals(target.get())) {
                try {
                    holder.get().scope(target.get());
                } catch (ScoreException e) {
                    failures.add(e);
                }
            }
        };
        ScoreContext reentrant = new ScoreContext(SessionOptions.defaults(), diagnostics, reentering);
        holder.set(reentrant);
        PkgDecl decl = syntax.pkg("p");
        LibRef lib = reentrant.addLibrary("work", List.of(syntax.unit(decl)));
        target.set(reentrant.hir(lib).pkgDecls().get(0));

        reentrant.scope(target.get());

        assertThat(failures).hasSize(1);
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
        Diagnostic diagnostic = diagnostics.getDiagnostics().get(0);
        assertThat(diagnostic.type()).isEqualTo(Diagnostic.Type.ERROR);
        assertThat(diagnostic.message()).isEqualTo("circular dependency: scope of `p` depends on itself");
        assertThat(diagnostic.spans()).containsExactly(decl.name().span());
    }
}
