package org.hdlscore.compiler.frontend.semantics;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.hdlscore.compiler.api.ScoreException;
import org.hdlscore.compiler.api.UnsupportedConstructException;
import org.hdlscore.compiler.config.SessionOptions;
import org.hdlscore.compiler.diagnostics.Diagnostic;
import org.hdlscore.compiler.diagnostics.DiagnosticsEngine;
import org.hdlscore.compiler.frontend.hir.Lib;
import org.hdlscore.compiler.frontend.parser.ast.CtxItem;
import org.hdlscore.compiler.frontend.parser.ast.EntityDecl;
import org.hdlscore.compiler.frontend.parser.ast.ObjectDeclNode;
import org.hdlscore.compiler.frontend.parser.ast.PkgDecl;
import org.hdlscore.compiler.frontend.parser.ast.TypeDeclNode;
import org.hdlscore.compiler.frontend.score.ScoreContext;
import org.hdlscore.compiler.frontend.score.id.CtxItemsRef;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.EnumRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;
import org.hdlscore.compiler.testutils.SyntaxFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

public class DefsResolverTest {

    private DiagnosticsEngine diagnostics;
    private SyntaxFixtures syntax;
    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        syntax = new SyntaxFixtures("defs.vhd");
        logger = (Logger) LoggerFactory.getLogger(DefsResolver.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        logger.setLevel(null);
    }

    private ScoreContext context(SessionOptions options) {
        return new ScoreContext(options, diagnostics);
    }

    private static ResolvableName name(String text) {
        return ResolvableName.ident(text);
    }

    // === Library ===

    @Test
    @Tag("unit")
    void libraryDefinesItsPrimaryUnits() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef lib = ctx.addLibrary("work", List.of(
                syntax.unit(syntax.entity("top")),
                syntax.unit(syntax.arch("rtl", "top")),
                syntax.unit(syntax.pkg("p")),
                syntax.unit(syntax.cfg("c", "top"))));

        Defs defs = ctx.definitions(lib);

        assertThat(defs.names()).containsExactly(name("top"), name("c"), name("p"));
        assertThat(defs.get(name("top"))).extracting(Spanned::value).containsExactly(ctx.hir(lib).entities().get(0));
        assertThat(defs.contains(name("rtl"))).isFalse();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void duplicateUnitsAreReportedOnceWithEverySpan() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        EntityDecl first = syntax.entity("foo");
        PkgDecl second = syntax.pkg("foo");
        LibRef lib = ctx.addLibrary("work", List.of(
                syntax.unit(first), syntax.unit(syntax.entity("bar")), syntax.unit(second)));

        ScoreException failure = catchThrowableOfType(() -> ctx.definitions(lib), ScoreException.class);
        Throwable again = catchThrowableOfType(() -> ctx.definitions(lib), ScoreException.class);

        assertThat(again).isSameAs(failure);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.message()).isEqualTo("`foo` declared multiple times");
            assertThat(d.spans()).containsExactly(first.name().span(), second.name().span());
        });
    }

    @Test
    @Tag("unit")
    void duplicateUnitsDowngradeToWarningWhenIgnored() throws Exception {
        ScoreContext ctx = context(new SessionOptions(false, true));
        LibRef lib = ctx.addLibrary("work", List.of(
                syntax.unit(syntax.entity("foo")), syntax.unit(syntax.entity("foo"))));
        Lib hir = ctx.hir(lib);

        Defs defs = ctx.definitions(lib);

        assertThat(defs.get(name("foo"))).extracting(Spanned::value).containsExactly(hir.entities().get(0));
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.count(Diagnostic.Type.WARNING)).isEqualTo(1);
    }

    // === Package declarations ===

    @Test
    @Tag("unit")
    void enumerationLiteralsOverload() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                syntax.enumType("t1", "a", "b"),
                syntax.enumType("t2", "a", "'0'")))));
        PkgDeclRef pkg = ctx.hir(lib).pkgDecls().get(0);

        Defs defs = ctx.definitions(pkg);

        assertThat(defs.get(name("a"))).hasSize(2).allSatisfy(def -> assertThat(def.value()).isInstanceOf(EnumRef.class));
        assertThat(defs.get(ResolvableName.bit('0'))).hasSize(1);
        assertThat(defs.names()).contains(name("t1"), name("t2"), name("b"));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void redeclarationPointsAtThePreviousDeclaration() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        ObjectDeclNode first = syntax.constant("x", "integer", syntax.intLit(1));
        ObjectDeclNode second = syntax.signal("x", "bit");
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p", first, second))));
        PkgDeclRef pkg = ctx.hir(lib).pkgDecls().get(0);

        assertThatThrownBy(() -> ctx.definitions(pkg)).isInstanceOf(ScoreException.class);

        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.message()).isEqualTo("`x` has already been declared");
            assertThat(d.spans()).containsExactly(second.names().get(0).span());
            assertThat(d.notes()).singleElement().satisfies(note -> {
                assertThat(note.message()).isEqualTo("previous declaration was here:");
                assertThat(note.spans()).containsExactly(first.names().get(0).span());
            });
        });
    }

    @Test
    @Tag("unit")
    void literalAndConstantDoNotOverload() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        TypeDeclNode type = syntax.enumType("t", "a");
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                type,
                syntax.constant("a", "t", null),
                syntax.constant("z", "t", null),
                syntax.constant("z", "t", null)))));
        PkgDeclRef pkg = ctx.hir(lib).pkgDecls().get(0);

        assertThatThrownBy(() -> ctx.definitions(pkg)).isInstanceOf(ScoreException.class);

        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::message)
                .containsExactly("`a` has already been declared", "`z` has already been declared");
    }

    @Test
    @Tag("unit")
    void nestedPackagesAreDeclared() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("outer", syntax.pkg("inner")))));
        PkgDeclRef outer = ctx.hir(lib).pkgDecls().get(0);

        Defs defs = ctx.definitions(outer);

        assertThat(defs.get(name("inner"))).singleElement()
                .satisfies(def -> assertThat(def.value()).isEqualTo(ctx.hir(outer).decls().get(0)));
    }

    // === Context items ===

    @Test
    @Tag("unit")
    void workIsDeclaredImplicitly() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef lib = ctx.addLibrary("mylib", List.of(syntax.unit(syntax.entity("top"))));
        CtxItemsRef ctxItems = ctx.contextOf(ctx.hir(lib).entities().get(0));

        Defs defs = ctx.definitions(ctxItems);

        assertThat(defs.get(DefsResolver.WORK)).containsExactly(new Spanned<>(lib, Span.BUILTIN));
    }

    @Test
    @Tag("unit")
    void libraryClausesBindRegisteredLibraries() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef ieee = ctx.addLibrary("ieee", List.of());
        CtxItem.LibClause clause = syntax.library("ieee", "work");
        LibRef lib = ctx.addLibrary("mylib", List.of(syntax.unit(syntax.entity("top"), clause)));
        CtxItemsRef ctxItems = ctx.contextOf(ctx.hir(lib).entities().get(0));

        Defs defs = ctx.definitions(ctxItems);

        assertThat(defs.get(name("ieee"))).containsExactly(new Spanned<>(ieee, clause.names().get(0).span()));
        assertThat(defs.get(DefsResolver.WORK)).containsExactly(new Spanned<>(lib, clause.names().get(1).span()));
    }

    @Test
    @Tag("unit")
    void unknownAndRepeatedLibrariesAreAllReported() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        ctx.addLibrary("ieee", List.of());
        CtxItem.LibClause clause = syntax.library("nosuch", "ieee", "ieee");
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.entity("top"), clause)));
        CtxItemsRef ctxItems = ctx.contextOf(ctx.hir(lib).entities().get(0));

        assertThatThrownBy(() -> ctx.definitions(ctxItems)).isInstanceOf(ScoreException.class);

        assertThat(diagnostics.getDiagnostics()).hasSize(2);
        Diagnostic unknown = diagnostics.getDiagnostics().get(0);
        assertThat(unknown.message()).isEqualTo("no library named `nosuch` found");
        assertThat(unknown.spans()).containsExactly(clause.names().get(0).span());
        Diagnostic repeated = diagnostics.getDiagnostics().get(1);
        assertThat(repeated.message()).isEqualTo("`ieee` has already been declared");
        assertThat(repeated.notes()).singleElement()
                .satisfies(note -> assertThat(note.spans()).containsExactly(clause.names().get(1).span()));
    }

    @Test
    @Tag("unit")
    void contextReferencesAreNotYetSupported() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.entity("top"), syntax.contextRef("work.c"))));
        CtxItemsRef ctxItems = ctx.contextOf(ctx.hir(lib).entities().get(0));

        assertThatThrownBy(() -> ctx.definitions(ctxItems)).isInstanceOf(ScoreException.class);

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("context references are not yet supported");
    }

    // === Unsupported tables ===

    @Test
    @Tag("unit")
    void entityDeclarationsAreNotYetSupported() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.entity("top"))));
        EntityRef entity = ctx.hir(lib).entities().get(0);

        UnsupportedConstructException failure =
                catchThrowableOfType(() -> ctx.definitions(entity), UnsupportedConstructException.class);

        assertThat(failure.getConstruct()).isEqualTo("entity");
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("declarations in entity `top` are not yet supported");
    }

    @Test
    @Tag("unit")
    void packageInstanceDeclarationsAreNotYetSupported() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkgInst("inst", "work.p"))));

        assertThatThrownBy(() -> ctx.definitions(ctx.hir(lib).pkgInsts().get(0)))
                .isInstanceOf(UnsupportedConstructException.class);
        assertThat(diagnostics.getDiagnostics()).hasSize(1);
    }

    // === Tracing ===

    @Test
    @Tag("unit")
    void traceLogsEveryDeclaration() throws Exception {
        logger.setLevel(Level.INFO);
        ScoreContext ctx = context(new SessionOptions(true, false));
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p", syntax.enumType("t", "a")))));

        ctx.definitions(ctx.hir(lib).pkgDecls().get(0));

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message).startsWith("Declaring `t` as"))
                .anySatisfy(message -> assertThat(message).startsWith("Declaring `a` as"));
    }

    @Test
    @Tag("unit")
    void rejectedRedeclarationIsNotTraced() throws Exception {
        logger.setLevel(Level.INFO);
        ScoreContext ctx = context(new SessionOptions(true, false));
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                syntax.constant("x", "integer", null),
                syntax.signal("x", "bit")))));
        PkgDeclRef pkg = ctx.hir(lib).pkgDecls().get(0);

        assertThatThrownBy(() -> ctx.definitions(pkg)).isInstanceOf(ScoreException.class);

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .filteredOn(message -> message.startsWith("Declaring `x` as"))
                .hasSize(1);
    }

    @Test
    @Tag("unit")
    void noTraceByDefault() throws Exception {
        ScoreContext ctx = context(SessionOptions.defaults());
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p", syntax.enumType("t", "a")))));

        ctx.definitions(ctx.hir(lib).pkgDecls().get(0));

        assertThat(appender.list).noneMatch(event -> event.getLevel() == Level.INFO);
    }
}
