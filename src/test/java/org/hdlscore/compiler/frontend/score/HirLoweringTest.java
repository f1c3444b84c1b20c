package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.api.ScoreException;
import org.hdlscore.compiler.api.UnsupportedConstructException;
import org.hdlscore.compiler.config.SessionOptions;
import org.hdlscore.compiler.diagnostics.Diagnostic;
import org.hdlscore.compiler.diagnostics.DiagnosticsEngine;
import org.hdlscore.compiler.frontend.hir.Arch;
import org.hdlscore.compiler.frontend.hir.ConstDecl;
import org.hdlscore.compiler.frontend.hir.Entity;
import org.hdlscore.compiler.frontend.hir.Expr;
import org.hdlscore.compiler.frontend.hir.ExprData;
import org.hdlscore.compiler.frontend.hir.IntfConst;
import org.hdlscore.compiler.frontend.hir.IntfSignal;
import org.hdlscore.compiler.frontend.hir.Lib;
import org.hdlscore.compiler.frontend.hir.Package;
import org.hdlscore.compiler.frontend.hir.SignalDecl;
import org.hdlscore.compiler.frontend.hir.TypeData;
import org.hdlscore.compiler.frontend.hir.TypeDecl;
import org.hdlscore.compiler.frontend.parser.ast.ArchBody;
import org.hdlscore.compiler.frontend.parser.ast.ExprNode;
import org.hdlscore.compiler.frontend.parser.ast.IntfMode;
import org.hdlscore.compiler.frontend.parser.ast.ObjectDeclNode;
import org.hdlscore.compiler.frontend.score.id.ConstDeclRef;
import org.hdlscore.compiler.frontend.score.id.EnumRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.frontend.score.id.SignalDeclRef;
import org.hdlscore.compiler.frontend.score.id.TypeDeclRef;
import org.hdlscore.compiler.frontend.semantics.BuiltinPackages;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.testutils.SyntaxFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HirLoweringTest {

    private DiagnosticsEngine diagnostics;
    private SyntaxFixtures syntax;
    private ScoreContext ctx;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        syntax = new SyntaxFixtures("lower.vhd");
        ctx = new ScoreContext(SessionOptions.defaults(), diagnostics);
    }

    private Package firstPackage(LibRef lib) throws ScoreException {
        return ctx.hir(ctx.hir(lib).pkgDecls().get(0));
    }

    @Test
    @Tag("unit")
    void libraryListsUnitsByKind() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(
                syntax.unit(syntax.entity("top")),
                syntax.unit(syntax.arch("rtl", "top")),
                syntax.unit(syntax.pkg("p")),
                syntax.unit(syntax.pkgInst("pi", "work.p")),
                syntax.unit(syntax.cfg("c", "top"))));

        Lib hir = ctx.hir(lib);

        assertThat(hir.name()).isEqualTo(ResolvableName.ident("work"));
        assertThat(hir.entities()).hasSize(1);
        assertThat(hir.archs()).hasSize(1);
        assertThat(hir.pkgDecls()).hasSize(1);
        assertThat(hir.pkgInsts()).hasSize(1);
        assertThat(hir.cfgs()).hasSize(1);
        assertThat(hir.ctxs()).isEmpty();
        assertThat(hir.pkgBodies()).isEmpty();
    }

    @Test
    @Tag("unit")
    void architectureBindsItsEntity() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(
                syntax.unit(syntax.entity("top")),
                syntax.unit(syntax.arch("rtl", "top"))));
        Lib hir = ctx.hir(lib);

        Arch arch = ctx.hir(hir.archs().get(0));

        assertThat(arch.entity()).isEqualTo(hir.entities().get(0));
        assertThat(arch.lib()).isEqualTo(lib);
        assertThat(arch.name().value()).isEqualTo(ResolvableName.ident("rtl"));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void architectureOfUnknownEntityFails() throws Exception {
        ArchBody body = syntax.arch("rtl", "missing");
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.entity("top")), syntax.unit(body)));

        assertThatThrownBy(() -> ctx.hir(ctx.hir(lib).archs().get(0))).isInstanceOf(ScoreException.class);

        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.message()).isEqualTo("no entity named `missing` in library `work`");
            assertThat(d.spans()).containsExactly(body.entity().span());
        });
    }

    @Test
    @Tag("unit")
    void portsAndGenericsResolveTheirTypeMarks() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.entity("top",
                List.of(syntax.generic("width", "integer")),
                List.of(syntax.port("clk", IntfMode.IN, "bit"), syntax.port("q", IntfMode.OUT, "bit"))))));
        Entity entity = ctx.hir(ctx.hir(lib).entities().get(0));

        assertThat(entity.generics()).hasSize(1);
        assertThat(entity.ports()).hasSize(2);
        IntfSignal clk = ctx.hir(entity.ports().get(0));
        assertThat(clk.name().value()).isEqualTo(ResolvableName.ident("clk"));
        assertThat(clk.mode()).isEqualTo(IntfMode.IN);
        assertThat(ctx.hir(clk.subtype()).typeMark().value()).isEqualTo(BuiltinPackages.BIT);
        assertThat(ctx.hir(ctx.hir(entity.generics().get(0)).subtype()).typeMark().value())
                .isEqualTo(BuiltinPackages.INTEGER);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void packageGenericsAreLoweredInThePackageScope() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                List.of(syntax.generic("width", "integer")),
                syntax.constant("c", "integer", syntax.intLit(1))))));
        Package pkg = firstPackage(lib);

        assertThat(pkg.generics()).hasSize(1);
        IntfConst width = ctx.hir(pkg.generics().get(0));
        assertThat(width.name().value()).isEqualTo(ResolvableName.ident("width"));
        assertThat(ctx.hir(width.subtype()).typeMark().value()).isEqualTo(BuiltinPackages.INTEGER);
        assertThat(pkg.decls()).hasSize(1);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void typeMarkMustDenoteAType() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                syntax.constant("c", "integer", syntax.intLit(1)),
                syntax.signal("s", "c")))));
        Package pkg = firstPackage(lib);
        SignalDecl signal = ctx.hir((SignalDeclRef) pkg.decls().get(1));

        assertThatThrownBy(() -> ctx.hir(signal.subtype())).isInstanceOf(ScoreException.class);

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("`c` is not a type");
    }

    @Test
    @Tag("unit")
    void rangeBoundsAreResolvedOnDemand() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                syntax.constant("max", "integer", syntax.intLit(7)),
                syntax.rangeType("small", syntax.intLit(0), syntax.nameExpr("max"))))));
        PkgDeclRef pkgRef = ctx.hir(lib).pkgDecls().get(0);
        Package pkg = ctx.hir(pkgRef);

        TypeDecl type = ctx.hir((TypeDeclRef) pkg.decls().get(1));
        assertThat(ctx.scoreboard().defsTable().contains(pkgRef)).isFalse();

        TypeData.RangeType range = (TypeData.RangeType) type.data().orElseThrow();
        assertThat(ctx.hir(range.lo()).data()).isEqualTo(new ExprData.IntegerLiteral(BigInteger.ZERO));
        ExprData hi = ctx.hir(range.hi()).data();
        assertThat(hi).isInstanceOf(ExprData.Name.class);
        assertThat(((ExprData.Name) hi).def()).isEqualTo(pkg.decls().get(0));
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void enumerationLiteralSharedByTwoTypesIsOverloaded() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                syntax.enumType("t1", "a", "b"),
                syntax.enumType("t2", "a", "c"),
                syntax.constant("k", "t1", syntax.nameExpr("a"))))));
        Package pkg = firstPackage(lib);
        ConstDecl k = ctx.hir((ConstDeclRef) pkg.decls().get(2));

        ExprData data = ctx.hir(k.init().orElseThrow()).data();

        assertThat(data).isInstanceOf(ExprData.OverloadedName.class);
        assertThat(((ExprData.OverloadedName) data).candidates())
                .extracting(candidate -> candidate.value())
                .containsExactly(
                        new EnumRef((TypeDeclRef) pkg.decls().get(0), 0),
                        new EnumRef((TypeDeclRef) pkg.decls().get(1), 0));
    }

    @Test
    @Tag("unit")
    void homographConstantsFromTwoPackagesAreAmbiguous() throws Exception {
        ObjectDeclNode first = syntax.constant("c", "integer", syntax.intLit(1));
        ObjectDeclNode second = syntax.constant("c", "integer", syntax.intLit(2));
        ExprNode.NameExpr use = syntax.nameExpr("c");
        LibRef lib = ctx.addLibrary("work", List.of(
                syntax.unit(syntax.pkg("p1", first)),
                syntax.unit(syntax.pkg("p2", second)),
                syntax.unit(syntax.pkg("q", syntax.constant("d", "integer", use)),
                        syntax.use("work.p1.all", "work.p2.all"))));
        Package q = ctx.hir(ctx.hir(lib).pkgDecls().get(2));
        ConstDecl d = ctx.hir((ConstDeclRef) q.decls().get(0));

        assertThatThrownBy(() -> ctx.hir(d.init().orElseThrow())).isInstanceOf(ScoreException.class);

        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(diag -> {
            assertThat(diag.message()).isEqualTo("`c` is ambiguous");
            assertThat(diag.spans()).containsExactly(use.name().span());
            assertThat(diag.notes()).singleElement().satisfies(note -> {
                assertThat(note.message()).isEqualTo("candidates:");
                assertThat(note.spans()).containsExactly(first.names().get(0).span(), second.names().get(0).span());
            });
        });
    }

    @Test
    @Tag("unit")
    void selectedNameThroughLibraryAndPackage() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                syntax.constant("k", "integer", syntax.intLit(1)),
                syntax.constant("j", "integer", syntax.nameExpr("work.p.k"))))));
        Package pkg = firstPackage(lib);
        ConstDecl j = ctx.hir((ConstDeclRef) pkg.decls().get(1));

        Expr init = ctx.hir(j.init().orElseThrow());

        assertThat(init.data()).isInstanceOf(ExprData.Name.class);
        ExprData.Name name = (ExprData.Name) init.data();
        assertThat(name.def()).isEqualTo(pkg.decls().get(0));
        assertThat(name.span()).isEqualTo(init.span());
    }

    @Test
    @Tag("unit")
    void unresolvedSuffixesWrapTheResolvedPrefix() throws Exception {
        ExprNode.NameExpr attribute = syntax.nameExpr("k'high");
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                syntax.constant("k", "integer", syntax.intLit(1)),
                syntax.constant("j", "integer", syntax.nameExpr("k.field")),
                syntax.constant("h", "integer", attribute)))));
        Package pkg = firstPackage(lib);
        ConstDeclRef k = (ConstDeclRef) pkg.decls().get(0);

        ExprData select = ctx.hir(ctx.hir((ConstDeclRef) pkg.decls().get(1)).init().orElseThrow()).data();
        ExprData attr = ctx.hir(ctx.hir((ConstDeclRef) pkg.decls().get(2)).init().orElseThrow()).data();

        assertThat(select).isInstanceOf(ExprData.Select.class);
        ExprData.Select selection = (ExprData.Select) select;
        assertThat(selection.name().value()).isEqualTo(ResolvableName.ident("field"));
        assertThat(ctx.hir(selection.prefix()).data()).isInstanceOf(ExprData.Name.class);
        assertThat(((ExprData.Name) ctx.hir(selection.prefix()).data()).def()).isEqualTo(k);

        assertThat(attr).isInstanceOf(ExprData.Attr.class);
        ExprData.Attr attrData = (ExprData.Attr) attr;
        assertThat(attrData.name().value()).isEqualTo(ResolvableName.ident("high"));
        assertThat(ctx.hir(attrData.prefix()).span()).isEqualTo(attribute.name().primary().span());
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void callsAreNotYetSupported() throws Exception {
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p",
                syntax.constant("k", "integer", syntax.intLit(1)),
                syntax.constant("j", "integer", new ExprNode.NameExpr(syntax.call("k")))))));
        Package pkg = firstPackage(lib);
        ConstDecl j = ctx.hir((ConstDeclRef) pkg.decls().get(1));

        assertThatThrownBy(() -> ctx.hir(j.init().orElseThrow()))
                .isInstanceOf(UnsupportedConstructException.class);

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("calls and indexed names are not yet supported");
    }

    @Test
    @Tag("unit")
    void multiNameDeclarationYieldsOneReferencePerName() throws Exception {
        ObjectDeclNode pair = ObjectDeclNode.constant(syntax.span(1),
                List.of(syntax.ident("x"), syntax.ident("y")), syntax.subtypeInd("integer"), null);
        LibRef lib = ctx.addLibrary("work", List.of(syntax.unit(syntax.pkg("p", pair))));
        Package pkg = firstPackage(lib);

        assertThat(pkg.decls()).hasSize(2);
        assertThat(ctx.hir((ConstDeclRef) pkg.decls().get(0)).name().value()).isEqualTo(ResolvableName.ident("x"));
        assertThat(ctx.hir((ConstDeclRef) pkg.decls().get(1)).name().value()).isEqualTo(ResolvableName.ident("y"));
        assertThat(ctx.hir((ConstDeclRef) pkg.decls().get(1)).init()).isEmpty();
    }
}
