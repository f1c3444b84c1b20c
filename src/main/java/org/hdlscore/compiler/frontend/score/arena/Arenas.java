package org.hdlscore.compiler.frontend.score.arena;

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
import org.hdlscore.compiler.frontend.semantics.Defs;
import org.hdlscore.compiler.frontend.semantics.Scope;

/**
 * The storage backing every artifact the scoreboard produces: one arena per HIR node kind,
 * plus one for definition tables and one for scopes. Memo tables hold the values, the
 * arenas own them and keep them alive for the whole session.
 */
public final class Arenas {

    private final Arena<Lib> libs = new Arena<>("lib");
    private final Arena<Entity> entities = new Arena<>("entity");
    private final Arena<Arch> archs = new Arena<>("arch");
    private final Arena<IntfSignal> intfSignals = new Arena<>("intf_signal");
    private final Arena<IntfConst> intfConsts = new Arena<>("intf_const");
    private final Arena<SubtypeInd> subtypeInds = new Arena<>("subtype_ind");
    private final Arena<Package> packages = new Arena<>("package");
    private final Arena<TypeDecl> typeDecls = new Arena<>("type_decl");
    private final Arena<SubtypeDecl> subtypeDecls = new Arena<>("subtype_decl");
    private final Arena<Expr> exprs = new Arena<>("expr");
    private final Arena<ConstDecl> constDecls = new Arena<>("const_decl");
    private final Arena<SignalDecl> signalDecls = new Arena<>("signal_decl");
    private final Arena<VariableDecl> variableDecls = new Arena<>("variable_decl");
    private final Arena<FileDecl> fileDecls = new Arena<>("file_decl");
    private final Arena<Defs> defs = new Arena<>("defs");
    private final Arena<Scope> scopes = new Arena<>("scope");

    public Arena<Lib> libs() {
        return libs;
    }

    public Arena<Entity> entities() {
        return entities;
    }

    public Arena<Arch> archs() {
        return archs;
    }

    public Arena<IntfSignal> intfSignals() {
        return intfSignals;
    }

    public Arena<IntfConst> intfConsts() {
        return intfConsts;
    }

    public Arena<SubtypeInd> subtypeInds() {
        return subtypeInds;
    }

    public Arena<Package> packages() {
        return packages;
    }

    public Arena<TypeDecl> typeDecls() {
        return typeDecls;
    }

    public Arena<SubtypeDecl> subtypeDecls() {
        return subtypeDecls;
    }

    public Arena<Expr> exprs() {
        return exprs;
    }

    public Arena<ConstDecl> constDecls() {
        return constDecls;
    }

    public Arena<SignalDecl> signalDecls() {
        return signalDecls;
    }

    public Arena<VariableDecl> variableDecls() {
        return variableDecls;
    }

    public Arena<FileDecl> fileDecls() {
        return fileDecls;
    }

    public Arena<Defs> defs() {
        return defs;
    }

    public Arena<Scope> scopes() {
        return scopes;
    }
}
