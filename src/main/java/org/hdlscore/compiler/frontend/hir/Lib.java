package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ArchRef;
import org.hdlscore.compiler.frontend.score.id.CfgRef;
import org.hdlscore.compiler.frontend.score.id.CtxRef;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.PkgBodyRef;
import org.hdlscore.compiler.frontend.score.id.PkgDeclRef;
import org.hdlscore.compiler.frontend.score.id.PkgInstRef;
import org.hdlscore.compiler.model.ResolvableName;

import java.util.List;

/**
 * A library: the design units it directly contains, grouped by kind and kept in source order.
 */
public record Lib(
        ResolvableName name,
        List<EntityRef> entities,
        List<CfgRef> cfgs,
        List<PkgDeclRef> pkgDecls,
        List<PkgInstRef> pkgInsts,
        List<CtxRef> ctxs,
        List<ArchRef> archs,
        List<PkgBodyRef> pkgBodies
) {
    public Lib {
        entities = List.copyOf(entities);
        cfgs = List.copyOf(cfgs);
        pkgDecls = List.copyOf(pkgDecls);
        pkgInsts = List.copyOf(pkgInsts);
        ctxs = List.copyOf(ctxs);
        archs = List.copyOf(archs);
        pkgBodies = List.copyOf(pkgBodies);
    }
}
