package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ConcStmtRef;
import org.hdlscore.compiler.frontend.score.id.CtxItemsRef;
import org.hdlscore.compiler.frontend.score.id.DeclInBlockRef;
import org.hdlscore.compiler.frontend.score.id.EntityRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.List;

/**
 * An architecture body.
 *
 * @param ctxItems The context items preceding the architecture.
 * @param lib      The library containing the architecture.
 * @param name     The architecture name.
 * @param entity   The entity this architecture implements.
 * @param decls    The declarations in the declarative part.
 * @param stmts    The concurrent statements.
 */
public record Arch(
        CtxItemsRef ctxItems,
        LibRef lib,
        Spanned<ResolvableName> name,
        EntityRef entity,
        List<DeclInBlockRef> decls,
        List<ConcStmtRef> stmts
) {
    public Arch {
        decls = List.copyOf(decls);
        stmts = List.copyOf(stmts);
    }
}
