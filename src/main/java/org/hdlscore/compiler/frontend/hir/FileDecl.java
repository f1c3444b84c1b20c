package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeIndRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.Optional;

/**
 * A file declaration.
 *
 * @param open The file open information, absent if the file is not opened on declaration.
 */
public record FileDecl(ScopeRef parent, Spanned<ResolvableName> name, SubtypeIndRef subtype, Optional<FileOpen> open) {

    /**
     * @param filename The expression yielding the logical file name.
     * @param kind     The optional expression yielding the open kind.
     */
    public record FileOpen(ExprRef filename, Optional<ExprRef> kind) {}
}
