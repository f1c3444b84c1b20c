package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.parser.ast.IntfMode;
import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeIndRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.Optional;

/**
 * An interface signal, i.e. one port of an entity.
 */
public record IntfSignal(
        Spanned<ResolvableName> name,
        IntfMode mode,
        SubtypeIndRef subtype,
        boolean bus,
        Optional<ExprRef> init
) {
}
