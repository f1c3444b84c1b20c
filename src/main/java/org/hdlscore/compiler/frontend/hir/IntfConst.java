package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeIndRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.Optional;

/**
 * An interface constant, i.e. one generic of an entity.
 */
public record IntfConst(Spanned<ResolvableName> name, SubtypeIndRef subtype, Optional<ExprRef> init) {
}
