package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ExprRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeIndRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.Optional;

/**
 * A constant. Deferred constants have no initial value.
 */
public record ConstDecl(ScopeRef parent, Spanned<ResolvableName> name, SubtypeIndRef subtype, Optional<ExprRef> init) {
}
