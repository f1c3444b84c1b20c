package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.frontend.score.id.SubtypeIndRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

/**
 * A subtype declaration.
 */
public record SubtypeDecl(ScopeRef parent, Spanned<ResolvableName> name, SubtypeIndRef subtype) {
}
