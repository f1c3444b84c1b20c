package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.Optional;

/**
 * A type declaration. Incomplete type declarations carry no data.
 */
public record TypeDecl(ScopeRef parent, Spanned<ResolvableName> name, Optional<TypeData> data) {
}
