package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.DeclInPkgRef;
import org.hdlscore.compiler.frontend.score.id.IntfConstRef;
import org.hdlscore.compiler.frontend.score.id.ScopeRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.List;

/**
 * A package declaration.
 *
 * @param parent   The context items for a primary unit, or the enclosing package for a nested one.
 * @param name     The package name.
 * @param generics The package generics.
 * @param decls    The declarations in source order, one per declared name.
 */
public record Package(
        ScopeRef parent,
        Spanned<ResolvableName> name,
        List<IntfConstRef> generics,
        List<DeclInPkgRef> decls
) {
    public Package {
        generics = List.copyOf(generics);
        decls = List.copyOf(decls);
    }
}
