package org.hdlscore.compiler.frontend.semantics;

import org.hdlscore.compiler.frontend.parser.ast.NamePart;
import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;

import java.util.List;

/**
 * The outcome of resolving the longest resolvable prefix of a compound name.
 *
 * @param name      The last name of the prefix.
 * @param defs      The definitions the prefix denotes, never empty.
 * @param validSpan The span of the prefix.
 * @param text      The prefix as written, for messages.
 * @param tail      The parts following the prefix that were not consumed.
 */
public record ResolvedName(
        ResolvableName name,
        List<Spanned<Def>> defs,
        Span validSpan,
        String text,
        List<NamePart> tail
) {
    public ResolvedName {
        defs = List.copyOf(defs);
        tail = List.copyOf(tail);
    }
}
