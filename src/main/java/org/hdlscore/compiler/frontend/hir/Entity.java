package org.hdlscore.compiler.frontend.hir;

import org.hdlscore.compiler.frontend.score.id.CtxItemsRef;
import org.hdlscore.compiler.frontend.score.id.IntfConstRef;
import org.hdlscore.compiler.frontend.score.id.IntfSignalRef;
import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Spanned;

import java.util.List;

/**
 * An entity declaration.
 *
 * @param ctxItems The context items preceding the entity.
 * @param lib      The library containing the entity.
 * @param name     The entity name.
 * @param generics The generic constants in declaration order, one per declared name.
 * @param ports    The ports in declaration order, one per declared name.
 */
public record Entity(
        CtxItemsRef ctxItems,
        LibRef lib,
        Spanned<ResolvableName> name,
        List<IntfConstRef> generics,
        List<IntfSignalRef> ports
) {
    public Entity {
        generics = List.copyOf(generics);
        ports = List.copyOf(ports);
    }
}
