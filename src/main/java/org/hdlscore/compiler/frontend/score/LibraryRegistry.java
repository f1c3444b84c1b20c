package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.frontend.score.id.LibRef;
import org.hdlscore.compiler.model.ResolvableName;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps library names to libraries. Filled while the session is set up, read-only afterwards.
 */
public final class LibraryRegistry {

    private final Map<ResolvableName, LibRef> libraries = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a library of that name is already registered.
     */
    public void register(ResolvableName name, LibRef lib) {
        if (libraries.putIfAbsent(name, lib) != null) {
            throw new IllegalArgumentException("Library " + name + " is already registered");
        }
    }

    public Optional<LibRef> lookup(ResolvableName name) {
        return Optional.ofNullable(libraries.get(name));
    }
}
