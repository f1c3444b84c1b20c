package org.hdlscore.compiler.frontend.score.id;

/**
 * A package whose definitions are predefined rather than declared in source.
 *
 * @param name The package name.
 */
public record BuiltinPkgRef(String name) implements ScopeRef, Def {

    /** The {@code standard} package made visible in every design unit. */
    public static final BuiltinPkgRef STANDARD = new BuiltinPkgRef("standard");
}
