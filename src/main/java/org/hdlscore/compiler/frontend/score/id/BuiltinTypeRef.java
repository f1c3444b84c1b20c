package org.hdlscore.compiler.frontend.score.id;

/**
 * A predefined type, such as {@code integer} or {@code bit}.
 *
 * @param name The type name.
 */
public record BuiltinTypeRef(String name) implements Def, TypeMarkRef {
}
