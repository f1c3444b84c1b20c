package org.hdlscore.compiler.frontend.score.id;

/**
 * A declaration that may appear in the declarative part of an architecture.
 */
public sealed interface DeclInBlockRef permits TypeDeclRef, SubtypeDeclRef, ObjectDeclRef {
}
