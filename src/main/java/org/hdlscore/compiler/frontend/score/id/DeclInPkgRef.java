package org.hdlscore.compiler.frontend.score.id;

/**
 * A declaration that may appear in a package declaration.
 */
public sealed interface DeclInPkgRef permits PkgDeclRef, PkgInstRef, TypeDeclRef, SubtypeDeclRef, ObjectDeclRef {
}
