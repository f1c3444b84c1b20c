package org.hdlscore.compiler.frontend.score.id;

/**
 * A construct that introduces a scope and owns a definitions table.
 */
public sealed interface ScopeRef permits LibRef, CtxItemsRef, EntityRef, ArchRef, PkgDeclRef, PkgInstRef, BuiltinPkgRef {
}
