package org.hdlscore.compiler.frontend.score.id;

/**
 * One object introduced by a constant, signal, variable or file declaration.
 */
public sealed interface ObjectDeclRef extends DeclInPkgRef, DeclInBlockRef
        permits ConstDeclRef, SignalDeclRef, VarDeclRef, FileDeclRef {
}
