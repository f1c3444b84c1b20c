package org.hdlscore.compiler.frontend.parser.ast;

/**
 * The kind of a signal declaration.
 */
public enum SignalKind {
    NORMAL,
    REGISTER,
    BUS
}
