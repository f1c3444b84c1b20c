package org.hdlscore.compiler.frontend.parser.ast;

/**
 * The mode of an interface signal.
 */
public enum IntfMode {
    IN,
    OUT,
    INOUT,
    BUFFER,
    LINKAGE
}
