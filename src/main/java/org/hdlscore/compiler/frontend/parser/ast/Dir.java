package org.hdlscore.compiler.frontend.parser.ast;

/**
 * The direction of a range.
 */
public enum Dir {
    TO,
    DOWNTO
}
