package org.hdlscore.compiler.frontend.parser.ast;

/**
 * Unary operators, including the VHDL-2008 unary reduction operators.
 */
public enum UnaryOp {
    NOT,
    ABS,
    POS,
    NEG,
    AND,
    OR,
    NAND,
    NOR,
    XOR,
    XNOR
}
