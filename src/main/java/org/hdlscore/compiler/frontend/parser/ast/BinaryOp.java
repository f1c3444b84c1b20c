package org.hdlscore.compiler.frontend.parser.ast;

/**
 * Binary operators.
 */
public enum BinaryOp {
    AND, OR, NAND, NOR, XOR, XNOR,
    EQ, NEQ, LT, LEQ, GT, GEQ,
    MATCH_EQ, MATCH_NEQ, MATCH_LT, MATCH_LEQ, MATCH_GT, MATCH_GEQ,
    SLL, SRL, SLA, SRA, ROL, ROR,
    ADD, SUB, CONCAT,
    MUL, DIV, MOD, REM,
    POW
}
