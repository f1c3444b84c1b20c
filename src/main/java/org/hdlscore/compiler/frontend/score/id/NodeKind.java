package org.hdlscore.compiler.frontend.score.id;

/**
 * The kind tag of a {@link NodeRef}. Each kind has its own HIR arena, if it has HIR at all.
 */
public enum NodeKind {
    LIB,
    ENTITY,
    ARCH,
    PKG_DECL,
    PKG_INST,
    PKG_BODY,
    CFG,
    CTX,
    CTX_ITEMS,
    INTF_SIGNAL,
    INTF_CONST,
    SUBTYPE_IND,
    TYPE_DECL,
    SUBTYPE_DECL,
    CONST_DECL,
    SIGNAL_DECL,
    VAR_DECL,
    FILE_DECL,
    EXPR,
    CONC_STMT
}
