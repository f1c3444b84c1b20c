package org.hdlscore.compiler.frontend.score.id;

/**
 * A typed handle addressing a node of the design. References carry no ownership: they are
 * plain values that can be copied, compared and hashed freely, and they are the only way
 * one node refers to another.
 * <p>
 * The numeric id is allocated from one session-wide counter, so two references of
 * different kinds never share an id.
 */
public sealed interface NodeRef permits LibRef, EntityRef, ArchRef, PkgDeclRef, PkgInstRef, PkgBodyRef, CfgRef,
        CtxRef, CtxItemsRef, IntfSignalRef, IntfConstRef, SubtypeIndRef, TypeDeclRef, SubtypeDeclRef, ConstDeclRef,
        SignalDeclRef, VarDeclRef, FileDeclRef, ExprRef, ConcStmtRef {

    /**
     * @return The session-unique id of the node.
     */
    int id();

    /**
     * @return The kind tag of the node.
     */
    NodeKind kind();
}
