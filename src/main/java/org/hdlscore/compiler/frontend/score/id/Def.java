package org.hdlscore.compiler.frontend.score.id;

/**
 * Anything a name can denote.
 */
public sealed interface Def permits LibRef, EntityRef, CfgRef, PkgDeclRef, PkgInstRef, CtxRef, TypeDeclRef,
        SubtypeDeclRef, EnumRef, ConstDeclRef, SignalDeclRef, VarDeclRef, FileDeclRef, BuiltinPkgRef, BuiltinTypeRef,
        BuiltinEnumRef {

    /**
     * Whether several definitions of this kind may share one name in the same table.
     */
    default boolean isOverloadable() {
        return false;
    }
}
