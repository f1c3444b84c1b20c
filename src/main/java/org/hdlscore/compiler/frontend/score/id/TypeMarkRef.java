package org.hdlscore.compiler.frontend.score.id;

/**
 * What a type mark may denote.
 */
public sealed interface TypeMarkRef permits TypeDeclRef, SubtypeDeclRef, BuiltinTypeRef {
}
