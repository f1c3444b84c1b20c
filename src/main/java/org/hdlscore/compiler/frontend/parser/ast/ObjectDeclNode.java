package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * A constant, signal, variable or file declaration. One declaration may introduce several names.
 *
 * @param span       The location of the declaration.
 * @param kind       Which object class is declared.
 * @param names      The declared names.
 * @param subtype    The subtype indication shared by all names.
 * @param init       The initial value, or {@code null}.
 * @param signalKind For signals: the signal kind; {@code null} otherwise.
 * @param shared     For variables: whether declared {@code shared}.
 * @param fileOpen   For files: the open information, or {@code null}.
 */
public record ObjectDeclNode(
        Span span,
        ObjectKind kind,
        List<AstIdent> names,
        SubtypeIndNode subtype,
        ExprNode init,
        SignalKind signalKind,
        boolean shared,
        FileOpenNode fileOpen
) implements DeclItem {

    /** The object class of a declaration. */
    public enum ObjectKind {
        CONSTANT,
        SIGNAL,
        VARIABLE,
        FILE
    }

    /**
     * {@code open <kind> is <name>}
     *
     * @param name The expression giving the file name.
     * @param kind The open kind expression, or {@code null}.
     */
    public record FileOpenNode(ExprNode name, ExprNode kind) {}

    public ObjectDeclNode {
        names = List.copyOf(names);
    }

    public static ObjectDeclNode constant(Span span, List<AstIdent> names, SubtypeIndNode subtype, ExprNode init) {
        return new ObjectDeclNode(span, ObjectKind.CONSTANT, names, subtype, init, null, false, null);
    }

    public static ObjectDeclNode signal(Span span, List<AstIdent> names, SubtypeIndNode subtype, SignalKind kind, ExprNode init) {
        return new ObjectDeclNode(span, ObjectKind.SIGNAL, names, subtype, init, kind, false, null);
    }

    public static ObjectDeclNode variable(Span span, boolean shared, List<AstIdent> names, SubtypeIndNode subtype, ExprNode init) {
        return new ObjectDeclNode(span, ObjectKind.VARIABLE, names, subtype, init, null, shared, null);
    }

    public static ObjectDeclNode file(Span span, List<AstIdent> names, SubtypeIndNode subtype, FileOpenNode open) {
        return new ObjectDeclNode(span, ObjectKind.FILE, names, subtype, null, null, false, open);
    }
}
