package org.hdlscore.compiler.frontend.parser.ast;

import org.hdlscore.compiler.model.Span;

import java.util.List;

/**
 * {@code entity <name> is generic (...); port (...); end;}
 */
public record EntityDecl(Span span, AstIdent name, List<GenericDecl> generics, List<PortDecl> ports) implements DesignUnit {
    public EntityDecl {
        generics = List.copyOf(generics);
        ports = List.copyOf(ports);
    }
}
