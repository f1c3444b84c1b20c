package org.hdlscore.compiler.frontend.semantics;

import org.hdlscore.compiler.frontend.score.id.BuiltinEnumRef;
import org.hdlscore.compiler.frontend.score.id.BuiltinPkgRef;
import org.hdlscore.compiler.frontend.score.id.BuiltinTypeRef;
import org.hdlscore.compiler.frontend.score.id.Def;
import org.hdlscore.compiler.model.ResolvableName;
import org.hdlscore.compiler.model.Span;
import org.hdlscore.compiler.model.Spanned;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The predefined packages. Their tables are fixed and shared by all sessions.
 */
public final class BuiltinPackages {

    public static final BuiltinTypeRef BOOLEAN = new BuiltinTypeRef("boolean");
    public static final BuiltinTypeRef BIT = new BuiltinTypeRef("bit");
    public static final BuiltinTypeRef SEVERITY_LEVEL = new BuiltinTypeRef("severity_level");
    public static final BuiltinTypeRef INTEGER = new BuiltinTypeRef("integer");
    public static final BuiltinTypeRef NATURAL = new BuiltinTypeRef("natural");
    public static final BuiltinTypeRef POSITIVE = new BuiltinTypeRef("positive");
    public static final BuiltinTypeRef REAL = new BuiltinTypeRef("real");
    public static final BuiltinTypeRef TIME = new BuiltinTypeRef("time");
    public static final BuiltinTypeRef STRING = new BuiltinTypeRef("string");
    public static final BuiltinTypeRef BIT_VECTOR = new BuiltinTypeRef("bit_vector");

    private static final Defs STANDARD_DEFS = buildStandard();
    private static final Scope STANDARD_SCOPE = Scope.of(Optional.empty(), BuiltinPkgRef.STANDARD);

    private BuiltinPackages() {
    }

    /**
     * @throws IllegalStateException if the package is not a known builtin package.
     */
    public static Defs definitions(BuiltinPkgRef pkg) {
        if (!BuiltinPkgRef.STANDARD.equals(pkg)) {
            throw new IllegalStateException("Unknown builtin package: " + pkg.name());
        }
        return STANDARD_DEFS;
    }

    /**
     * @throws IllegalStateException if the package is not a known builtin package.
     */
    public static Scope scope(BuiltinPkgRef pkg) {
        if (!BuiltinPkgRef.STANDARD.equals(pkg)) {
            throw new IllegalStateException("Unknown builtin package: " + pkg.name());
        }
        return STANDARD_SCOPE;
    }

    private static Defs buildStandard() {
        Map<ResolvableName, List<Spanned<Def>>> defs = new LinkedHashMap<>();
        declareEnum(defs, BOOLEAN, ResolvableName.ident("false"), ResolvableName.ident("true"));
        declareEnum(defs, BIT, ResolvableName.bit('0'), ResolvableName.bit('1'));
        declareEnum(defs, SEVERITY_LEVEL, ResolvableName.ident("note"), ResolvableName.ident("warning"),
                ResolvableName.ident("error"), ResolvableName.ident("failure"));
        for (BuiltinTypeRef type : List.of(INTEGER, NATURAL, POSITIVE, REAL, TIME, STRING, BIT_VECTOR)) {
            declare(defs, ResolvableName.ident(type.name()), type);
        }
        return new Defs(defs);
    }

    private static void declareEnum(Map<ResolvableName, List<Spanned<Def>>> defs, BuiltinTypeRef type,
                                    ResolvableName... literals) {
        declare(defs, ResolvableName.ident(type.name()), type);
        for (int i = 0; i < literals.length; i++) {
            declare(defs, literals[i], new BuiltinEnumRef(type, i));
        }
    }

    private static void declare(Map<ResolvableName, List<Spanned<Def>>> defs, ResolvableName name, Def def) {
        defs.computeIfAbsent(name, n -> new ArrayList<>()).add(new Spanned<>(def, Span.BUILTIN));
    }
}
