package org.hdlscore.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while the scoreboard resolves a design.
 * <p>
 * This decouples error reporting from the resolution logic: resolvers only construct
 * diagnostics and hand them over; formatting and printing is up to the caller.
 */
public class DiagnosticsEngine implements DiagnosticSink {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void emit(Diagnostic diagnostic) {
        LOG.debug("Diagnostic emitted: {}", diagnostic);
        diagnostics.add(diagnostic);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Counts the diagnostics of the given type.
     */
    public long count(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
