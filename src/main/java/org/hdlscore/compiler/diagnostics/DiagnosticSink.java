package org.hdlscore.compiler.diagnostics;

/**
 * Receives diagnostics as they are detected. Emission is fire-and-forget: a sink
 * must neither block nor throw.
 */
@FunctionalInterface
public interface DiagnosticSink {

    /**
     * Accepts a diagnostic.
     * @param diagnostic The diagnostic to record.
     */
    void emit(Diagnostic diagnostic);

    /**
     * Convenience overload that builds the diagnostic first.
     * @param builder The builder holding the diagnostic.
     */
    default void emit(Diagnostic.Builder builder) {
        emit(builder.build());
    }
}
