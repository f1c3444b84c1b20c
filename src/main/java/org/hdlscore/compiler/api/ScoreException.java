package org.hdlscore.compiler.api;

/**
 * Signals that a scoreboard query failed.
 * <p>
 * The reason has already been reported to the diagnostic sink at the point of detection,
 * so the exception carries no message and no stack trace. Callers only branch on it and
 * propagate it; they must not report it again.
 */
public class ScoreException extends Exception {

    /**
     * Constructs a new silent query failure.
     */
    public ScoreException() {
        super(null, null, false, false);
    }
}
