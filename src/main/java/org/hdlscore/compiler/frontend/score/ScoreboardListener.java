package org.hdlscore.compiler.frontend.score;

/**
 * Observes the scoreboard. Only actual computations are reported, cache hits are not.
 */
@FunctionalInterface
public interface ScoreboardListener {

    ScoreboardListener NONE = (query, key) -> { };

    /**
     * Called right before a query is computed for a key.
     *
     * @param query The name of the query, e.g. {@code hir} or {@code scope}.
     * @param key   The key the query runs for.
     */
    void onCompute(String query, Object key);
}
