package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.api.ScoreException;

/**
 * Computes one artifact for a key. Implementations report problems to the diagnostic sink
 * before failing.
 *
 * @param <K> The key type.
 * @param <V> The artifact type.
 */
@FunctionalInterface
public interface IQuery<K, V> {
    V compute(K key) throws ScoreException;
}
