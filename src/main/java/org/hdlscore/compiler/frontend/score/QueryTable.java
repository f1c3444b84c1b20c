package org.hdlscore.compiler.frontend.score;

import org.hdlscore.compiler.api.ScoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The memo table of one query. Each key is computed at most once: later requests get the
 * cached artifact, or the cached failure rethrown as the very same exception instance, so
 * diagnostics of a failed computation are never emitted twice.
 * <p>
 * A key whose computation is still running when it is requested again depends on itself.
 * Instead of recursing, the table hands the key to its {@link CycleReporter} and fails.
 *
 * @param <K> The key type.
 * @param <V> The artifact type.
 */
public final class QueryTable<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(QueryTable.class);

    /**
     * Reports a key that was requested while its own computation was in progress.
     */
    @FunctionalInterface
    public interface CycleReporter<K> {
        void report(String query, K key);
    }

    private final String name;
    private final ScoreboardListener listener;
    private final CycleReporter<? super K> cycleReporter;
    private final Map<K, V> results = new HashMap<>();
    private final Map<K, ScoreException> failures = new HashMap<>();
    private final Set<K> inProgress = new HashSet<>();
    private int computations;

    public QueryTable(String name, ScoreboardListener listener, CycleReporter<? super K> cycleReporter) {
        this.name = name;
        this.listener = listener;
        this.cycleReporter = cycleReporter;
    }

    /**
     * Returns the artifact for the key, computing it on first request.
     *
     * @throws ScoreException if the computation failed, now or on an earlier request, or if the
     *                        key depends on itself.
     */
    public V get(K key, IQuery<? super K, ? extends V> query) throws ScoreException {
        V cached = results.get(key);
        if (cached != null) {
            return cached;
        }
        ScoreException failure = failures.get(key);
        if (failure != null) {
            throw failure;
        }
        if (!inProgress.add(key)) {
            LOG.debug("Cycle detected: {} of {} requested while in progress", name, key);
            cycleReporter.report(name, key);
            throw new ScoreException();
        }
        computations++;
        listener.onCompute(name, key);
        LOG.debug("Computing {} of {}", name, key);
        try {
            V value = query.compute(key);
            if (value == null) {
                throw new IllegalStateException("Query " + name + " produced no result for " + key);
            }
            results.put(key, value);
            return value;
        } catch (ScoreException e) {
            LOG.debug("Query {} of {} failed", name, key);
            failures.put(key, e);
            throw e;
        } finally {
            inProgress.remove(key);
        }
    }

    /**
     * Stores an artifact that was produced outside this table, e.g. by the computation of
     * another artifact.
     *
     * @throws IllegalStateException if the key already has a result.
     */
    public void insert(K key, V value) {
        if (results.containsKey(key) || failures.containsKey(key)) {
            throw new IllegalStateException("Query " + name + " already has a result for " + key);
        }
        results.put(key, value);
    }

    public boolean contains(K key) {
        return results.containsKey(key) || failures.containsKey(key);
    }

    /**
     * @return How many computations this table has started.
     */
    public int computations() {
        return computations;
    }

    public String name() {
        return name;
    }
}
