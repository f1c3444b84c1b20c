package org.hdlscore.compiler.frontend.score.arena;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * An append-only pool of values. Values are never removed or replaced, so an index handed
 * out by {@link #alloc(Object)} stays valid and keeps denoting the same value for the
 * lifetime of the arena.
 *
 * @param <T> The type of the pooled values.
 */
public final class Arena<T> {

    private final String name;
    private final ObjectArrayList<T> values = new ObjectArrayList<>();

    public Arena(String name) {
        this.name = name;
    }

    /**
     * Appends a value to the pool.
     *
     * @param value The value to store, must not be null.
     * @return The index of the value within this arena.
     */
    public int alloc(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot allocate null in arena " + name);
        }
        values.add(value);
        return values.size() - 1;
    }

    /**
     * Appends a value and returns it, for callers that only need the stored value itself.
     */
    public T store(T value) {
        alloc(value);
        return value;
    }

    /**
     * @param index An index previously returned by {@link #alloc(Object)}.
     * @return The value stored at the index.
     * @throws IllegalStateException if the index was never allocated by this arena.
     */
    public T get(int index) {
        if (index < 0 || index >= values.size()) {
            throw new IllegalStateException("Index " + index + " was never allocated in arena " + name);
        }
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public String name() {
        return name;
    }
}
