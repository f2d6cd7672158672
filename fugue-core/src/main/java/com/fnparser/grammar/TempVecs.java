package com.fnparser.grammar;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pools of scratch lists, one pool per element type, reused while a single parse collects
 * arguments, statements, fields and patterns.
 *
 * <p>A list handed out by {@link #pop(Class)} is empty. {@link #push(Class, List)} clears it and
 * makes it available again; whatever the caller wants to keep must be copied out first. Not
 * thread safe: each parse owns its own instance.</p>
 */
public final class TempVecs {

    private final Map<Class<?>, ArrayDeque<List<?>>> pools = new HashMap<>();

    @SuppressWarnings("unchecked")
    public <T> List<T> pop(Class<T> kind) {
        ArrayDeque<List<?>> pool = pools.get(kind);
        if (pool == null || pool.isEmpty()) {
            return new ArrayList<>();
        }
        return (List<T>) pool.pop();
    }

    public <T> void push(Class<T> kind, List<T> vec) {
        vec.clear();
        pools.computeIfAbsent(kind, k -> new ArrayDeque<>()).push(vec);
    }

    /**
     * Number of idle lists pooled for {@code kind}.
     */
    public int pooled(Class<?> kind) {
        ArrayDeque<List<?>> pool = pools.get(kind);
        return pool == null ? 0 : pool.size();
    }
}
