package io.pooldata.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Distinct-value views of a pooled column.
 * <p>
 * Levels are read straight from the pool, so slots orphaned by a replacement are
 * still reported.
 */
public final class Levels {

    private Levels() {
    }

    /**
     * The pool as a dense column, followed by one missing entry when any element
     * is missing.
     */
    public static <T> DenseColumn<T> unique(PooledColumn<T> column) {
        var pool = column.pool();
        var values = new ArrayList<T>(pool.size() + 1);
        values.addAll(pool);
        var anyMissing = column.hasMissing();
        var mask = new boolean[pool.size() + (anyMissing ? 1 : 0)];
        if (anyMissing) {
            values.add(null);
            mask[pool.size()] = true;
        }
        return DenseColumn.of(column.type(), values, mask);
    }

    /**
     * Same as {@link #unique(PooledColumn)}.
     */
    public static <T> DenseColumn<T> levels(PooledColumn<T> column) {
        return unique(column);
    }

    /**
     * Reference to value for every pool slot, in reference order.
     */
    public static <T> Map<Integer, T> indexToLevel(PooledColumn<T> column) {
        var pool = column.pool();
        var result = new LinkedHashMap<Integer, T>();
        for (var i = 0; i < pool.size(); i++) {
            result.put(i + 1, pool.get(i));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Value to reference for every pool slot, in reference order.
     */
    public static <T> Map<T, Integer> levelToIndex(PooledColumn<T> column) {
        var pool = column.pool();
        var result = new LinkedHashMap<T, Integer>();
        for (var i = 0; i < pool.size(); i++) {
            result.put(pool.get(i), i + 1);
        }
        return Collections.unmodifiableMap(result);
    }
}
