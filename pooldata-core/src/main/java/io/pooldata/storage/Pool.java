package io.pooldata.storage;

import io.pooldata.core.PoolingConfiguration;
import io.pooldata.core.RefWidth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, duplicate-free, append-only value pool.
 * Values are stored once and addressed by 1-based references; reference 0 is
 * reserved for missing and never resolves to a value.
 * <p>
 * With indexed lookup enabled, a value to reference map is kept in step with the
 * buffer. Without it, lookups scan the buffer and return the first match. Both
 * answer identically because the pool never holds duplicates.
 */
final class Pool<T> {
    private final RefWidth width;
    private final ArrayList<T> values;
    private final Map<T, Integer> valueToRef;

    private Pool(RefWidth width, ArrayList<T> values, boolean indexedLookup) {
        this.width = width;
        this.values = values;
        if (indexedLookup) {
            this.valueToRef = new HashMap<>(Math.max(16, values.size() * 2));
            for (var i = 0; i < values.size(); i++) {
                valueToRef.put(values.get(i), i + 1);
            }
        } else {
            this.valueToRef = null;
        }
    }

    /**
     * Pool holding the given distinct values in ascending order.
     */
    static <T> Pool<T> sorted(Collection<? extends T> distinct, Comparator<? super T> comparator,
                              PoolingConfiguration config) {
        config.refWidth().checkCapacity(distinct.size());
        var values = new ArrayList<T>(Math.max(config.initialPoolCapacity(), distinct.size()));
        values.addAll(distinct);
        values.sort(comparator);
        return new Pool<>(config.refWidth(), values, config.indexedLookup());
    }

    /**
     * Pool holding the given values in the given order.
     *
     * @throws IllegalArgumentException if a value is null or repeated
     */
    static <T> Pool<T> ordered(List<? extends T> ordered, PoolingConfiguration config) {
        config.refWidth().checkCapacity(ordered.size());
        var values = new ArrayList<T>(Math.max(config.initialPoolCapacity(), ordered.size()));
        var seen = new HashMap<T, Boolean>();
        for (T value : ordered) {
            if (value == null) {
                throw new IllegalArgumentException("pool values must not be null");
            }
            if (seen.put(value, Boolean.TRUE) != null) {
                throw new IllegalArgumentException("pool contains duplicate value: " + value);
            }
            values.add(value);
        }
        return new Pool<>(config.refWidth(), values, config.indexedLookup());
    }

    int size() {
        return values.size();
    }

    /**
     * Value at a 1-based reference.
     */
    T get(int ref) {
        if (ref < 1 || ref > values.size()) {
            throw new IndexOutOfBoundsException("Invalid pool reference: " + ref);
        }
        return values.get(ref - 1);
    }

    /**
     * 1-based reference of a value, or 0 when the pool does not hold it.
     */
    int indexOf(T value) {
        if (valueToRef != null) {
            var ref = valueToRef.get(value);
            return ref == null ? 0 : ref;
        }
        for (var i = 0; i < values.size(); i++) {
            if (values.get(i).equals(value)) {
                return i + 1;
            }
        }
        return 0;
    }

    /**
     * Append a value the pool does not hold yet.
     *
     * @return the new value's reference
     */
    int append(T value) {
        width.checkCapacity(values.size() + 1L);
        values.add(value);
        var ref = values.size();
        if (valueToRef != null) {
            valueToRef.put(value, ref);
        }
        return ref;
    }

    /**
     * Replace the value stored at a reference with one the pool does not hold yet.
     */
    void overwrite(int ref, T value) {
        var previous = get(ref);
        values.set(ref - 1, value);
        if (valueToRef != null) {
            valueToRef.remove(previous);
            valueToRef.put(value, ref);
        }
    }

    Pool<T> copy() {
        return new Pool<>(width, new ArrayList<>(values), valueToRef != null);
    }

    List<T> asList() {
        return Collections.unmodifiableList(values);
    }
}
