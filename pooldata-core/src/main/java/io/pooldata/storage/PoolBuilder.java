package io.pooldata.storage;

import io.pooldata.core.PoolingConfiguration;
import io.pooldata.core.ValueNotInPoolException;
import io.pooldata.core.converter.ValueConverter;
import io.pooldata.core.converter.ValueConverters;
import io.pooldata.kernel.Missing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds pooled columns from raw values and a missingness mask.
 * <p>
 * The pool is the set of distinct non-missing values sorted ascending, so the
 * reference of a value is its rank in that order, independent of where it first
 * appears. Missing positions get reference 0.
 * <pre>
 * PooledColumn&lt;String&gt; column = PoolBuilder.forType(String.class)
 *     .configuration(PoolingConfiguration.builder().refWidth(RefWidth.UINT8).build())
 *     .encode(List.of("b", "a", "b"));
 * // pool [a, b], references [2, 1, 2]
 * </pre>
 *
 * @param <T> the element type
 */
public final class PoolBuilder<T> {
    private static final Logger LOG = LoggerFactory.getLogger(PoolBuilder.class);

    private final Class<T> type;
    private final Comparator<? super T> comparator;
    private PoolingConfiguration configuration = PoolingConfiguration.defaults();
    private ValueConverter<T> converter;

    private PoolBuilder(Class<T> type, Comparator<? super T> comparator) {
        this.type = Objects.requireNonNull(type, "type");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.converter = ValueConverters.forType(type);
    }

    /**
     * Builder ordering pools by the natural order of {@code T}.
     */
    public static <T extends Comparable<? super T>> PoolBuilder<T> forType(Class<T> type) {
        return new PoolBuilder<>(type, Comparator.naturalOrder());
    }

    /**
     * Builder ordering pools by the given comparator.
     */
    public static <T> PoolBuilder<T> forType(Class<T> type, Comparator<? super T> comparator) {
        return new PoolBuilder<>(type, comparator);
    }

    public PoolBuilder<T> configuration(PoolingConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        return this;
    }

    /**
     * Converter used by the built columns for single-element writes and replacements.
     */
    public PoolBuilder<T> converter(ValueConverter<T> converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
        return this;
    }

    /**
     * Encode values with no positions flagged missing; {@code null} values are
     * still missing.
     */
    public PooledColumn<T> encode(List<? extends T> values) {
        Objects.requireNonNull(values, "values");
        return encode(values, new boolean[values.size()]);
    }

    public PooledColumn<T> encode(DenseColumn<? extends T> column) {
        Objects.requireNonNull(column, "column");
        return encode(column.values(), column.missingMask());
    }

    /**
     * Encode values, inferring the pool from the distinct non-missing values.
     *
     * @throws io.pooldata.core.PoolCapacityExceededException if there are more distinct values than
     *                                                        the reference width can address
     */
    public PooledColumn<T> encode(List<? extends T> values, boolean[] missing) {
        checkLengths(values, missing);
        var distinct = new HashSet<T>();
        for (var i = 0; i < missing.length; i++) {
            if (!isMissing(values, missing, i)) {
                distinct.add(values.get(i));
            }
        }
        var pool = Pool.<T>sorted(distinct, comparator, configuration);
        var refs = assignRefs(values, missing, rankOf(pool), configuration);
        LOG.debug("Encoded {} {} values into a pool of {}", missing.length, type.getSimpleName(), pool.size());
        return new PooledColumn<>(type, refs, pool, configuration, converter);
    }

    public PooledColumn<T> encodeWithPool(List<? extends T> values, Collection<? extends T> pool) {
        Objects.requireNonNull(values, "values");
        return encodeWithPool(values, pool, new boolean[values.size()]);
    }

    /**
     * Encode values against a fixed, caller-supplied pool. The pool is
     * deduplicated and sorted before references are assigned.
     *
     * @throws io.pooldata.core.PoolCapacityExceededException if the supplied pool is longer than the
     *                                                        reference width can address
     * @throws ValueNotInPoolException if a non-missing value is not in the pool
     */
    public PooledColumn<T> encodeWithPool(List<? extends T> values, Collection<? extends T> pool,
                                          boolean[] missing) {
        checkLengths(values, missing);
        Objects.requireNonNull(pool, "pool");
        configuration.refWidth().checkCapacity(pool.size());
        var distinct = new LinkedHashSet<T>();
        for (T value : pool) {
            if (value == null) {
                throw new IllegalArgumentException("pool values must not be null");
            }
            distinct.add(value);
        }
        var sorted = Pool.<T>sorted(distinct, comparator, configuration);
        var ranks = rankOf(sorted);
        for (var i = 0; i < missing.length; i++) {
            if (!isMissing(values, missing, i) && !ranks.containsKey(values.get(i))) {
                throw new ValueNotInPoolException(values.get(i));
            }
        }
        var refs = assignRefs(values, missing, ranks, configuration);
        LOG.debug("Encoded {} {} values against a fixed pool of {}", missing.length, type.getSimpleName(),
                sorted.size());
        return new PooledColumn<>(type, refs, sorted, configuration, converter);
    }

    /**
     * Column of {@code size} missing elements with an empty pool.
     */
    public PooledColumn<T> allMissing(int size) {
        var pool = Pool.<T>sorted(Set.of(), comparator, configuration);
        return new PooledColumn<>(type, RefArray.allocate(configuration.refWidth(), size), pool,
                configuration, converter);
    }

    /**
     * Column of {@code size} copies of one value over a single-slot pool.
     *
     * @throws IllegalArgumentException if the value is missing or cannot be converted to {@code T}
     */
    public PooledColumn<T> filled(Object value, int size) {
        if (Missing.isMissing(value)) {
            throw new IllegalArgumentException("fill value required, use allMissing for missing columns");
        }
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative: " + size);
        }
        var pool = Pool.<T>ordered(List.of(converter.convert(value)), configuration);
        var refs = RefArray.allocate(configuration.refWidth(), size);
        for (var i = 0; i < size; i++) {
            refs.set(i, 1);
        }
        return new PooledColumn<>(type, refs, pool, configuration, converter);
    }

    /**
     * Column of zeros; the element type must accept an {@code Integer} 0.
     */
    public PooledColumn<T> zeros(int size) {
        return filled(0, size);
    }

    public PooledColumn<T> ones(int size) {
        return filled(1, size);
    }

    public static PooledColumn<Boolean> trues(int size) {
        return forType(Boolean.class).filled(Boolean.TRUE, size);
    }

    public static PooledColumn<Boolean> falses(int size) {
        return forType(Boolean.class).filled(Boolean.FALSE, size);
    }

    static boolean isMissing(List<?> values, boolean[] missing, int index) {
        return missing[index] || values.get(index) == null;
    }

    static <T> Map<T, Integer> rankOf(Pool<T> pool) {
        var ranks = new HashMap<T, Integer>(Math.max(16, pool.size() * 2));
        for (var ref = 1; ref <= pool.size(); ref++) {
            ranks.put(pool.get(ref), ref);
        }
        return ranks;
    }

    static RefArray assignRefs(List<?> values, boolean[] missing, Map<?, Integer> ranks,
                               PoolingConfiguration configuration) {
        var refs = RefArray.allocate(configuration.refWidth(), missing.length);
        for (var i = 0; i < missing.length; i++) {
            if (!isMissing(values, missing, i)) {
                refs.set(i, ranks.get(values.get(i)));
            }
        }
        return refs;
    }

    private static void checkLengths(List<?> values, boolean[] missing) {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(missing, "missing");
        if (values.size() != missing.length) {
            throw new IllegalArgumentException("values and mask differ in length: "
                    + values.size() + " != " + missing.length);
        }
    }
}
