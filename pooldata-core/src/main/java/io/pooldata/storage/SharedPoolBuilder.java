package io.pooldata.storage;

import io.pooldata.core.PoolingConfiguration;
import io.pooldata.core.converter.ValueConverter;
import io.pooldata.core.converter.ValueConverters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds two pooled columns over one shared canonical pool.
 * <p>
 * The pool is the sorted union of both inputs' distinct non-missing values, so
 * whenever {@code left[i].equals(right[j])} the two columns hold the same
 * reference at {@code i} and {@code j}. Join and grouping code can then match keys
 * by comparing integers. Missing positions get reference 0 on both sides and add
 * nothing to the pool.
 * <p>
 * Each returned column owns its own copy of the pool: replacing a value in one
 * does not change the other.
 *
 * @param <T> the element type
 */
public final class SharedPoolBuilder<T> {
    private static final Logger LOG = LoggerFactory.getLogger(SharedPoolBuilder.class);

    private final Class<T> type;
    private final Comparator<? super T> comparator;
    private PoolingConfiguration configuration = PoolingConfiguration.defaults();
    private ValueConverter<T> converter;

    private SharedPoolBuilder(Class<T> type, Comparator<? super T> comparator) {
        this.type = Objects.requireNonNull(type, "type");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.converter = ValueConverters.forType(type);
    }

    public static <T extends Comparable<? super T>> SharedPoolBuilder<T> forType(Class<T> type) {
        return new SharedPoolBuilder<>(type, Comparator.naturalOrder());
    }

    public static <T> SharedPoolBuilder<T> forType(Class<T> type, Comparator<? super T> comparator) {
        return new SharedPoolBuilder<>(type, comparator);
    }

    public SharedPoolBuilder<T> configuration(PoolingConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        return this;
    }

    public SharedPoolBuilder<T> converter(ValueConverter<T> converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
        return this;
    }

    /**
     * Encode two value lists; {@code null} values are missing.
     */
    public PooledColumnPair<T> encode(List<? extends T> left, List<? extends T> right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        return encode(left, new boolean[left.size()], right, new boolean[right.size()]);
    }

    public PooledColumnPair<T> encode(DenseColumn<? extends T> left, DenseColumn<? extends T> right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        return encode(left.values(), left.missingMask(), right.values(), right.missingMask());
    }

    /**
     * Encode two value lists with their missingness masks.
     *
     * @throws io.pooldata.core.PoolCapacityExceededException if the union of distinct values does not
     *                                                        fit the reference width
     */
    public PooledColumnPair<T> encode(List<? extends T> left, boolean[] leftMissing,
                                      List<? extends T> right, boolean[] rightMissing) {
        checkLengths(left, leftMissing, "left");
        checkLengths(right, rightMissing, "right");

        var distinct = new HashSet<T>();
        collect(left, leftMissing, distinct);
        collect(right, rightMissing, distinct);
        var pool = Pool.<T>sorted(distinct, comparator, configuration);
        var ranks = PoolBuilder.rankOf(pool);

        var leftRefs = PoolBuilder.assignRefs(left, leftMissing, ranks, configuration);
        var rightRefs = PoolBuilder.assignRefs(right, rightMissing, ranks, configuration);
        LOG.debug("Encoded {} + {} {} values into a shared pool of {}", leftMissing.length,
                rightMissing.length, type.getSimpleName(), pool.size());
        return new PooledColumnPair<>(
                new PooledColumn<>(type, leftRefs, pool, configuration, converter),
                new PooledColumn<>(type, rightRefs, pool.copy(), configuration, converter));
    }

    private static <T> void collect(List<? extends T> values, boolean[] missing, Set<T> distinct) {
        for (var i = 0; i < missing.length; i++) {
            if (!PoolBuilder.isMissing(values, missing, i)) {
                distinct.add(values.get(i));
            }
        }
    }

    private static void checkLengths(List<?> values, boolean[] missing, String side) {
        Objects.requireNonNull(values, side);
        Objects.requireNonNull(missing, side + "Missing");
        if (values.size() != missing.length) {
            throw new IllegalArgumentException(side + " values and mask differ in length: "
                    + values.size() + " != " + missing.length);
        }
    }
}
