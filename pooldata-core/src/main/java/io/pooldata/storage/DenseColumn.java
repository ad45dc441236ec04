package io.pooldata.storage;

import io.pooldata.kernel.Column;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Plain column: one value slot and one missing flag per element.
 * <p>
 * Input of the pool builders and result of decoding a pooled column. A
 * {@code null} value is always missing; missing slots read as {@code null}.
 * Instances are immutable.
 *
 * @param <T> the element type
 */
public final class DenseColumn<T> implements Column<T> {
    private final Class<T> type;
    private final List<T> values;
    private final boolean[] missing;

    private DenseColumn(Class<T> type, List<T> values, boolean[] missing) {
        this.type = type;
        this.values = values;
        this.missing = missing;
    }

    /**
     * Column over the given values; {@code null} entries are missing.
     */
    public static <T> DenseColumn<T> of(Class<T> type, List<? extends T> values) {
        Objects.requireNonNull(values, "values");
        return of(type, values, new boolean[values.size()]);
    }

    /**
     * Column over the given values with an explicit missingness mask. Positions
     * flagged in the mask are missing whatever value they carry.
     */
    public static <T> DenseColumn<T> of(Class<T> type, List<? extends T> values, boolean[] missing) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(missing, "missing");
        if (values.size() != missing.length) {
            throw new IllegalArgumentException("values and mask differ in length: "
                    + values.size() + " != " + missing.length);
        }
        var copy = new ArrayList<T>(values.size());
        var mask = new boolean[missing.length];
        for (var i = 0; i < missing.length; i++) {
            T value = values.get(i);
            if (missing[i] || value == null) {
                mask[i] = true;
                copy.add(null);
            } else {
                copy.add(value);
            }
        }
        return new DenseColumn<>(type, copy, mask);
    }

    @SafeVarargs
    public static <T> DenseColumn<T> of(Class<T> type, T... values) {
        return of(type, Arrays.asList(values));
    }

    /**
     * Column of {@code size} missing elements.
     */
    public static <T> DenseColumn<T> missing(Class<T> type, int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative: " + size);
        }
        var mask = new boolean[size];
        Arrays.fill(mask, true);
        return new DenseColumn<>(type, new ArrayList<>(Collections.<T>nCopies(size, null)), mask);
    }

    @Override
    public Class<T> type() {
        return type;
    }

    @Override
    public int size() {
        return missing.length;
    }

    @Override
    public T get(int index) {
        return values.get(index);
    }

    @Override
    public boolean isMissing(int index) {
        return missing[index];
    }

    @Override
    public boolean[] missingMask() {
        return Arrays.copyOf(missing, missing.length);
    }

    /**
     * Values in order, {@code null} at missing positions.
     */
    public List<T> values() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DenseColumn<?> other)) {
            return false;
        }
        return type.equals(other.type)
                && Arrays.equals(missing, other.missing)
                && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, values, Arrays.hashCode(missing));
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("[");
        for (var i = 0; i < missing.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(missing[i] ? "NA" : values.get(i));
        }
        return sb.append(']').toString();
    }
}
