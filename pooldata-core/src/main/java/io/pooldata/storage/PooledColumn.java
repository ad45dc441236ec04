package io.pooldata.storage;

import io.pooldata.core.PoolingConfiguration;
import io.pooldata.core.RefWidth;
import io.pooldata.core.ReferenceOutOfRangeException;
import io.pooldata.core.UnsupportedElementKindException;
import io.pooldata.core.converter.ValueConverter;
import io.pooldata.core.converter.ValueConverters;
import io.pooldata.kernel.Column;
import io.pooldata.kernel.Missing;
import io.pooldata.kernel.References;
import io.pooldata.kernel.SortIndexer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dictionary-encoded column: a reference array into an ordered value pool.
 * <p>
 * Each element is an unsigned reference; {@code 0} means missing and {@code r > 0}
 * means pool slot {@code r}. Every construction path checks that the pool fits the
 * reference width and that no reference points past the end of the pool.
 * <p>
 * <b>Ownership:</b> a column exclusively owns its references and its pool. Copies,
 * selections and the two halves of a {@link SharedPoolBuilder} result each hold
 * their own pool, so mutating one never affects another.
 * <p>
 * <b>Thread-safety:</b> none. A column is a single-owner structure; concurrent
 * mutation needs external synchronization.
 *
 * @param <T> the element type
 */
public final class PooledColumn<T> implements Column<T> {

    private final Class<T> type;
    private final RefArray refs;
    private final Pool<T> pool;
    private final PoolingConfiguration configuration;
    private final ValueConverter<T> converter;

    PooledColumn(Class<T> type, RefArray refs, Pool<T> pool,
                 PoolingConfiguration configuration, ValueConverter<T> converter) {
        this.type = Objects.requireNonNull(type, "type");
        this.refs = Objects.requireNonNull(refs, "refs");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.converter = Objects.requireNonNull(converter, "converter");
        configuration.refWidth().checkCapacity(pool.size());
        var max = refs.max();
        if (max > pool.size()) {
            throw new ReferenceOutOfRangeException(max, pool.size());
        }
    }

    /**
     * Column over raw references and a pool, with default configuration.
     *
     * @see #of(Class, int[], List, PoolingConfiguration)
     */
    public static <T> PooledColumn<T> of(Class<T> type, int[] refs, List<? extends T> pool) {
        return of(type, refs, pool, PoolingConfiguration.defaults());
    }

    /**
     * Column over raw references and a pool. The pool is used in the given order.
     *
     * @throws io.pooldata.core.PoolCapacityExceededException if the pool does not fit the reference width
     * @throws ReferenceOutOfRangeException if a reference is negative or past the end of the pool
     * @throws IllegalArgumentException if the pool contains null or duplicate values
     */
    public static <T> PooledColumn<T> of(Class<T> type, int[] refs, List<? extends T> pool,
                                         PoolingConfiguration configuration) {
        Objects.requireNonNull(refs, "refs");
        Objects.requireNonNull(pool, "pool");
        var values = Pool.<T>ordered(pool, configuration);
        for (int ref : refs) {
            if (ref < 0 || ref > values.size()) {
                throw new ReferenceOutOfRangeException(ref, values.size());
            }
        }
        return new PooledColumn<>(type, RefArray.fromInts(configuration.refWidth(), refs), values,
                configuration, ValueConverters.forType(type));
    }

    @Override
    public Class<T> type() {
        return type;
    }

    @Override
    public int size() {
        return refs.size();
    }

    public PoolingConfiguration configuration() {
        return configuration;
    }

    public RefWidth width() {
        return refs.width();
    }

    /**
     * Read-only view of the references, for join and grouping code that compares
     * integers instead of decoded values.
     */
    public References references() {
        return refs.view();
    }

    /**
     * Unmodifiable view of the pool in reference order; element {@code k} has
     * reference {@code k + 1}.
     */
    public List<T> pool() {
        return pool.asList();
    }

    public int poolSize() {
        return pool.size();
    }

    /**
     * Decoded value at a position, or {@code null} when missing.
     */
    @Override
    public T get(int index) {
        var ref = refs.get(index);
        return ref == 0 ? null : pool.get(ref);
    }

    @Override
    public boolean isMissing(int index) {
        return refs.get(index) == 0;
    }

    @Override
    public boolean hasMissing() {
        return refs.count(0) > 0;
    }

    /**
     * Decode every element into a new dense column.
     */
    public DenseColumn<T> decodeAll() {
        var n = refs.size();
        var values = new ArrayList<T>(n);
        var missing = new boolean[n];
        for (var i = 0; i < n; i++) {
            var ref = refs.get(i);
            if (ref == 0) {
                missing[i] = true;
                values.add(null);
            } else {
                values.add(pool.get(ref));
            }
        }
        return DenseColumn.of(type, values, missing);
    }

    // Multi-index reads

    /**
     * Elements whose mask entry is true, over a copy of the whole pool.
     */
    public PooledColumn<T> select(boolean[] mask) {
        checkMaskLength(mask);
        return select(positionsOf(mask));
    }

    /**
     * Elements at the given 0-based positions, in the given order, over a copy of
     * the whole pool. Positions may repeat.
     */
    public PooledColumn<T> select(int[] indices) {
        Objects.requireNonNull(indices, "indices");
        for (int index : indices) {
            Objects.checkIndex(index, refs.size());
        }
        return new PooledColumn<>(type, refs.select(indices), pool.copy(), configuration, converter);
    }

    /**
     * Elements whose mask entry is true; missing mask entries count as false.
     */
    public PooledColumn<T> select(Column<Boolean> mask) {
        Objects.requireNonNull(mask, "mask");
        if (mask.size() != refs.size()) {
            throw new IllegalArgumentException("mask length " + mask.size() + " != column length " + refs.size());
        }
        return select(whereTrue(mask));
    }

    /**
     * 0-based positions holding {@code true}, in ascending order. Missing entries
     * are skipped.
     */
    public static int[] whereTrue(Column<Boolean> mask) {
        Objects.requireNonNull(mask, "mask");
        var selected = new boolean[mask.size()];
        for (var i = 0; i < selected.length; i++) {
            selected[i] = !mask.isMissing(i) && Boolean.TRUE.equals(mask.get(i));
        }
        return positionsOf(selected);
    }

    /**
     * Elements at the given 0-based positions; missing positions are dropped first.
     */
    public PooledColumn<T> selectIndices(Column<? extends Number> indices) {
        Objects.requireNonNull(indices, "indices");
        var positions = new int[indices.size()];
        var count = 0;
        for (var i = 0; i < indices.size(); i++) {
            if (indices.isMissing(i)) {
                continue;
            }
            positions[count++] = toPosition(indices.get(i));
        }
        return select(Arrays.copyOf(positions, count));
    }

    // Writes

    /**
     * Assign a value at a position.
     * <p>
     * {@code null} or {@link Missing#VALUE} makes the element missing. Any other
     * value is converted to {@code T}; if the pool holds it the element is
     * repointed, otherwise the value is appended to the pool first.
     *
     * @return the stored value, or {@code null} for missing
     * @throws io.pooldata.core.PoolCapacityExceededException if appending would overflow the reference width
     * @throws IllegalArgumentException if the value cannot be converted to {@code T}
     */
    public T set(int index, Object value) {
        Objects.checkIndex(index, refs.size());
        if (Missing.isMissing(value)) {
            refs.set(index, 0);
            return null;
        }
        T converted = converter.convert(value);
        var ref = pool.indexOf(converted);
        if (ref == 0) {
            ref = pool.append(converted);
        }
        refs.set(index, ref);
        return converted;
    }

    public void setMissing(int index) {
        Objects.checkIndex(index, refs.size());
        refs.set(index, 0);
    }

    /**
     * Make every element whose mask entry is true missing. The pool is unchanged.
     */
    public void setMissing(boolean[] mask) {
        checkElementKind("setMissing(mask)");
        checkMaskLength(mask);
        for (var i = 0; i < mask.length; i++) {
            if (mask[i]) {
                refs.set(i, 0);
            }
        }
    }

    /**
     * Make the elements at the given positions missing. The pool is unchanged.
     */
    public void setMissing(int[] indices) {
        checkElementKind("setMissing(indices)");
        Objects.requireNonNull(indices, "indices");
        for (int index : indices) {
            Objects.checkIndex(index, refs.size());
        }
        for (int index : indices) {
            refs.set(index, 0);
        }
    }

    /**
     * Substitute one value for another throughout the column.
     *
     * @see PoolReplacer
     */
    public T replace(Object from, Object to) {
        return PoolReplacer.replace(this, from, to);
    }

    // Derived columns and views

    /**
     * Deep copy of references and pool.
     */
    public PooledColumn<T> copy() {
        return new PooledColumn<>(type, refs.copy(), pool.copy(), configuration, converter);
    }

    /**
     * Column of {@code size} missing elements over a copy of this pool.
     */
    public PooledColumn<T> similar(int size) {
        return new PooledColumn<>(type, RefArray.allocate(configuration.refWidth(), size), pool.copy(),
                configuration, converter);
    }

    public DenseColumn<T> unique() {
        return Levels.unique(this);
    }

    public DenseColumn<T> levels() {
        return Levels.levels(this);
    }

    public Map<Integer, T> indexToLevel() {
        return Levels.indexToLevel(this);
    }

    public Map<T, Integer> levelToIndex() {
        return Levels.levelToIndex(this);
    }

    /**
     * Reorder by a permutation computed over this column's references.
     */
    public PooledColumn<T> sort(SortIndexer indexer) {
        Objects.requireNonNull(indexer, "indexer");
        return reorder(indexer.order(references(), pool.size()));
    }

    /**
     * Reorder by a permutation of {@code 0..size()-1}.
     *
     * @throws IllegalArgumentException if {@code permutation} is not a permutation
     */
    public PooledColumn<T> reorder(int[] permutation) {
        Objects.requireNonNull(permutation, "permutation");
        if (permutation.length != refs.size()) {
            throw new IllegalArgumentException("permutation length " + permutation.length
                    + " != column length " + refs.size());
        }
        var seen = new boolean[permutation.length];
        for (int index : permutation) {
            if (index < 0 || index >= seen.length || seen[index]) {
                throw new IllegalArgumentException("not a permutation: position " + index);
            }
            seen[index] = true;
        }
        return select(permutation);
    }

    // Package access for the replace engine

    RefArray refArray() {
        return refs;
    }

    Pool<T> mutablePool() {
        return pool;
    }

    ValueConverter<T> converter() {
        return converter;
    }

    @Override
    public String toString() {
        return "PooledColumn{type=" + type.getSimpleName()
                + ", size=" + refs.size()
                + ", poolSize=" + pool.size()
                + ", width=" + refs.width() + '}';
    }

    private void checkElementKind(String operation) {
        if (Missing.class.equals(type)) {
            throw new UnsupportedElementKindException(type, operation);
        }
    }

    private void checkMaskLength(boolean[] mask) {
        Objects.requireNonNull(mask, "mask");
        if (mask.length != refs.size()) {
            throw new IllegalArgumentException("mask length " + mask.length + " != column length " + refs.size());
        }
    }

    private static int[] positionsOf(boolean[] mask) {
        var positions = new int[mask.length];
        var count = 0;
        for (var i = 0; i < mask.length; i++) {
            if (mask[i]) {
                positions[count++] = i;
            }
        }
        return Arrays.copyOf(positions, count);
    }

    private static int toPosition(Number index) {
        if (index instanceof Double || index instanceof Float) {
            var d = index.doubleValue();
            if (d != Math.rint(d)) {
                throw new IllegalArgumentException("index is not integral: " + index);
            }
        }
        var value = index.longValue();
        if (value < 0 || value > Integer.MAX_VALUE) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds");
        }
        return (int) value;
    }
}
