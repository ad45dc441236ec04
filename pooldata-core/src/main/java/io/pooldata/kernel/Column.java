package io.pooldata.kernel;

/**
 * Read capability shared by dense and pooled columns.
 * <p>
 * A missing element reads as {@code null}; element values themselves are never null.
 *
 * @param <T> the element type
 */
public interface Column<T> {

    Class<T> type();

    /**
     * Number of logical elements.
     */
    int size();

    /**
     * Decoded value at a 0-based position, or {@code null} when missing.
     */
    T get(int index);

    boolean isMissing(int index);

    /**
     * Missingness of every element as a fresh array.
     */
    default boolean[] missingMask() {
        var mask = new boolean[size()];
        for (var i = 0; i < mask.length; i++) {
            mask[i] = isMissing(i);
        }
        return mask;
    }

    default boolean hasMissing() {
        for (var i = 0; i < size(); i++) {
            if (isMissing(i)) {
                return true;
            }
        }
        return false;
    }
}
