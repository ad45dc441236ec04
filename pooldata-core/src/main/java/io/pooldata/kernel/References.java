package io.pooldata.kernel;

/**
 * Read-only view of a reference array.
 * <p>
 * Reference {@code 0} is missing; {@code r > 0} is the 1-based pool index {@code r}.
 * Join and grouping code compares these integers directly instead of decoded values.
 */
public interface References {

    int size();

    /**
     * Unsigned reference at a 0-based position.
     */
    int get(int index);

    int[] toIntArray();

    /**
     * Largest reference, or 0 when empty.
     */
    default int max() {
        var max = 0;
        for (var i = 0; i < size(); i++) {
            max = Math.max(max, get(i));
        }
        return max;
    }

    /**
     * Number of positions holding the given reference.
     */
    default int count(int reference) {
        var count = 0;
        for (var i = 0; i < size(); i++) {
            if (get(i) == reference) {
                count++;
            }
        }
        return count;
    }
}
