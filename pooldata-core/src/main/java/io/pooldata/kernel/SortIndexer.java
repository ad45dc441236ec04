package io.pooldata.kernel;

/**
 * Computes an ordering permutation over a reference array.
 * <p>
 * Implemented by grouping/sorting code outside this library; pooled columns only
 * apply the permutation it returns.
 */
@FunctionalInterface
public interface SortIndexer {

    /**
     * @param references the references to order
     * @param poolSize   number of pool slots, i.e. the largest possible reference
     * @return a permutation of {@code 0..references.size()-1}
     */
    int[] order(References references, int poolSize);
}
