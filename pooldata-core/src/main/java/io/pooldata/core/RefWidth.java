package io.pooldata.core;

/**
 * Physical width of a reference array.
 * <p>
 * The width bounds the number of values a pool may hold: reference {@code 0} is
 * reserved for missing, so a pool can have at most {@link #maxReference()} entries.
 */
public enum RefWidth {
    /**
     * One unsigned byte per element.
     */
    UINT8(255),

    /**
     * One unsigned short per element.
     */
    UINT16(65_535),

    /**
     * One int per element, bounded by the largest JVM array.
     */
    INT32(Integer.MAX_VALUE);

    private final int maxReference;

    RefWidth(int maxReference) {
        this.maxReference = maxReference;
    }

    /**
     * Largest reference, and therefore largest pool size, this width can hold.
     */
    public int maxReference() {
        return maxReference;
    }

    public boolean canAddress(long poolSize) {
        return poolSize <= maxReference;
    }

    /**
     * Fails with {@link PoolCapacityExceededException} if a pool of the given size
     * cannot be addressed.
     */
    public void checkCapacity(long poolSize) {
        if (!canAddress(poolSize)) {
            throw new PoolCapacityExceededException(this, poolSize);
        }
    }
}
