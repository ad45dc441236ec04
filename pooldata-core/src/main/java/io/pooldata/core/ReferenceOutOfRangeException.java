package io.pooldata.core;

/**
 * A reference array points beyond the end of its pool.
 */
public class ReferenceOutOfRangeException extends PoolDataException {

    private final long reference;
    private final int poolSize;

    public ReferenceOutOfRangeException(long reference, int poolSize) {
        super("reference " + reference + " points beyond the end of a pool of " + poolSize + " values");
        this.reference = reference;
        this.poolSize = poolSize;
    }

    public long reference() {
        return reference;
    }

    public int poolSize() {
        return poolSize;
    }
}
