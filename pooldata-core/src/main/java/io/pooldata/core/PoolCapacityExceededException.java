package io.pooldata.core;

/**
 * A pool holds more values than the reference width can address.
 */
public class PoolCapacityExceededException extends PoolDataException {

    private final RefWidth width;
    private final long requested;

    public PoolCapacityExceededException(RefWidth width, long requested) {
        super("pool capacity exceeded: " + requested + " values do not fit "
                + width + " references (max " + width.maxReference() + ")");
        this.width = width;
        this.requested = requested;
    }

    public RefWidth width() {
        return width;
    }

    public int capacity() {
        return width.maxReference();
    }

    public long requested() {
        return requested;
    }
}
