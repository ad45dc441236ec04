package io.pooldata.core;

/**
 * A replacement was requested for a concrete value that is not in the pool.
 */
public class ReplaceSourceNotFoundException extends PoolDataException {

    private final transient Object value;

    public ReplaceSourceNotFoundException(Object value) {
        super("can't replace a value not in the pool: " + value);
        this.value = value;
    }

    public ReplaceSourceNotFoundException(Object value, Throwable cause) {
        super("can't replace a value not in the pool: " + value, cause);
        this.value = value;
    }

    public Object value() {
        return value;
    }
}
