package io.pooldata.core;

/**
 * Raw data contains a value that a caller-fixed pool does not hold.
 */
public class ValueNotInPoolException extends PoolDataException {

    private final transient Object value;

    public ValueNotInPoolException(Object value) {
        super("value not in provided pool: " + value);
        this.value = value;
    }

    public Object value() {
        return value;
    }
}
