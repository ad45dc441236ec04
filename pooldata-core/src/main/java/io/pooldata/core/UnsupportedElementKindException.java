package io.pooldata.core;

/**
 * An operation is not defined for columns of the given element type.
 */
public class UnsupportedElementKindException extends PoolDataException {

    private final Class<?> type;

    public UnsupportedElementKindException(Class<?> type, String operation) {
        super(operation + " is not supported for columns of " + type.getName());
        this.type = type;
    }

    public Class<?> type() {
        return type;
    }
}
