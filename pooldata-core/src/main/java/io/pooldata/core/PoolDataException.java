package io.pooldata.core;

/**
 * Root of every error raised by pooled column construction and mutation.
 * <p>
 * All subclasses are fatal to the operation that raised them; none is retried
 * or downgraded internally.
 */
public class PoolDataException extends RuntimeException {

    public PoolDataException(Throwable cause) {
        super(cause);
    }

    public PoolDataException(String message, Throwable cause) {
        super(message, cause);
    }

    public PoolDataException(String message) {
        super(message);
    }

}
