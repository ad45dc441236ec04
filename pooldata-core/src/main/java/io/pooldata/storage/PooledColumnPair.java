package io.pooldata.storage;

/**
 * Two pooled columns built over one canonical pool: equal values carry equal
 * references in {@code left} and {@code right}.
 */
public record PooledColumnPair<T>(PooledColumn<T> left, PooledColumn<T> right) {
}
