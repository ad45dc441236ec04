package io.pooldata.core.converter;

/**
 * Converts an arbitrary assigned value into a column's element type.
 *
 * @param <T> the element type produced
 */
@FunctionalInterface
public interface ValueConverter<T> {

    /**
     * Convert a non-null value into {@code T}.
     *
     * @throws IllegalArgumentException if the value cannot be represented as {@code T}
     */
    T convert(Object value);
}
