package io.pooldata.core;

/**
 * Immutable configuration for pooled column construction.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * PoolingConfiguration config = PoolingConfiguration.builder()
 *     .refWidth(RefWidth.UINT8)
 *     .indexedLookup(false)
 *     .build();
 * </pre>
 * <p>
 * Columns keep the configuration they were built with; copies and selections
 * inherit it.
 */
public final class PoolingConfiguration {

    private static final PoolingConfiguration DEFAULTS = builder().build();

    // Reference storage
    private final RefWidth refWidth;

    // Pool lookup
    private final boolean indexedLookup;
    private final int initialPoolCapacity;

    private PoolingConfiguration(Builder builder) {
        this.refWidth = builder.refWidth;
        this.indexedLookup = builder.indexedLookup;
        this.initialPoolCapacity = builder.initialPoolCapacity;
    }

    /**
     * Create a new builder for PoolingConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The shared default configuration: {@link RefWidth#UINT16} references,
     * indexed pool lookup, initial pool capacity of 16.
     */
    public static PoolingConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the width of the reference arrays built with this configuration.
     *
     * @return the reference width
     */
    public RefWidth refWidth() {
        return refWidth;
    }

    /**
     * Check if pools keep a value to index map next to the value buffer.
     * When disabled, lookups scan the pool linearly.
     *
     * @return true if indexed lookup is enabled (default: true)
     */
    public boolean indexedLookup() {
        return indexedLookup;
    }

    /**
     * Get the initial capacity of a pool's growable buffer.
     *
     * @return initial pool capacity
     */
    public int initialPoolCapacity() {
        return initialPoolCapacity;
    }

    /**
     * Return a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .refWidth(refWidth)
                .indexedLookup(indexedLookup)
                .initialPoolCapacity(initialPoolCapacity);
    }

    @Override
    public String toString() {
        return "PoolingConfiguration{refWidth=" + refWidth
                + ", indexedLookup=" + indexedLookup
                + ", initialPoolCapacity=" + initialPoolCapacity + '}';
    }

    /**
     * Builder for PoolingConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private RefWidth refWidth = RefWidth.UINT16;
        private boolean indexedLookup = true;
        private int initialPoolCapacity = 16;

        private Builder() {
        }

        /**
         * Set the reference width.
         *
         * @param refWidth the width of reference arrays
         * @return this builder for method chaining
         */
        public Builder refWidth(RefWidth refWidth) {
            if (refWidth == null) {
                throw new IllegalArgumentException("refWidth required");
            }
            this.refWidth = refWidth;
            return this;
        }

        /**
         * Enable or disable the value to index map kept next to each pool.
         *
         * @param indexedLookup true to enable indexed lookup
         * @return this builder for method chaining
         */
        public Builder indexedLookup(boolean indexedLookup) {
            this.indexedLookup = indexedLookup;
            return this;
        }

        /**
         * Set the initial capacity of pool buffers.
         *
         * @param initialPoolCapacity initial capacity (must be positive)
         * @return this builder for method chaining
         */
        public Builder initialPoolCapacity(int initialPoolCapacity) {
            if (initialPoolCapacity <= 0) {
                throw new IllegalArgumentException("initialPoolCapacity must be positive: " + initialPoolCapacity);
            }
            this.initialPoolCapacity = initialPoolCapacity;
            return this;
        }

        /**
         * Build the configuration.
         *
         * @return a new immutable PoolingConfiguration instance
         */
        public PoolingConfiguration build() {
            return new PoolingConfiguration(this);
        }
    }
}
