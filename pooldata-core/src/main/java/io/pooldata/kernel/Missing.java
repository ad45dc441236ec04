package io.pooldata.kernel;

/**
 * Out-of-band marker for a missing element in untyped writes.
 * <p>
 * Typed reads report missing as {@code null}; untyped writes such as
 * {@code set(index, Object)} accept either {@code null} or {@link #VALUE}.
 * Columns whose element type is {@code Missing} itself are not meaningful and are
 * rejected by operations that would have to tell the two apart.
 */
public final class Missing {

    public static final Missing VALUE = new Missing();

    private Missing() {
    }

    public static boolean isMissing(Object value) {
        return value == null || value == VALUE;
    }

    @Override
    public String toString() {
        return "NA";
    }
}
