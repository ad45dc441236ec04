package io.pooldata.core.converter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Default {@link ValueConverter}s keyed by target type.
 * <p>
 * Instances of the target type pass through unchanged. Numbers convert between
 * boxed types only when no information is lost, character sequences become
 * strings, and strings name enum constants. Everything else is rejected.
 */
public final class ValueConverters {

    private static final Map<Class<?>, ValueConverter<?>> DEFAULTS = new HashMap<>();

    static {
        register(Byte.class, value -> (byte) integral(value, Byte.MIN_VALUE, Byte.MAX_VALUE, Byte.class));
        register(Short.class, value -> (short) integral(value, Short.MIN_VALUE, Short.MAX_VALUE, Short.class));
        register(Integer.class, value -> (int) integral(value, Integer.MIN_VALUE, Integer.MAX_VALUE, Integer.class));
        register(Long.class, value -> integral(value, Long.MIN_VALUE, Long.MAX_VALUE, Long.class));
        register(Double.class, ValueConverters::toDouble);
        register(Float.class, ValueConverters::toFloat);
        register(String.class, ValueConverters::toStringValue);
        register(Character.class, ValueConverters::toCharacter);
    }

    private ValueConverters() {
    }

    private static <T> void register(Class<T> type, ValueConverter<T> converter) {
        DEFAULTS.put(type, converter);
    }

    /**
     * Get the default converter for a target type.
     *
     * @param type the element type
     * @return a converter that never returns null
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <T> ValueConverter<T> forType(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
        var known = (ValueConverter<T>) DEFAULTS.get(type);
        if (type.isEnum()) {
            ValueConverter<T> byName = value -> (T) enumConstant((Class) type, value);
            return identityOr(type, byName);
        }
        return identityOr(type, known);
    }

    private static <T> ValueConverter<T> identityOr(Class<T> type, ValueConverter<T> fallback) {
        return value -> {
            if (value == null) {
                throw new IllegalArgumentException("value required");
            }
            if (type.isInstance(value)) {
                return type.cast(value);
            }
            if (fallback == null) {
                throw incompatible(value, type);
            }
            return fallback.convert(value);
        };
    }

    private static long integral(Object value, long min, long max, Class<?> type) {
        long result;
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            result = ((Number) value).longValue();
        } else if (value instanceof BigInteger big) {
            if (big.bitLength() > 63) {
                throw outOfRange(value, type);
            }
            result = big.longValue();
        } else if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            if (!(value instanceof BigDecimal) && !Double.isFinite(((Number) value).doubleValue())) {
                throw outOfRange(value, type);
            }
            var decimal = value instanceof BigDecimal bd ? bd : BigDecimal.valueOf(((Number) value).doubleValue());
            try {
                result = decimal.longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("cannot convert " + value + " to " + type.getSimpleName()
                        + " without loss", e);
            }
        } else if (value instanceof Character c) {
            result = c;
        } else {
            throw incompatible(value, type);
        }
        if (result < min || result > max) {
            throw outOfRange(value, type);
        }
        return result;
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number && !(value instanceof BigInteger) && !(value instanceof BigDecimal)) {
            if (value instanceof Long l
                    && new BigDecimal(l.longValue()).compareTo(new BigDecimal((double) l.longValue())) != 0) {
                throw outOfRange(value, Double.class);
            }
            return number.doubleValue();
        }
        throw incompatible(value, Double.class);
    }

    private static Float toFloat(Object value) {
        if (value instanceof Byte || value instanceof Short) {
            return ((Number) value).floatValue();
        }
        // compare as long: an int cast would saturate 2^31 back to Integer.MAX_VALUE
        if (value instanceof Integer i && (long) (float) i.intValue() == i.intValue()) {
            return (float) i.intValue();
        }
        if (value instanceof Double d && Double.compare(d.floatValue(), d) == 0) {
            return d.floatValue();
        }
        throw incompatible(value, Float.class);
    }

    private static String toStringValue(Object value) {
        if (value instanceof CharSequence || value instanceof Character) {
            return value.toString();
        }
        throw incompatible(value, String.class);
    }

    private static Character toCharacter(Object value) {
        if (value instanceof CharSequence seq && seq.length() == 1) {
            return seq.charAt(0);
        }
        throw incompatible(value, Character.class);
    }

    private static <E extends Enum<E>> E enumConstant(Class<E> type, Object value) {
        if (!(value instanceof CharSequence)) {
            throw incompatible(value, type);
        }
        try {
            return Enum.valueOf(type, value.toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("no constant " + value + " in " + type.getName(), e);
        }
    }

    private static IllegalArgumentException incompatible(Object value, Class<?> type) {
        return new IllegalArgumentException("cannot convert " + value.getClass().getName()
                + " value " + value + " to " + type.getName());
    }

    private static IllegalArgumentException outOfRange(Object value, Class<?> type) {
        return new IllegalArgumentException("value " + value + " out of range for " + type.getSimpleName());
    }
}
