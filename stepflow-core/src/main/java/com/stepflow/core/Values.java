package com.stepflow.core;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Type acceptance rules for configuration values. Sources such as environment variables deliver every scalar as a
 * string, so numeric and boolean targets also accept their textual form.
 */
final class Values {
    private Values() {}

    static boolean conforms(Object value, Class<?> type) {
        if (value == null) return false;
        if (type.isInstance(value)) return true;
        return tryConvert(value, type) != null;
    }

    static <T> T convert(String path, Object value, Class<T> type) {
        if (value != null && type.isInstance(value)) return type.cast(value);
        Object converted = value == null ? null : tryConvert(value, type);
        if (converted == null) {
            throw new ValueTypeException(path, type, value == null ? null : value.getClass());
        }
        return type.cast(converted);
    }

    private static Object tryConvert(Object value, Class<?> type) {
        if (type == Secret.class && value instanceof String s) {
            return Secret.of(s);
        }
        if (type == Boolean.class && value instanceof String s) {
            if ("true".equalsIgnoreCase(s)) return Boolean.TRUE;
            if ("false".equalsIgnoreCase(s)) return Boolean.FALSE;
            return null;
        }
        if (!Number.class.isAssignableFrom(type)) return null;

        BigDecimal number = asDecimal(value);
        if (number == null) return null;
        try {
            if (type == Integer.class) return number.intValueExact();
            if (type == Long.class) return number.longValueExact();
            if (type == Double.class) return number.doubleValue();
            if (type == Float.class) return number.floatValue();
            if (type == BigDecimal.class) return number;
            if (type == BigInteger.class) return number.toBigIntegerExact();
            if (type == Number.class) return value instanceof Number ? value : number;
        } catch (ArithmeticException notExact) {
            return null;
        }
        return null;
    }

    private static BigDecimal asDecimal(Object value) {
        if (value instanceof BigDecimal d) return d;
        if (value instanceof BigInteger i) return new BigDecimal(i);
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Number n) return BigDecimal.valueOf(n.longValue());
        if (value instanceof String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException notNumeric) {
                return null;
            }
        }
        return null;
    }
}
