/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import io.tabula.errors.InvalidTypeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Cell-level helpers: normalization, equality, ordering and arithmetic on untyped values.
 */
public final class Values {

    private Values() {
    }

    /**
     * Widens Integer/Short/Byte to Long and Float to Double so that equal numbers compare equal.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        } else if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        return value;
    }

    public static List<Object> normalizeAll(Iterable<?> values) {
        List<Object> result = values instanceof Collection
            ? new ArrayList<>(((Collection<?>) values).size())
            : new ArrayList<>();
        for (Object value : values) {
            result.add(normalize(value));
        }
        return result;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long
            || value instanceof Integer
            || value instanceof Short
            || value instanceof Byte
            || value instanceof BigInteger;
    }

    public static boolean isMissing(Object value) {
        return value == null || (value instanceof Double && ((Double) value).isNaN());
    }

    /**
     * Strict equality. Numbers compare by value regardless of boxing, NaN is never equal.
     */
    public static boolean equal(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            if (isIntegral(a) && isIntegral(b)) {
                return ((Number) a).longValue() == ((Number) b).longValue();
            }
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return Objects.equals(a, b);
    }

    /**
     * Compares two values of the same kind.
     *
     * @return comparison result, or null when the values are missing or not comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Integer compareOrNull(Object a, Object b) {
        if (isMissing(a) || isMissing(b)) {
            return null;
        }
        if (a instanceof Number && b instanceof Number) {
            if (isIntegral(a) && isIntegral(b)) {
                return Long.compare(((Number) a).longValue(), ((Number) b).longValue());
            }
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable) a).compareTo(b);
        }
        return null;
    }

    public static boolean lessThan(Object a, Object b) {
        Integer c = compareOrNull(a, b);
        return c != null && c < 0;
    }

    public static boolean lessThanOrEqual(Object a, Object b) {
        Integer c = compareOrNull(a, b);
        return c != null && c <= 0;
    }

    public static boolean greaterThan(Object a, Object b) {
        Integer c = compareOrNull(a, b);
        return c != null && c > 0;
    }

    public static boolean greaterThanOrEqual(Object a, Object b) {
        Integer c = compareOrNull(a, b);
        return c != null && c >= 0;
    }

    /**
     * Total order used for sorting: missing values last, incomparable values by type name.
     */
    public static int compare(Object a, Object b) {
        boolean missingA = isMissing(a);
        boolean missingB = isMissing(b);
        if (missingA || missingB) {
            return Boolean.compare(missingA, missingB);
        }
        Integer c = compareOrNull(a, b);
        if (c != null) {
            return c;
        }
        return a.getClass().getName().compareTo(b.getClass().getName());
    }

    public static Object add(Object a, Object b) {
        if (a == null || b == null) {
            return null;
        }
        if (a instanceof String || b instanceof String) {
            return String.valueOf(a) + b;
        }
        Number x = asNumber(a, "add");
        Number y = asNumber(b, "add");
        if (isIntegral(x) && isIntegral(y)) {
            try {
                return Math.addExact(x.longValue(), y.longValue());
            } catch (ArithmeticException overflow) {
                return x.doubleValue() + y.doubleValue();
            }
        }
        return x.doubleValue() + y.doubleValue();
    }

    public static Object sub(Object a, Object b) {
        if (a == null || b == null) {
            return null;
        }
        Number x = asNumber(a, "sub");
        Number y = asNumber(b, "sub");
        if (isIntegral(x) && isIntegral(y)) {
            try {
                return Math.subtractExact(x.longValue(), y.longValue());
            } catch (ArithmeticException overflow) {
                return x.doubleValue() - y.doubleValue();
            }
        }
        return x.doubleValue() - y.doubleValue();
    }

    public static Object mul(Object a, Object b) {
        if (a == null || b == null) {
            return null;
        }
        Number x = asNumber(a, "mul");
        Number y = asNumber(b, "mul");
        if (isIntegral(x) && isIntegral(y)) {
            try {
                return Math.multiplyExact(x.longValue(), y.longValue());
            } catch (ArithmeticException overflow) {
                return x.doubleValue() * y.doubleValue();
            }
        }
        return x.doubleValue() * y.doubleValue();
    }

    public static Object div(Object a, Object b) {
        if (a == null || b == null) {
            return null;
        }
        return asNumber(a, "div").doubleValue() / asNumber(b, "div").doubleValue();
    }

    /**
     * Numeric view of a value for reductions. Missing values become NaN.
     */
    public static double toDouble(Object value) {
        if (value == null) {
            return Double.NaN;
        }
        return asNumber(value, "reduce").doubleValue();
    }

    /**
     * Round half away from zero at the given decimal digit. Shifts through the decimal string
     * representation, so 1.005 rounds to 1.01 rather than 1.0.
     */
    public static Object round(Object value, int decimals) {
        if (value == null) {
            return null;
        }
        if (isIntegral(value)) {
            if (decimals >= 0) {
                return value;
            }
            return new BigDecimal(((Number) value).longValue())
                .setScale(decimals, RoundingMode.HALF_UP)
                .longValue();
        }
        double d = asNumber(value, "round").doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return d;
        }
        return BigDecimal.valueOf(d).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }

    private static Number asNumber(Object value, String opName) {
        if (value instanceof Number) {
            return (Number) value;
        }
        throw new InvalidTypeException(String.format("%s only supports numeric values, got %s", opName, value));
    }
}
