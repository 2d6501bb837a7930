/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import io.tabula.errors.InvalidTypeException;

import java.math.BigDecimal;
import java.time.temporal.Temporal;
import java.util.Date;
import java.util.Locale;

/**
 * Element type classification of a column.
 */
public enum DType {

    INT("int"),
    FLOAT("float"),
    OBJECT("object"),
    BOOL("bool"),
    DATETIME("datetime");

    private final String dtype;

    DType(String dtype) {
        this.dtype = dtype;
    }

    public String dtype() {
        return dtype;
    }

    public static DType of(String name) {
        if (name != null) {
            String lower = name.toLowerCase(Locale.ROOT);
            for (DType value : values()) {
                if (value.dtype.equals(lower)) {
                    return value;
                }
            }
        }
        throw new InvalidTypeException(String.format("dtype %s not allowed", name));
    }

    /**
     * Classify a single value.
     *
     * @param el value to classify
     * @return dtype of the value
     */
    public static DType elementToDType(Object el) {
        if (el instanceof String) {
            return OBJECT;
        } else if (el instanceof Double || el instanceof Float || el instanceof BigDecimal) {
            return FLOAT;
        } else if (el instanceof Boolean) {
            return BOOL;
        } else if (el instanceof Temporal || el instanceof Date) {
            return DATETIME;
        } else if (el instanceof Number) {
            return INT;
        }
        // null, maps, lists, arrays and any other object
        return OBJECT;
    }

    /**
     * Classify a sequence of values. The scan stops at the first value which is not int, float or
     * datetime, so the result depends on element order. A float seen earlier is not downgraded by
     * later ints.
     *
     * @param values values to classify
     * @return dtype of the sequence, object when empty
     */
    public static DType arrayToDType(Iterable<?> values) {
        DType arrayDType = null;

        for (Object el : values) {
            DType next = elementToDType(el);
            if (!(arrayDType == FLOAT && next == INT)) {
                arrayDType = next;
            }

            if (arrayDType != INT && arrayDType != FLOAT && arrayDType != DATETIME) {
                break;
            }
        }

        return arrayDType == null ? OBJECT : arrayDType;
    }

    @Override
    public String toString() {
        return String.format("dtype(%s)", dtype);
    }
}
