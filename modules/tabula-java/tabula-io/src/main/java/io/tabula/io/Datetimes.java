/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.io;

import io.tabula.core.DataFrame;
import io.tabula.core.Series;
import io.tabula.errors.InvalidTypeException;
import io.tabula.errors.UnsupportedConversionException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Datetimes {

    private Datetimes() {
    }

    /**
     * Parse ISO date strings, keeping the shape of the argument.
     *
     * @param arg Series, DataFrame, List or String
     * @return a Series, DataFrame, List or temporal value respectively
     */
    public static Object toDatetime(Object arg) {
        if (arg instanceof Series) {
            return toDatetime((Series) arg);
        } else if (arg instanceof DataFrame) {
            return toDatetime((DataFrame) arg);
        } else if (arg instanceof List) {
            List<Object> parsed = new ArrayList<>();
            for (Object value : (List<?>) arg) {
                parsed.add(toDatetime(value));
            }
            return parsed;
        } else if (arg instanceof String) {
            return parse((String) arg);
        }
        throw new InvalidTypeException("Must be Series, DataFrame, List or String");
    }

    public static Series toDatetime(Series series) {
        return series.map(Datetimes::cell);
    }

    public static DataFrame toDatetime(DataFrame df) {
        Map<Object, Series> columns = new LinkedHashMap<>();
        for (Object column : df.columns()) {
            columns.put(column, toDatetime(df.get(column)));
        }
        return DataFrame.fromColumns(columns, df.index());
    }

    private static Object cell(Object value) {
        if (value == null || value instanceof Temporal) {
            return value;
        } else if (value instanceof String) {
            return parse((String) value);
        }
        throw new InvalidTypeException(String.format("Unable to convert %s to datetime", value));
    }

    /**
     * Zoned timestamps keep their zone, timestamps without one stay local, plain dates stay dates.
     */
    public static Temporal parse(String text) {
        String value = text.trim();
        try {
            if (value.length() <= 10) {
                return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
            }
            if (value.endsWith("Z") || value.lastIndexOf('+') > 10 || value.lastIndexOf('-') > 10 || value.endsWith("]")) {
                return ZonedDateTime.parse(value, DateTimeFormatter.ISO_ZONED_DATE_TIME);
            }
            return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new UnsupportedConversionException(String.format("Unable to parse %s as datetime", text), e);
        }
    }
}
