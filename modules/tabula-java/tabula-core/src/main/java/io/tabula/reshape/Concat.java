/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.reshape;

import io.tabula.TabulaLog;
import io.tabula.core.DataFrame;
import io.tabula.core.Index;
import io.tabula.core.NDFrame;
import io.tabula.core.Series;
import io.tabula.errors.InvalidAxisException;
import io.tabula.errors.InvalidTypeException;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Concatenation of Series or DataFrames.
 */
public final class Concat {

    private static final TabulaLog LOG = new TabulaLog(LoggerFactory.getLogger(Concat.class));

    private Concat() {
    }

    public static <T extends NDFrame> T concat(List<?> objs) {
        return concat(objs, false, 0);
    }

    public static <T extends NDFrame> T concat(List<?> objs, boolean ignoreIndex) {
        return concat(objs, ignoreIndex, 0);
    }

    /**
     * Concatenate objects of one kind.
     *
     * @param objs        all Series or all DataFrame
     * @param ignoreIndex renumber rows from 0 instead of keeping the labels
     * @param axis        0 stacks rows, 1 places DataFrame columns side by side
     * @return a Series when given Series, a DataFrame when given DataFrames
     */
    @SuppressWarnings("unchecked")
    public static <T extends NDFrame> T concat(List<?> objs, boolean ignoreIndex, int axis) {
        if (objs == null || objs.isEmpty()) {
            throw new InvalidTypeException("objs must be a non-empty List of Series or DataFrame");
        }
        if (objs.get(0) instanceof Series) {
            return (T) concatSeries(checkAll(objs, Series.class), ignoreIndex);
        } else if (objs.get(0) instanceof DataFrame) {
            return (T) concatFrames(checkAll(objs, DataFrame.class), ignoreIndex, axis);
        }
        throw new InvalidTypeException("objs must be a List of Series or DataFrame");
    }

    private static <T> List<T> checkAll(List<?> objs, Class<T> kind) {
        List<T> checked = new ArrayList<>(objs.size());
        for (Object obj : objs) {
            if (!kind.isInstance(obj)) {
                throw new InvalidTypeException(String.format("Objects must all be %s", kind.getSimpleName()));
            }
            checked.add(kind.cast(obj));
        }
        return checked;
    }

    public static Series concatSeries(List<Series> series, boolean ignoreIndex) {
        return Series.concat(series, ignoreIndex);
    }

    /**
     * Stack frames by rows (axis 0) or join their columns (axis 1).
     * <p>
     * By rows, a column missing from a frame is padded with NaN for that frame's rows. By columns,
     * a repeated column name gets a ".x" suffix.
     */
    public static DataFrame concatFrames(List<DataFrame> frames, boolean ignoreIndex, int axis) {
        if (axis != 0 && axis != 1) {
            throw new InvalidAxisException(String.format("Invalid axis %d, must be 0 or 1", axis));
        }
        if (frames.size() == 1) {
            return frames.get(0).copy();
        }

        LinkedHashMap<Object, Series> columns = new LinkedHashMap<>();
        if (axis == 1) {
            for (DataFrame df : frames) {
                for (Object column : df.columns()) {
                    if (columns.containsKey(column)) {
                        String renamed = column + ".x";
                        LOG.warn("Repeated column {} renamed to {}", column, renamed);
                        columns.put(renamed, df.get(column).rename(renamed));
                    } else {
                        columns.put(column, df.get(column));
                    }
                }
            }
        } else {
            Index accumulated = null;
            for (DataFrame df : frames) {
                LinkedHashMap<Object, Series> next = new LinkedHashMap<>();
                for (Map.Entry<Object, Series> entry : columns.entrySet()) {
                    Series incoming = df.columnExists(entry.getKey())
                        ? df.get(entry.getKey())
                        : padding(entry.getKey(), df.length(), df.index());
                    next.put(entry.getKey(), stack(entry.getValue(), incoming, ignoreIndex));
                }
                for (Object column : df.columns()) {
                    if (next.containsKey(column)) {
                        continue;
                    }
                    next.put(column, accumulated == null
                        ? df.get(column)
                        : stack(padding(column, accumulated.size(), accumulated), df.get(column), ignoreIndex));
                }
                columns = next;
                if (!columns.isEmpty()) {
                    accumulated = columns.values().iterator().next().index();
                }
            }
        }

        DataFrame result = DataFrame.fromColumns(columns);
        LOG.debug("Concatenated {} frames along axis {} into {} rows x {} columns",
            frames.size(), axis, result.length(), columns.size());
        return result;
    }

    private static Series padding(Object column, int length, Index index) {
        return new Series(Collections.nCopies(length, Double.NaN), column, index);
    }

    private static Series stack(Series first, Series second, boolean ignoreIndex) {
        return Series.concat(Arrays.asList(first, second), ignoreIndex);
    }
}
