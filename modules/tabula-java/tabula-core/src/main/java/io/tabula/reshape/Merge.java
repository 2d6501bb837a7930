/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.reshape;

import io.tabula.TabulaLog;
import io.tabula.config.TabulaConfig;
import io.tabula.core.DataFrame;
import io.tabula.core.Values;
import io.tabula.errors.KeyException;
import io.tabula.errors.MergeException;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relational join of two frames on key columns.
 * <p>
 * Every row of the left frame is compared with every row of the right frame. Non-key columns
 * present on both sides get the configured left and right suffixes.
 */
public class Merge {

    private static final TabulaLog LOG = new TabulaLog(LoggerFactory.getLogger(Merge.class));

    private final String leftSuffix;
    private final String rightSuffix;

    public Merge(TabulaConfig config) {
        this.leftSuffix = config.mergeLeftSuffix();
        this.rightSuffix = config.mergeRightSuffix();
    }

    public static DataFrame mergeDataFrame(DataFrame df1, DataFrame df2, List<?> on, String how) {
        return mergeDataFrame(df1, df2, on, MergeHow.of(how));
    }

    public static DataFrame mergeDataFrame(DataFrame df1, DataFrame df2, List<?> on, MergeHow how) {
        return new Merge(TabulaConfig.global()).merge(df1, df2, on, how);
    }

    /**
     * @param on  key columns, or null for the columns both frames share
     * @param how inner keeps matching rows only, outer also keeps unmatched rows of both sides
     */
    public DataFrame merge(DataFrame df1, DataFrame df2, List<?> on, MergeHow how) {
        List<Object> keys = resolveKeys(df1, df2, on);
        LOG.verbose("Merging on {} with suffixes {} and {}", keys, leftSuffix, rightSuffix);

        List<Object> cols1 = nonKeyColumns(df1, keys);
        List<Object> cols2 = nonKeyColumns(df2, keys);
        List<Object> renamed1 = new ArrayList<>(cols1.size());
        List<Object> renamed2 = new ArrayList<>(cols2.size());
        for (Object column : cols1) {
            renamed1.add(cols2.contains(column) ? column + leftSuffix : column);
        }
        for (Object column : cols2) {
            renamed2.add(cols1.contains(column) ? column + rightSuffix : column);
        }

        List<Map<Object, Object>> rows1 = records(df1);
        List<Map<Object, Object>> rows2 = records(df2);
        boolean[] matched1 = new boolean[rows1.size()];
        boolean[] matched2 = new boolean[rows2.size()];
        List<Map<Object, Object>> data = new ArrayList<>();

        for (int i = 0; i < rows1.size(); i++) {
            Map<Object, Object> row1 = rows1.get(i);
            for (int j = 0; j < rows2.size(); j++) {
                Map<Object, Object> row2 = rows2.get(j);
                if (!keysMatch(row1, row2, keys)) {
                    continue;
                }
                Map<Object, Object> record = new LinkedHashMap<>();
                copyKeys(row1, keys, record);
                copyColumns(row1, cols1, renamed1, record);
                copyColumns(row2, cols2, renamed2, record);
                data.add(record);
                matched1[i] = true;
                matched2[j] = true;
            }
        }

        if (how == MergeHow.OUTER) {
            for (int i = 0; i < rows1.size(); i++) {
                if (!matched1[i]) {
                    Map<Object, Object> record = new LinkedHashMap<>();
                    copyKeys(rows1.get(i), keys, record);
                    copyColumns(rows1.get(i), cols1, renamed1, record);
                    copyColumns(null, cols2, renamed2, record);
                    data.add(record);
                }
            }
            for (int j = 0; j < rows2.size(); j++) {
                if (!matched2[j]) {
                    Map<Object, Object> record = new LinkedHashMap<>();
                    copyKeys(rows2.get(j), keys, record);
                    copyColumns(null, cols1, renamed1, record);
                    copyColumns(rows2.get(j), cols2, renamed2, record);
                    data.add(record);
                }
            }
        }

        LOG.debug("{} merge on {}: {} x {} rows -> {} rows", how, keys, rows1.size(), rows2.size(), data.size());
        return DataFrame.fromRecords(data);
    }

    private static List<Object> resolveKeys(DataFrame df1, DataFrame df2, List<?> on) {
        List<Object> keys = new ArrayList<>();
        if (on == null) {
            for (Object column : df1.columns()) {
                if (df2.columnExists(column)) {
                    keys.add(column);
                }
            }
            if (keys.isEmpty()) {
                throw new MergeException("No common keys");
            }
            return keys;
        }
        for (Object column : on) {
            if (!df1.columnExists(column) || !df2.columnExists(column)) {
                throw new KeyException(String.format("KeyError: %s not found", column));
            }
            keys.add(Values.normalize(column));
        }
        return keys;
    }

    private static List<Object> nonKeyColumns(DataFrame df, List<Object> keys) {
        List<Object> columns = new ArrayList<>();
        for (Object column : df.columns()) {
            if (!keys.contains(column)) {
                columns.add(column);
            }
        }
        return columns;
    }

    private static List<Map<Object, Object>> records(DataFrame df) {
        List<Map<Object, Object>> records = new ArrayList<>(df.length());
        for (Map<Object, Object> record : df) {
            records.add(record);
        }
        return records;
    }

    private static boolean keysMatch(Map<Object, Object> row1, Map<Object, Object> row2, List<Object> keys) {
        for (Object key : keys) {
            if (!Values.equal(row1.get(key), row2.get(key))) {
                return false;
            }
        }
        return true;
    }

    private static void copyKeys(Map<Object, Object> row, List<Object> keys, Map<Object, Object> record) {
        for (Object key : keys) {
            record.put(key, row.get(key));
        }
    }

    private static void copyColumns(Map<Object, Object> row, List<Object> columns, List<Object> renamed,
                                    Map<Object, Object> record) {
        for (int c = 0; c < columns.size(); c++) {
            record.put(renamed.get(c), row == null ? null : row.get(columns.get(c)));
        }
    }
}
