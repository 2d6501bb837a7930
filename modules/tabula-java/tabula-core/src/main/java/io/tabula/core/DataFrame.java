/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import io.tabula.TabulaLog;
import io.tabula.config.TabulaConfig;
import io.tabula.errors.IndexMismatchException;
import io.tabula.errors.InvalidAxisException;
import io.tabula.errors.InvalidTypeException;
import io.tabula.errors.KeyException;
import io.tabula.errors.NotImplementedException;
import io.tabula.errors.ShapeMismatchException;
import io.tabula.errors.TabulaException;
import io.tabula.reshape.Concat;
import io.tabula.reshape.Merge;
import io.tabula.reshape.MergeHow;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Two-dimensional table of named columns sharing one row index.
 * <p>
 * Columns are {@link Series} of equal length. Operations return new frames; only the column
 * names and the row index can be reassigned in place.
 */
public class DataFrame extends NDFrame implements Iterable<Map<Object, Object>> {

    private static final TabulaLog LOG = new TabulaLog(LoggerFactory.getLogger(DataFrame.class));

    private static final List<String> ORIENTS = Arrays.asList("records", "split", "index", "values", "columns");

    private final LinkedHashMap<Object, Series> data;
    private List<List<Object>> rows;

    public DataFrame() {
        this(new LinkedHashMap<>(), Index.empty());
    }

    private DataFrame(LinkedHashMap<Object, Series> data, Index index) {
        this.data = data;
        setupAxes(0, 1);
        setAxis(0, index);
        setAxis(1, new Index(new ArrayList<>(data.keySet())));
    }

    public static DataFrame fromRecords(List<? extends Map<?, ?>> records) {
        return fromRecords(records, null);
    }

    /**
     * Build a frame from row records. Columns appear in order of first appearance; a record
     * lacking a column contributes null to it.
     *
     * @param records row records, column name to value
     * @param index   row labels or null for 0..n-1
     */
    public static DataFrame fromRecords(List<? extends Map<?, ?>> records, Object index) {
        List<Map<Object, Object>> normalized = new ArrayList<>(records.size());
        List<Object> columns = new ArrayList<>();
        for (Map<?, ?> record : records) {
            Map<Object, Object> row = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : record.entrySet()) {
                Object column = Values.normalize(entry.getKey());
                if (!columns.contains(column)) {
                    columns.add(column);
                }
                row.put(column, entry.getValue());
            }
            normalized.add(row);
        }

        LinkedHashMap<Object, List<Object>> columnValues = new LinkedHashMap<>();
        for (Object column : columns) {
            List<Object> values = new ArrayList<>(normalized.size());
            for (Map<Object, Object> row : normalized) {
                values.add(Values.normalize(row.get(column)));
            }
            columnValues.put(column, values);
        }
        return build(columnValues, Index.parse(index, records.size()));
    }

    public static DataFrame fromColumns(Map<?, ?> columns) {
        return fromColumns(columns, null);
    }

    /**
     * Build a frame from a column map. Values may be a Series, a List or an array; a Series takes
     * the column name.
     *
     * @param columns column name to values
     * @param index   row labels; when null the first Series' index, otherwise 0..n-1
     */
    public static DataFrame fromColumns(Map<?, ?> columns, Object index) {
        LinkedHashMap<Object, List<Object>> columnValues = new LinkedHashMap<>();
        Index seriesIndex = null;
        int length = -1;
        for (Map.Entry<?, ?> entry : columns.entrySet()) {
            List<Object> values;
            if (entry.getValue() instanceof Series) {
                Series series = (Series) entry.getValue();
                values = series.values();
                if (seriesIndex == null) {
                    seriesIndex = series.index();
                }
            } else if (entry.getValue() instanceof List) {
                values = Values.normalizeAll((List<?>) entry.getValue());
            } else if (entry.getValue() instanceof Object[]) {
                values = Values.normalizeAll(Arrays.asList((Object[]) entry.getValue()));
            } else {
                throw new InvalidTypeException(
                    String.format("Column %s must be a Series, List or Array", entry.getKey()));
            }
            if (length >= 0 && values.size() != length) {
                throw new IndexMismatchException(
                    String.format("Column %s of length %d does not match length %d", entry.getKey(), values.size(), length));
            }
            length = values.size();
            columnValues.put(Values.normalize(entry.getKey()), values);
        }
        length = Math.max(length, 0);
        Index resolved = index == null && seriesIndex != null ? seriesIndex : Index.parse(index, length);
        return build(columnValues, resolved);
    }

    public static DataFrame fromRows(List<? extends List<?>> rows, List<?> columns) {
        return fromRows(rows, columns, null);
    }

    /**
     * Build a frame from row-major values.
     *
     * @param rows    rows of equal width
     * @param columns column names, or null for 0..width-1
     * @param index   row labels or null for 0..n-1
     */
    public static DataFrame fromRows(List<? extends List<?>> rows, List<?> columns, Object index) {
        int width = rows.isEmpty() ? 0 : rows.get(0).size();
        List<Object> names = columns == null ? Index.range(width).values() : Values.normalizeAll(columns);
        LinkedHashMap<Object, List<Object>> columnValues = new LinkedHashMap<>();
        for (Object name : names) {
            columnValues.put(name, new ArrayList<>(rows.size()));
        }
        if (columnValues.size() != names.size()) {
            throw new ShapeMismatchException("Column names must be unique");
        }
        for (List<?> row : rows) {
            if (row.size() != names.size()) {
                throw new ShapeMismatchException(
                    String.format("Row of width %d does not match %d columns", row.size(), names.size()));
            }
            for (int c = 0; c < names.size(); c++) {
                columnValues.get(names.get(c)).add(Values.normalize(row.get(c)));
            }
        }
        return build(columnValues, Index.parse(index, rows.size()));
    }

    private static DataFrame build(LinkedHashMap<Object, List<Object>> columnValues, Index index) {
        LinkedHashMap<Object, Series> data = new LinkedHashMap<>();
        for (Map.Entry<Object, List<Object>> entry : columnValues.entrySet()) {
            if (entry.getValue().size() != index.size()) {
                throw new IndexMismatchException(
                    String.format("Column %s of length %d does not match index of length %d",
                        entry.getKey(), entry.getValue().size(), index.size()));
            }
            data.put(entry.getKey(), Series.trusted(entry.getValue(), entry.getKey(), index));
        }
        return new DataFrame(data, index);
    }

    /**
     * Frame over columns which already share the given index.
     */
    static DataFrame ofSeries(LinkedHashMap<Object, Series> columns, Index index) {
        LinkedHashMap<Object, Series> data = new LinkedHashMap<>();
        for (Map.Entry<Object, Series> entry : columns.entrySet()) {
            Series series = entry.getValue();
            data.put(entry.getKey(), Series.trusted(series.values(), entry.getKey(), index));
        }
        return new DataFrame(data, index);
    }

    public Index index() {
        return getAxis(0);
    }

    /**
     * Replace the row labels of every column.
     *
     * @param index Index, List or array with one label per row
     */
    public void setIndex(Object index) {
        Index parsed = Index.parse(index, length());
        for (Map.Entry<Object, Series> entry : data.entrySet()) {
            entry.setValue(entry.getValue().withIndex(parsed));
        }
        setAxis(0, parsed);
    }

    public Index columns() {
        return getAxis(1);
    }

    /**
     * Rename the columns positionally.
     *
     * @param names one unique name per column
     */
    public void setColumns(List<?> names) {
        List<Object> normalized = Values.normalizeAll(names);
        if (normalized.size() != data.size()) {
            throw new ShapeMismatchException("Columns must be array of same dimension");
        }
        List<Series> current = new ArrayList<>(data.values());
        LinkedHashMap<Object, Series> renamed = new LinkedHashMap<>();
        for (int i = 0; i < normalized.size(); i++) {
            renamed.put(normalized.get(i), current.get(i).rename(normalized.get(i)));
        }
        if (renamed.size() != current.size()) {
            throw new ShapeMismatchException("Column names must be unique");
        }
        data.clear();
        data.putAll(renamed);
        setAxis(1, new Index(normalized));
        rows = null;
    }

    public int length() {
        return index().size();
    }

    public boolean columnExists(Object column) {
        return data.containsKey(Values.normalize(column));
    }

    /**
     * @return the column's Series, not a copy
     */
    public Series get(Object column) {
        Series series = data.get(Values.normalize(column));
        if (series == null) {
            throw new KeyException(String.format("KeyError: %s not found", column));
        }
        return series;
    }

    public DataFrame get(List<?> columns) {
        LinkedHashMap<Object, Series> subset = new LinkedHashMap<>();
        for (Object column : columns) {
            subset.put(Values.normalize(column), get(column));
        }
        return ofSeries(subset, index());
    }

    /**
     * Row-major values, computed on first access.
     */
    public List<List<Object>> values() {
        if (rows == null) {
            List<List<Object>> computed = new ArrayList<>(length());
            List<Series> columns = new ArrayList<>(data.values());
            for (int r = 0; r < length(); r++) {
                List<Object> row = new ArrayList<>(columns.size());
                for (Series column : columns) {
                    row.add(column.iloc(r));
                }
                computed.add(Collections.unmodifiableList(row));
            }
            rows = Collections.unmodifiableList(computed);
        }
        return rows;
    }

    private Map<Object, Object> record(int row) {
        Map<Object, Object> record = new LinkedHashMap<>();
        for (Map.Entry<Object, Series> entry : data.entrySet()) {
            record.put(entry.getKey(), entry.getValue().iloc(row));
        }
        return record;
    }

    @Override
    public Iterator<Map<Object, Object>> iterator() {
        return new Iterator<Map<Object, Object>>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < length();
            }

            @Override
            public Map<Object, Object> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return record(next++);
            }
        };
    }

    /**
     * Row position paired with the row as a record.
     */
    public List<Pair<Integer, Map<Object, Object>>> iterrows() {
        List<Pair<Integer, Map<Object, Object>>> result = new ArrayList<>(length());
        for (int r = 0; r < length(); r++) {
            result.add(new Pair<>(r, record(r)));
        }
        return result;
    }

    public DataFrame copy() {
        return ofSeries(data, index());
    }

    public DataFrame iloc(int row) {
        return iloc(Slice.of(row, row + 1), Slice.of(0, data.size()));
    }

    public DataFrame iloc(Slice rows) {
        return iloc(rows, Slice.of(0, data.size()));
    }

    public DataFrame iloc(int row, int column) {
        return iloc(Slice.of(row, row + 1), Slice.of(column, column + 1));
    }

    public DataFrame iloc(int row, Slice columns) {
        return iloc(Slice.of(row, row + 1), columns);
    }

    public DataFrame iloc(Slice rows, int column) {
        return iloc(rows, Slice.of(column, column + 1));
    }

    /**
     * Positional selection. Always returns a frame, a single cell included.
     *
     * @param rows    row positions [start, end) within [0, length]
     * @param columns column positions [start, end) within [0, number of columns], end greater than start
     */
    public DataFrame iloc(Slice rows, Slice columns) {
        if (rows.start() < 0 || rows.end() > length() || rows.end() < rows.start()) {
            throw new IndexOutOfBoundsException(
                String.format("Row range %s out of bounds for length %d", rows, length()));
        }
        if (columns.end() <= columns.start()) {
            throw new IllegalArgumentException(
                String.format("Column range %s must end after it starts", columns));
        }
        if (columns.start() < 0 || columns.end() > data.size()) {
            throw new IndexOutOfBoundsException(
                String.format("Column range %s out of bounds for %d columns", columns, data.size()));
        }
        List<Map.Entry<Object, Series>> entries = new ArrayList<>(data.entrySet());
        LinkedHashMap<Object, Series> selected = new LinkedHashMap<>();
        for (int c = columns.start(); c < columns.end(); c++) {
            Map.Entry<Object, Series> entry = entries.get(c);
            selected.put(entry.getKey(), entry.getValue().iloc(rows.start(), rows.end()));
        }
        return new DataFrame(selected, index().slice(rows.start(), rows.end()));
    }

    public DataFrame head() {
        return head(10);
    }

    public DataFrame head(int n) {
        int rows = Math.max(0, Math.min(n, length()));
        return sliceRows(0, rows);
    }

    public DataFrame tail() {
        return tail(10);
    }

    public DataFrame tail(int n) {
        int rows = Math.max(0, Math.min(n, length()));
        return sliceRows(length() - rows, length());
    }

    private DataFrame sliceRows(int start, int end) {
        return mapColumns(series -> series.iloc(start, end), index().slice(start, end));
    }

    private DataFrame mapColumns(Function<Series, Series> func, Index newIndex) {
        LinkedHashMap<Object, Series> mapped = new LinkedHashMap<>();
        for (Map.Entry<Object, Series> entry : data.entrySet()) {
            mapped.put(entry.getKey(), func.apply(entry.getValue()));
        }
        return ofSeries(mapped, newIndex);
    }

    /**
     * Apply a comparison to every cell.
     *
     * @param other scalar, a List, array or Series of length equal to the frame (compared with
     *              each column), or a DataFrame of the same shape (compared column by column)
     */
    public DataFrame where(Object other, BiPredicate<Object, Object> op) {
        if (other instanceof DataFrame) {
            DataFrame frame = (DataFrame) other;
            if (!frame.shape().equals(shape())) {
                throw new ShapeMismatchException(
                    String.format("DataFrame of shape %s does not match shape %s", frame.shape(), shape()));
            }
            List<Series> others = new ArrayList<>(frame.data.values());
            LinkedHashMap<Object, Series> compared = new LinkedHashMap<>();
            int c = 0;
            for (Map.Entry<Object, Series> entry : data.entrySet()) {
                compared.put(entry.getKey(), entry.getValue().where(others.get(c++), op));
            }
            return ofSeries(compared, index());
        }
        if (Series.isSequence(other)) {
            int size = other instanceof Series
                ? ((Series) other).length()
                : other instanceof List ? ((List<?>) other).size() : ((Object[]) other).length;
            if (size != length()) {
                throw new ShapeMismatchException(
                    String.format("Operand of length %d does not match frame of length %d", size, length()));
            }
        }
        return mapColumns(series -> series.where(other, op), index());
    }

    public DataFrame eq(Object other) {
        return where(other, Values::equal);
    }

    public DataFrame gt(Object other) {
        return where(other, Values::greaterThan);
    }

    public DataFrame gte(Object other) {
        return where(other, Values::greaterThanOrEqual);
    }

    public DataFrame lt(Object other) {
        return where(other, Values::lessThan);
    }

    public DataFrame lte(Object other) {
        return where(other, Values::lessThanOrEqual);
    }

    /**
     * Keep the rows whose mask entry is true.
     *
     * @param mask Series, List or array of booleans, one per row
     */
    public DataFrame filter(Object mask) {
        if (!Series.isSequence(mask)) {
            throw new InvalidTypeException("filter mask must be a Series, List or Array");
        }
        Series flags = Series.from(mask, "", null);
        if (flags.length() != length()) {
            throw new ShapeMismatchException(
                String.format("Mask of length %d does not match frame of length %d", flags.length(), length()));
        }
        List<Integer> positions = new ArrayList<>();
        for (int r = 0; r < flags.length(); r++) {
            if (Boolean.TRUE.equals(flags.iloc(r))) {
                positions.add(r);
            }
        }
        List<Object> labels = new ArrayList<>(positions.size());
        for (Integer position : positions) {
            labels.add(index().get(position));
        }
        return mapColumns(series -> series.take(positions), new Index(labels));
    }

    public Series sum() {
        return sum(0);
    }

    public Series sum(int axis) {
        return reduce(axis, Series::sum, row -> {
            double total = 0;
            for (double value : row) {
                total += value;
            }
            return total;
        });
    }

    public Series mean() {
        return mean(0);
    }

    public Series mean(int axis) {
        return reduce(axis, Series::mean, DataFrame::rowMean);
    }

    public Series variance() {
        return variance(0);
    }

    public Series variance(int axis) {
        return reduce(axis, Series::variance, DataFrame::rowVariance);
    }

    public Series std() {
        return std(0);
    }

    public Series std(int axis) {
        return reduce(axis, Series::std, row -> Math.sqrt(rowVariance(row)));
    }

    private static double rowMean(double[] row) {
        double mean = 0;
        for (double value : row) {
            mean += value / row.length;
        }
        return mean;
    }

    private static double rowVariance(double[] row) {
        double mean = rowMean(row);
        double variance = 0;
        for (double value : row) {
            variance += (value - mean) * (value - mean) / (row.length - 1);
        }
        return variance;
    }

    /**
     * Axis 0 reduces each column into a series indexed by column names, axis 1 reduces each row
     * into a series indexed by the row labels.
     */
    private Series reduce(int axis, ToDoubleFunction<Series> byColumn, ToDoubleFunction<double[]> byRow) {
        validateAxis(axis);
        List<Object> result = new ArrayList<>();
        if (axis == 0) {
            for (Series series : data.values()) {
                result.add(byColumn.applyAsDouble(series));
            }
            return new Series(result, "", columns());
        }
        for (List<Object> row : values()) {
            result.add(byRow.applyAsDouble(Series.trusted(new ArrayList<>(row), "", Index.range(row.size())).present()));
        }
        return new Series(result, "", index());
    }

    private static void validateAxis(int axis) {
        if (axis != 0 && axis != 1) {
            throw new InvalidAxisException(String.format("Invalid axis %d, must be 0 or 1", axis));
        }
    }

    public DataFrame cov() {
        return pairwise(Series::cov, false);
    }

    public DataFrame corr() {
        return pairwise(Series::corr, true);
    }

    private DataFrame pairwise(PairwiseStatistic statistic, boolean unitDiagonal) {
        List<Series> columns = new ArrayList<>(data.values());
        int n = columns.size();
        Object[][] matrix = new Object[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double value = i == j && unitDiagonal ? 1.0 : statistic.compute(columns.get(i), columns.get(j));
                matrix[i][j] = value;
                matrix[j][i] = value;
            }
        }
        List<List<Object>> result = new ArrayList<>(n);
        for (Object[] row : matrix) {
            result.add(Arrays.asList(row));
        }
        return fromRows(result, columns().values(), columns());
    }

    private interface PairwiseStatistic {
        double compute(Series first, Series second);
    }

    public DataFrame diff(int periods) {
        return diff(periods, 0);
    }

    public DataFrame diff(int periods, int axis) {
        return lagged(periods, axis, Series::diff, Values::sub);
    }

    public DataFrame pctChange(int periods) {
        return pctChange(periods, 0);
    }

    public DataFrame pctChange(int periods, int axis) {
        return lagged(periods, axis, Series::pctChange,
            (current, previous) -> Values.sub(Values.div(current, previous), 1L));
    }

    private DataFrame lagged(int periods, int axis, LaggedColumn byColumn,
                             BinaryOperator<Object> byCell) {
        validateAxis(axis);
        if (periods <= 0) {
            throw new IllegalArgumentException("periods must be positive");
        }
        if (axis == 0) {
            return mapColumns(series -> byColumn.apply(series, periods), index());
        }
        List<Series> columns = new ArrayList<>(data.values());
        LinkedHashMap<Object, Series> result = new LinkedHashMap<>();
        int c = 0;
        for (Map.Entry<Object, Series> entry : data.entrySet()) {
            List<Object> values = new ArrayList<>(length());
            for (int r = 0; r < length(); r++) {
                values.add(c < periods ? null : byCell.apply(entry.getValue().iloc(r), columns.get(c - periods).iloc(r)));
            }
            result.put(entry.getKey(), Series.trusted(values, entry.getKey(), index()));
            c++;
        }
        return new DataFrame(result, index());
    }

    private interface LaggedColumn {
        Series apply(Series series, int periods);
    }

    public DataFrame cumsum() {
        return cumulative(Cumulative.SUM, 0);
    }

    public DataFrame cumsum(int axis) {
        return cumulative(Cumulative.SUM, axis);
    }

    public DataFrame cummul() {
        return cumulative(Cumulative.MUL, 0);
    }

    public DataFrame cummul(int axis) {
        return cumulative(Cumulative.MUL, axis);
    }

    public DataFrame cummax() {
        return cumulative(Cumulative.MAX, 0);
    }

    public DataFrame cummax(int axis) {
        return cumulative(Cumulative.MAX, axis);
    }

    public DataFrame cummin() {
        return cumulative(Cumulative.MIN, 0);
    }

    public DataFrame cummin(int axis) {
        return cumulative(Cumulative.MIN, axis);
    }

    public DataFrame cumulative(Cumulative kind, int axis) {
        validateAxis(axis);
        if (axis == 0) {
            return mapColumns(series -> series.cumulative(kind), index());
        }
        List<List<Object>> scanned = new ArrayList<>(length());
        for (List<Object> row : values()) {
            scanned.add(kind.apply(row));
        }
        return fromRows(scanned, columns().values(), index());
    }

    public DataFrame merge(DataFrame other) {
        return merge(other, null, MergeHow.INNER);
    }

    public DataFrame merge(DataFrame other, List<?> on) {
        return merge(other, on, MergeHow.INNER);
    }

    public DataFrame merge(DataFrame other, List<?> on, String how) {
        return Merge.mergeDataFrame(this, other, on, how);
    }

    public DataFrame merge(DataFrame other, List<?> on, MergeHow how) {
        return Merge.mergeDataFrame(this, other, on, how);
    }

    /**
     * Reshape by column values. Rows are the sorted distinct values of {@code indexColumn}, columns
     * the sorted distinct values of {@code columnsColumn}; absent combinations are null.
     */
    public DataFrame pivot(Object indexColumn, Object columnsColumn, Object valuesColumn) {
        Series indexValues = get(indexColumn);
        Series columnValues = get(columnsColumn);
        Series cellValues = get(valuesColumn);

        Map<Object, Map<Object, Object>> cells = new LinkedHashMap<>();
        List<Object> pivotColumns = new ArrayList<>();
        for (int r = 0; r < length(); r++) {
            Object rowKey = indexValues.iloc(r);
            Object columnKey = columnValues.iloc(r);
            Map<Object, Object> row = cells.computeIfAbsent(Series.uniqueKey(rowKey), key -> new LinkedHashMap<>());
            if (row.containsKey(Series.uniqueKey(columnKey))) {
                throw new TabulaException("pivot index and column must be unique");
            }
            row.put(Series.uniqueKey(columnKey), cellValues.iloc(r));
            if (!containsLabel(pivotColumns, columnKey)) {
                pivotColumns.add(columnKey);
            }
        }

        List<Object> pivotIndex = indexValues.unique();
        pivotIndex.sort(Values::compare);
        pivotColumns.sort(Values::compare);

        LinkedHashMap<Object, List<Object>> result = new LinkedHashMap<>();
        for (Object column : pivotColumns) {
            List<Object> values = new ArrayList<>(pivotIndex.size());
            for (Object label : pivotIndex) {
                values.add(cells.get(Series.uniqueKey(label)).get(Series.uniqueKey(column)));
            }
            result.put(column, values);
        }
        LOG.debug("Pivoted {} rows into {}x{}", length(), pivotIndex.size(), pivotColumns.size());
        return build(result, new Index(pivotIndex));
    }

    private static boolean containsLabel(List<Object> labels, Object label) {
        for (Object existing : labels) {
            if (Values.equal(existing, label)) {
                return true;
            }
        }
        return false;
    }

    public DataFrame pivotTable(Object indexColumn, Object columnsColumn, Object valuesColumn, String aggfunc) {
        throw new NotImplementedException("pivotTable is not implemented");
    }

    /**
     * CSV text: every header and cell is followed by a comma, lines end with CRLF.
     */
    public String toCsv() {
        StringBuilder sb = new StringBuilder();
        for (Object column : data.keySet()) {
            sb.append(column).append(',');
        }
        sb.append("\r\n");
        for (List<Object> row : values()) {
            for (Object value : row) {
                sb.append(String.valueOf(value)).append(',');
            }
            sb.append("\r\n");
        }
        return sb.toString();
    }

    public void toExcel(String path) {
        throw new NotImplementedException("toExcel is not implemented");
    }

    public Object toJson() {
        return toJson("columns");
    }

    /**
     * Plain nested representation of the frame.
     *
     * @param orient records, split, index, values or columns
     */
    public Object toJson(String orient) {
        if (!ORIENTS.contains(orient)) {
            throw new InvalidTypeException(String.format("orient must be in %s", ORIENTS));
        }
        switch (orient) {
            case "records": {
                List<Map<Object, Object>> records = new ArrayList<>(length());
                for (Map<Object, Object> record : this) {
                    records.add(record);
                }
                return records;
            }
            case "split": {
                Map<String, Object> split = new LinkedHashMap<>();
                split.put("columns", new ArrayList<>(columns().values()));
                split.put("index", new ArrayList<>(index().values()));
                split.put("data", copyRows());
                return split;
            }
            case "index": {
                Map<Object, Object> byLabel = new LinkedHashMap<>();
                for (int r = 0; r < length(); r++) {
                    byLabel.put(index().get(r), record(r));
                }
                return byLabel;
            }
            case "values":
                return copyRows();
            default: {
                Map<Object, Object> byColumn = new LinkedHashMap<>();
                for (Map.Entry<Object, Series> entry : data.entrySet()) {
                    byColumn.put(entry.getKey(), entry.getValue().toJson("index"));
                }
                return byColumn;
            }
        }
    }

    private List<List<Object>> copyRows() {
        List<List<Object>> copy = new ArrayList<>(length());
        for (List<Object> row : values()) {
            copy.add(new ArrayList<>(row));
        }
        return copy;
    }

    /**
     * New frame with the mapped columns renamed, other columns untouched.
     */
    public DataFrame rename(Map<?, ?> columns) {
        LinkedHashMap<Object, Series> renamed = new LinkedHashMap<>();
        Map<Object, Object> mapping = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : columns.entrySet()) {
            mapping.put(Values.normalize(entry.getKey()), Values.normalize(entry.getValue()));
        }
        for (Map.Entry<Object, Series> entry : data.entrySet()) {
            Object name = mapping.containsKey(entry.getKey()) ? mapping.get(entry.getKey()) : entry.getKey();
            if (renamed.containsKey(name)) {
                throw new ShapeMismatchException(String.format("Column names must be unique, %s repeats", name));
            }
            renamed.put(name, entry.getValue());
        }
        return ofSeries(renamed, index());
    }

    /**
     * Swap rows and columns: row labels become column names.
     */
    public DataFrame transpose() {
        List<List<Object>> transposed = new ArrayList<>(data.size());
        for (Series series : data.values()) {
            transposed.add(new ArrayList<>(series.values()));
        }
        return fromRows(transposed, index().values(), columns());
    }

    public DataFrame append(DataFrame other) {
        return append(other, false);
    }

    public DataFrame append(DataFrame other, boolean ignoreIndex) {
        return Concat.concat(Arrays.asList(this, other), ignoreIndex, 0);
    }

    /**
     * New frame with the column added at the end or replaced in place.
     *
     * @param column column name
     * @param values Series, List or array with one value per row
     */
    public DataFrame set(Object column, Object values) {
        if (!Series.isSequence(values)) {
            throw new InvalidTypeException("values must be a Series, List or Array");
        }
        Series series = Series.from(values, column, null);
        if (!data.isEmpty() && series.length() != length()) {
            throw new IndexMismatchException(
                String.format("Column of length %d does not match frame of length %d", series.length(), length()));
        }
        LinkedHashMap<Object, Series> updated = new LinkedHashMap<>(data);
        updated.put(Values.normalize(column), series);
        return ofSeries(updated, data.isEmpty() ? series.index() : index());
    }

    /**
     * Move the row labels into a leading column and number the rows from 0.
     *
     * @param drop discard the labels instead of keeping them as a column
     */
    public DataFrame resetIndex(boolean drop) {
        Index range = Index.range(length());
        LinkedHashMap<Object, Series> result = new LinkedHashMap<>();
        if (!drop) {
            Object name = "index";
            int level = 0;
            while (data.containsKey(name)) {
                name = "level_" + level++;
            }
            result.put(name, new Series(index().values(), name, range));
        }
        result.putAll(data);
        return ofSeries(result, range);
    }

    @Override
    public String toString() {
        int maxRows = TabulaConfig.global().displayMaxRows();
        StringBuilder sb = new StringBuilder();
        for (Object column : data.keySet()) {
            sb.append('\t').append(column);
        }
        sb.append('\n');
        int shown = Math.min(maxRows, length());
        List<List<Object>> values = values();
        for (int r = 0; r < shown; r++) {
            sb.append(index().get(r));
            for (Object value : values.get(r)) {
                sb.append('\t').append(value);
            }
            sb.append('\n');
        }
        if (shown < length()) {
            sb.append("...\n");
        }
        sb.append(String.format("[%d rows x %d columns]", length(), data.size()));
        return sb.toString();
    }
}
