/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import io.tabula.TabulaLog;
import io.tabula.config.TabulaConfig;
import io.tabula.errors.IndexMismatchException;
import io.tabula.errors.InvalidTypeException;
import io.tabula.errors.ShapeMismatchException;
import io.tabula.errors.UnsupportedConversionException;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * One-dimensional labeled column of values.
 * <p>
 * A Series never changes its values after construction. Every operation returns a new Series,
 * only the name and the index can be reassigned.
 */
public class Series extends NDFrame implements Iterable<Object> {

    private static final TabulaLog LOG = new TabulaLog(LoggerFactory.getLogger(Series.class));

    private static final List<String> ORIENTS = Arrays.asList("records", "split", "index");

    private final List<Object> values;
    private final DType dtype;
    private Object name;

    public Series(List<?> data) {
        this(data, "", null);
    }

    public Series(List<?> data, Object name) {
        this(data, name, null);
    }

    /**
     * @param data  values of the series
     * @param name  series name
     * @param index row labels: an Index, a List, an array, a single label or null for 0..n-1
     */
    public Series(List<?> data, Object name, Object index) {
        this(Values.normalizeAll(data), name, index, true);
    }

    public Series(Object[] data, Object name, Object index) {
        this(Arrays.asList(data), name, index);
    }

    private Series(List<Object> normalized, Object name, Object index, boolean validate) {
        this.values = Collections.unmodifiableList(normalized);
        this.dtype = DType.arrayToDType(normalized);
        this.name = name == null ? "" : name;
        setupAxes(0);
        setAxis(0, validate ? Index.parse(index, normalized.size()) : (Index) index);
    }

    public static Series of(Object... data) {
        return new Series(Arrays.asList(data));
    }

    /**
     * Build a series from a list, an array or a single scalar value.
     */
    public static Series from(Object data, Object name, Object index) {
        if (data instanceof Series) {
            Series series = (Series) data;
            return new Series(series.values, name, index == null ? series.index() : index);
        } else if (data instanceof List) {
            return new Series((List<?>) data, name, index);
        } else if (data instanceof Object[]) {
            return new Series((Object[]) data, name, index);
        }
        return new Series(Collections.singletonList(data), name, index);
    }

    /**
     * Values are already normalized and the index has the right length.
     */
    static Series trusted(List<Object> values, Object name, Index index) {
        return new Series(values, name, index, false);
    }

    public List<Object> values() {
        return values;
    }

    public DType dtype() {
        return dtype;
    }

    public Object name() {
        return name;
    }

    public void setName(Object name) {
        this.name = name == null ? "" : name;
    }

    public Index index() {
        return getAxis(0);
    }

    public void setIndex(Object index) {
        setAxis(0, Index.parse(index, values.size()));
    }

    public int length() {
        return values.size();
    }

    public Object iloc(int position) {
        return values.get(position);
    }

    /**
     * Positions [start, end), clamped to the series bounds.
     */
    public Series iloc(int start, int end) {
        int from = Math.max(0, Math.min(start, values.size()));
        int to = Math.max(from, Math.min(end, values.size()));
        return trusted(new ArrayList<>(values.subList(from, to)), name, index().slice(from, to));
    }

    public Series head() {
        return head(5);
    }

    public Series head(int n) {
        return iloc(0, n);
    }

    public Series tail() {
        return tail(5);
    }

    public Series tail(int n) {
        return iloc(values.size() - Math.max(0, n), values.size());
    }

    public Series copy() {
        return trusted(new ArrayList<>(values), name, index());
    }

    public Series rename(Object newName) {
        return trusted(new ArrayList<>(values), newName, index());
    }

    public Series map(Function<Object, Object> func) {
        return map((value, position) -> func.apply(value));
    }

    public Series map(BiFunction<Object, Integer, Object> func) {
        List<Object> mapped = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            mapped.add(Values.normalize(func.apply(values.get(i), i)));
        }
        return trusted(mapped, name, index());
    }

    public void forEach(BiConsumer<Object, Integer> action) {
        for (int i = 0; i < values.size(); i++) {
            action.accept(values.get(i), i);
        }
    }

    @Override
    public Iterator<Object> iterator() {
        return values.iterator();
    }

    public Series astype(String target) {
        return astype(DType.of(target));
    }

    /**
     * Convert to int (floor) or float.
     *
     * @param target int or float
     * @return this series when it already has the target dtype
     */
    public Series astype(DType target) {
        if (target == dtype) {
            return this;
        }
        if (dtype == DType.OBJECT || dtype == DType.DATETIME) {
            throw new UnsupportedConversionException(
                String.format("Unable to convert %s to %s", dtype, target));
        }
        switch (target) {
            case INT:
                return map(value -> Values.isMissing(value) ? null : (Object) (long) Math.floor(numericOf(value)));
            case FLOAT:
                return map(value -> value == null ? null : (Object) numericOf(value));
            default:
                throw new InvalidTypeException(String.format("Invalid dtype %s", target));
        }
    }

    private static double numericOf(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
        }
        return Values.toDouble(value);
    }

    public Series add(Object other) {
        return combine(other, Values::add);
    }

    public Series sub(Object other) {
        return combine(other, Values::sub);
    }

    public Series mul(Object other) {
        return combine(other, Values::mul);
    }

    public Series multiply(Object other) {
        return mul(other);
    }

    public Series div(Object other) {
        return combine(other, Values::div);
    }

    public Series divide(Object other) {
        return div(other);
    }

    private Series combine(Object other, BiFunction<Object, Object, Object> op) {
        List<Object> result = new ArrayList<>(values.size());
        if (isSequence(other)) {
            List<Object> operand = sequenceOf(other);
            for (int i = 0; i < values.size(); i++) {
                result.add(op.apply(values.get(i), operand.get(i)));
            }
        } else {
            Object scalar = Values.normalize(other);
            for (Object value : values) {
                result.add(op.apply(value, scalar));
            }
        }
        return trusted(result, name, index());
    }

    /**
     * Compare each value with a scalar or, positionally, with a sequence of the same length.
     *
     * @param other  scalar, Series, List or array
     * @param op     comparison
     * @return boolean series, false wherever a value is missing
     */
    public Series where(Object other, BiPredicate<Object, Object> op) {
        List<Object> result = new ArrayList<>(values.size());
        if (isSequence(other)) {
            List<Object> operand = sequenceOf(other);
            for (int i = 0; i < values.size(); i++) {
                result.add(op.test(values.get(i), operand.get(i)));
            }
        } else {
            Object scalar = Values.normalize(other);
            for (Object value : values) {
                result.add(op.test(value, scalar));
            }
        }
        return trusted(result, name, index());
    }

    public Series eq(Object other) {
        return where(other, Values::equal);
    }

    public Series lt(Object other) {
        return where(other, Values::lessThan);
    }

    public Series lte(Object other) {
        return where(other, Values::lessThanOrEqual);
    }

    public Series gt(Object other) {
        return where(other, Values::greaterThan);
    }

    public Series gte(Object other) {
        return where(other, Values::greaterThanOrEqual);
    }

    public Series notnull() {
        return map(value -> !Values.isMissing(value));
    }

    static boolean isSequence(Object other) {
        return other instanceof Series || other instanceof List || other instanceof Object[];
    }

    private List<Object> sequenceOf(Object other) {
        List<Object> operand;
        if (other instanceof Series) {
            operand = ((Series) other).values;
        } else if (other instanceof List) {
            operand = Values.normalizeAll((List<?>) other);
        } else {
            operand = Values.normalizeAll(Arrays.asList((Object[]) other));
        }
        if (operand.size() != values.size()) {
            throw new ShapeMismatchException(
                String.format("Operand of length %d does not match series of length %d", operand.size(), values.size()));
        }
        return operand;
    }

    /**
     * Move values by the given number of positions, filling the vacated slots with null.
     */
    public Series shift(int periods) {
        if (Math.abs(periods) > values.size()) {
            throw new ShapeMismatchException("Periods greater than length of Series");
        }
        List<Object> shifted = new ArrayList<>(values.size());
        if (periods >= 0) {
            shifted.addAll(Collections.nCopies(periods, null));
            shifted.addAll(values.subList(0, values.size() - periods));
        } else {
            shifted.addAll(values.subList(-periods, values.size()));
            shifted.addAll(Collections.nCopies(-periods, null));
        }
        return trusted(shifted, name, index());
    }

    public Series diff() {
        return diff(1);
    }

    public Series diff(int periods) {
        return lagged(periods, (current, previous) -> Values.sub(current, previous));
    }

    public Series pctChange() {
        return pctChange(1);
    }

    public Series pctChange(int periods) {
        return lagged(periods, (current, previous) -> Values.sub(Values.div(current, previous), 1L));
    }

    private Series lagged(int periods, BiFunction<Object, Object, Object> op) {
        if (periods <= 0) {
            throw new IllegalArgumentException("periods must be positive");
        }
        int head = Math.min(periods, values.size());
        List<Object> result = new ArrayList<>(Collections.nCopies(head, null));
        for (int i = head; i < values.size(); i++) {
            result.add(op.apply(values.get(i), values.get(i - periods)));
        }
        return trusted(result, name, index());
    }

    public Series sortValues() {
        return sortValues(true);
    }

    /**
     * Stable sort carrying the labels along. Missing values go last in both directions.
     */
    public Series sortValues(boolean ascending) {
        List<Integer> positions = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            positions.add(i);
        }
        positions.sort((a, b) -> {
            Object x = values.get(a);
            Object y = values.get(b);
            if (Values.isMissing(x) || Values.isMissing(y) || ascending) {
                return Values.compare(x, y);
            }
            return Values.compare(y, x);
        });
        return take(positions);
    }

    Series take(List<Integer> positions) {
        List<Object> taken = new ArrayList<>(positions.size());
        List<Object> labels = new ArrayList<>(positions.size());
        for (Integer position : positions) {
            taken.add(values.get(position));
            labels.add(index().get(position));
        }
        return trusted(taken, name, new Index(labels));
    }

    public Series round() {
        return round(0);
    }

    public Series round(int decimals) {
        return map(value -> Values.round(value, decimals));
    }

    public Series abs() {
        if (dtype != DType.INT && dtype != DType.FLOAT) {
            return copy();
        }
        return map(value -> {
            if (value instanceof Long) {
                return Math.abs((Long) value);
            } else if (value instanceof Number) {
                return Math.abs(((Number) value).doubleValue());
            }
            return value;
        });
    }

    /**
     * Non-missing values as doubles. Reductions skip missing values.
     */
    double[] present() {
        double[] result = new double[values.size()];
        int n = 0;
        for (Object value : values) {
            if (!Values.isMissing(value)) {
                result[n++] = Values.toDouble(value);
            }
        }
        return Arrays.copyOf(result, n);
    }

    public double sum() {
        double total = 0;
        for (double value : present()) {
            total += value;
        }
        return total;
    }

    public double mean() {
        double[] present = present();
        double total = 0;
        for (double value : present) {
            total += value;
        }
        return total / present.length;
    }

    public double median() {
        double[] sorted = present();
        if (sorted.length == 0) {
            return Double.NaN;
        }
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[middle];
        }
        return (sorted[middle - 1] + sorted[middle]) / 2;
    }

    /**
     * Sample variance (divisor n - 1).
     */
    public double variance() {
        double[] present = present();
        double mean = mean();
        double total = 0;
        for (double value : present) {
            double delta = value - mean;
            total += delta * delta;
        }
        return total / (present.length - 1);
    }

    public double std() {
        return Math.sqrt(variance());
    }

    public Object min() {
        return extreme(Cumulative.MIN);
    }

    public Object max() {
        return extreme(Cumulative.MAX);
    }

    private Object extreme(Cumulative kind) {
        Object result = null;
        for (Object value : kind.apply(values)) {
            if (!Values.isMissing(value)) {
                result = value;
            }
        }
        return result;
    }

    /**
     * Sample covariance with another series of the same length, in a single pass over the
     * positions where both values are present.
     */
    public double cov(Series other) {
        if (other.length() != values.size()) {
            throw new ShapeMismatchException("Series must be of same length");
        }
        double meanX = 0;
        double meanY = 0;
        double coMoment = 0;
        int n = 0;
        for (int i = 0; i < values.size(); i++) {
            if (Values.isMissing(values.get(i)) || Values.isMissing(other.values.get(i))) {
                continue;
            }
            double x = Values.toDouble(values.get(i));
            double y = Values.toDouble(other.values.get(i));
            n++;
            double deltaX = x - meanX;
            meanX += deltaX / n;
            meanY += (y - meanY) / n;
            coMoment += deltaX * (y - meanY);
        }
        return coMoment / (n - 1);
    }

    public double corr(Series other) {
        return cov(other) / (std() * other.std());
    }

    /**
     * Distinct values in order of first appearance.
     */
    public List<Object> unique() {
        Set<Object> seen = new HashSet<>();
        List<Object> distinct = new ArrayList<>();
        for (Object value : values) {
            if (seen.add(uniqueKey(value))) {
                distinct.add(value);
            }
        }
        return distinct;
    }

    static Object uniqueKey(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return d == 0 ? 0d : d;
        }
        return value;
    }

    /**
     * Keep the values whose mask entry is true.
     *
     * @param mask Series, List or array of booleans with the same length
     */
    public Series filter(Object mask) {
        if (!isSequence(mask)) {
            throw new InvalidTypeException("filter mask must be a Series, List or Array");
        }
        List<Object> flags = sequenceOf(mask);
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < flags.size(); i++) {
            if (Boolean.TRUE.equals(flags.get(i))) {
                positions.add(i);
            }
        }
        return take(positions);
    }

    public Series cumsum() {
        return cumulative(Cumulative.SUM);
    }

    public Series cummul() {
        return cumulative(Cumulative.MUL);
    }

    public Series cummax() {
        return cumulative(Cumulative.MAX);
    }

    public Series cummin() {
        return cumulative(Cumulative.MIN);
    }

    public Series cumulative(Cumulative kind) {
        return trusted(kind.apply(values), name, index());
    }

    /**
     * Group the values of both series by label.
     *
     * @return for each distinct label, the values carrying it in this series (left) and in the
     * other series (right)
     */
    public Map<Object, Pair<List<Object>, List<Object>>> alignSeries(Series other) {
        Map<Object, Object> labels = new LinkedHashMap<>();
        Map<Object, Pair<List<Object>, List<Object>>> byKey = new HashMap<>();
        for (int i = 0; i < values.size(); i++) {
            bucket(byKey, labels, index().get(i)).left().add(values.get(i));
        }
        for (int i = 0; i < other.length(); i++) {
            bucket(byKey, labels, other.index().get(i)).right().add(other.values.get(i));
        }
        // keyed by the first spelling of each label
        Map<Object, Pair<List<Object>, List<Object>>> aligned = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : labels.entrySet()) {
            aligned.put(entry.getValue(), byKey.get(entry.getKey()));
        }
        return aligned;
    }

    private static Pair<List<Object>, List<Object>> bucket(Map<Object, Pair<List<Object>, List<Object>>> byKey,
                                                           Map<Object, Object> labels, Object label) {
        Object key = uniqueKey(label);
        labels.putIfAbsent(key, label);
        return byKey.computeIfAbsent(key, k -> new Pair<>(new ArrayList<>(), new ArrayList<>()));
    }

    public Object toJson() {
        return toJson("index");
    }

    /**
     * Plain representation of the series.
     *
     * @param orient records (list of values), split (index, name and values) or index (label to value)
     */
    public Object toJson(String orient) {
        if (!ORIENTS.contains(orient)) {
            throw new InvalidTypeException(String.format("orient must be in %s", ORIENTS));
        }
        switch (orient) {
            case "records":
                return new ArrayList<>(values);
            case "split":
                Map<String, Object> split = new LinkedHashMap<>();
                split.put("index", new ArrayList<>(index().values()));
                split.put("name", name);
                split.put("values", new ArrayList<>(values));
                return split;
            default:
                Map<Object, Object> byLabel = new LinkedHashMap<>();
                for (int i = 0; i < values.size(); i++) {
                    byLabel.put(index().get(i), values.get(i));
                }
                return byLabel;
        }
    }

    public Series append(Series other) {
        return append(other, false);
    }

    public Series append(Series other, boolean ignoreIndex) {
        return concat(Arrays.asList(this, other), ignoreIndex);
    }

    /**
     * Join series end to end. The name is kept when all inputs share it.
     */
    public static Series concat(List<Series> series, boolean ignoreIndex) {
        List<Object> joined = new ArrayList<>();
        Index index = Index.empty();
        Object commonName = series.isEmpty() ? "" : series.get(0).name;
        for (Series s : series) {
            joined.addAll(s.values);
            index = index.concat(s.index());
            if (!Objects.equals(s.name, commonName)) {
                commonName = "";
            }
        }
        LOG.debug("Concatenated {} series into {} values", series.size(), joined.size());
        return trusted(joined, commonName, ignoreIndex ? Index.range(joined.size()) : index);
    }

    /**
     * Label aligned copy used by DataFrame, which owns a single index for all of its columns.
     */
    Series withIndex(Index newIndex) {
        if (newIndex.size() != values.size()) {
            throw new IndexMismatchException(
                String.format("Index of length %d does not match data of length %d", newIndex.size(), values.size()));
        }
        return trusted(values, name, newIndex);
    }

    @Override
    public String toString() {
        int maxRows = TabulaConfig.global().displayMaxRows();
        StringBuilder sb = new StringBuilder();
        int rows = Math.min(maxRows, values.size());
        for (int i = 0; i < rows; i++) {
            sb.append(index().get(i)).append('\t').append(values.get(i)).append('\n');
        }
        if (rows < values.size()) {
            sb.append("...\n");
        }
        sb.append(String.format("Name: %s, dtype: %s", name, dtype));
        return sb.toString();
    }
}
