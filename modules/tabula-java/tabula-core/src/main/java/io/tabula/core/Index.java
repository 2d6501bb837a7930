/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import io.tabula.errors.IndexMismatchException;
import io.tabula.errors.InvalidTypeException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered sequence of row or column labels.
 */
public final class Index implements Iterable<Object> {

    private static final Index EMPTY = new Index(Collections.emptyList(), false);

    private final List<Object> labels;

    public Index(List<?> labels) {
        this(Values.normalizeAll(labels), false);
    }

    public Index(Object[] labels) {
        this(Arrays.asList(labels));
    }

    private Index(List<Object> labels, boolean copy) {
        this.labels = Collections.unmodifiableList(copy ? new ArrayList<>(labels) : labels);
    }

    /**
     * Build an Index from a list, an array or an existing Index.
     *
     * @param labels candidate labels
     * @return index over the labels
     */
    public static Index of(Object labels) {
        if (labels instanceof Index) {
            return (Index) labels;
        } else if (labels instanceof List) {
            return new Index((List<?>) labels);
        } else if (labels instanceof Object[]) {
            return new Index((Object[]) labels);
        }
        throw new InvalidTypeException("Index values must be List or Array");
    }

    public static Index range(int size) {
        if (size == 0) {
            return EMPTY;
        }
        List<Object> labels = new ArrayList<>(size);
        for (long i = 0; i < size; i++) {
            labels.add(i);
        }
        return new Index(labels, false);
    }

    public static Index empty() {
        return EMPTY;
    }

    /**
     * Resolve the index for a sequence of values: a missing index becomes 0..n-1, a provided one
     * must have the same length.
     */
    static Index parse(Object index, int valuesSize) {
        if (index == null) {
            return range(valuesSize);
        }
        Index parsed = index instanceof Index || index instanceof List || index instanceof Object[]
            ? of(index)
            : new Index(Collections.singletonList(index));
        if (parsed.size() != valuesSize) {
            throw new IndexMismatchException(
                String.format("Index of length %d does not match data of length %d", parsed.size(), valuesSize));
        }
        return parsed;
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public Object get(int position) {
        return labels.get(position);
    }

    public List<Object> values() {
        return labels;
    }

    public int indexOf(Object label) {
        Object normalized = Values.normalize(label);
        for (int i = 0; i < labels.size(); i++) {
            if (Values.equal(labels.get(i), normalized)) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(Object label) {
        return indexOf(label) >= 0;
    }

    /**
     * Labels in [start, end), clamped to the index bounds.
     */
    public Index slice(int start, int end) {
        int from = Math.max(0, Math.min(start, labels.size()));
        int to = Math.max(from, Math.min(end, labels.size()));
        return new Index(labels.subList(from, to), true);
    }

    public Index concat(Index other) {
        List<Object> joined = new ArrayList<>(labels.size() + other.size());
        joined.addAll(labels);
        joined.addAll(other.labels);
        return new Index(joined, false);
    }

    @Override
    public Iterator<Object> iterator() {
        return labels.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Index other = (Index) o;
        if (labels.size() != other.labels.size()) {
            return false;
        }
        for (int i = 0; i < labels.size(); i++) {
            if (!Values.equal(labels.get(i), other.labels.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (Object label : labels) {
            // adding 0.0 folds -0.0 into 0.0, which equals treats as the same label
            int h = label instanceof Number ? Double.hashCode(((Number) label).doubleValue() + 0.0) : Objects.hashCode(label);
            hash = 31 * hash + h;
        }
        return hash;
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
