/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import io.tabula.errors.InvalidTypeException;
import io.tabula.errors.KeyException;
import io.tabula.errors.NotImplementedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hierarchical labels: an ordered map from key to a nested MultiIndex or, at the bottom, an Index.
 */
public final class MultiIndex {

    private final Map<Object, Object> levels;

    /**
     * @param levels ordered map whose values are Index, List, Map or MultiIndex
     */
    public MultiIndex(Map<?, ?> levels) {
        Map<Object, Object> parsed = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : levels.entrySet()) {
            parsed.put(Values.normalize(entry.getKey()), parseLevel(entry.getKey(), entry.getValue()));
        }
        this.levels = Collections.unmodifiableMap(parsed);
    }

    /**
     * Building a MultiIndex from label tuples is not supported.
     */
    public static MultiIndex fromArrays(List<? extends List<?>> arrays) {
        throw new NotImplementedException("MultiIndex from arrays is not implemented");
    }

    private static Object parseLevel(Object key, Object level) {
        if (level instanceof Index || level instanceof MultiIndex) {
            return level;
        } else if (level instanceof List) {
            return new Index((List<?>) level);
        } else if (level instanceof Map) {
            return new MultiIndex((Map<?, ?>) level);
        }
        throw new InvalidTypeException(
            String.format("MultiIndex level %s must be Index, List, Map or MultiIndex", key));
    }

    /**
     * @return the nested MultiIndex or Index stored under the key
     */
    public Object get(Object key) {
        Object normalized = Values.normalize(key);
        if (!levels.containsKey(normalized)) {
            throw new KeyException(String.format("KeyError: %s not found", key));
        }
        return levels.get(normalized);
    }

    public Object getIn(List<?> keys) {
        Object level = this;
        for (Object key : keys) {
            if (!(level instanceof MultiIndex)) {
                throw new KeyException(String.format("KeyError: %s is below the last level", key));
            }
            level = ((MultiIndex) level).get(key);
        }
        return level;
    }

    public List<Object> keys() {
        return new ArrayList<>(levels.keySet());
    }

    /**
     * Plain nested structure: maps down to the leaf label lists.
     */
    public Map<Object, Object> values() {
        Map<Object, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : levels.entrySet()) {
            Object level = entry.getValue();
            plain.put(entry.getKey(), level instanceof MultiIndex
                ? ((MultiIndex) level).values()
                : ((Index) level).values());
        }
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return levels.equals(((MultiIndex) o).levels);
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    @Override
    public String toString() {
        return values().toString();
    }
}
