/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Running aggregates for cumsum, cummul, cummax and cummin.
 */
public enum Cumulative {

    SUM(0L) {
        @Override
        Object combine(Object running, Object value) {
            return Values.add(running, value);
        }
    },
    MUL(1L) {
        @Override
        Object combine(Object running, Object value) {
            return Values.mul(running, value);
        }
    },
    MAX(Double.NEGATIVE_INFINITY) {
        @Override
        Object combine(Object running, Object value) {
            return Values.greaterThan(value, running) ? value : running;
        }
    },
    MIN(Double.POSITIVE_INFINITY) {
        @Override
        Object combine(Object running, Object value) {
            return Values.lessThan(value, running) ? value : running;
        }
    };

    private final Object seed;

    Cumulative(Object seed) {
        this.seed = seed;
    }

    abstract Object combine(Object running, Object value);

    /**
     * Single left-to-right scan. Missing values stay missing and do not reset the aggregate.
     */
    public List<Object> apply(List<?> values) {
        List<Object> result = new ArrayList<>(values.size());
        Object running = seed;
        for (Object value : values) {
            if (Values.isMissing(value)) {
                result.add(value);
                continue;
            }
            running = combine(running, value);
            result.add(running);
        }
        return result;
    }
}
