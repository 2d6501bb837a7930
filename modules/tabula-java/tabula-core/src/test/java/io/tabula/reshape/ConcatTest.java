/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.reshape;

import io.tabula.core.DataFrame;
import io.tabula.core.Index;
import io.tabula.core.Series;
import io.tabula.errors.IndexMismatchException;
import io.tabula.errors.InvalidTypeException;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;

class ConcatTest {

    private static DataFrame frame(Object... columnsAndValues) {
        Map<Object, Object> columns = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            columns.put(columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return DataFrame.fromColumns(columns);
    }

    @Test
    public void testConcatSeries() {
        Series series = Concat.concat(Arrays.asList(Series.of(1, 2), Series.of(3)));
        assertThat("Wrong values", series.values(), Matchers.equalTo(Arrays.<Object>asList(1L, 2L, 3L)));
        assertThat("Labels should be kept", series.index().values(), Matchers.equalTo(Arrays.<Object>asList(0L, 1L, 0L)));

        Series renumbered = Concat.concat(Arrays.asList(Series.of(1, 2), Series.of(3)), true);
        assertThat("Labels should be renumbered", renumbered.index(), Matchers.equalTo(Index.range(3)));
    }

    @Test
    public void testConcatRowsWithPadding() {
        DataFrame first = frame("x", Arrays.asList(1, 2), "y", Arrays.asList(3, 4));
        DataFrame second = frame("x", Arrays.asList(5), "z", Arrays.asList(6));
        DataFrame result = Concat.concat(Arrays.asList(first, second), true, 0);

        assertThat("Wrong columns", result.columns().values(), Matchers.equalTo(Arrays.<Object>asList("x", "y", "z")));
        assertThat("Wrong length", result.length(), Matchers.equalTo(3));
        assertThat("Wrong stacked column", result.get("x").values(), Matchers.equalTo(Arrays.<Object>asList(1L, 2L, 5L)));

        List<Object> y = result.get("y").values();
        assertThat("Existing values kept", y.subList(0, 2), Matchers.equalTo(Arrays.<Object>asList(3L, 4L)));
        assertThat("Missing rows padded with NaN", ((Double) y.get(2)).isNaN(), Matchers.equalTo(true));

        List<Object> z = result.get("z").values();
        assertThat("New column padded for prior rows", ((Double) z.get(0)).isNaN() && ((Double) z.get(1)).isNaN(), Matchers.equalTo(true));
        assertThat("New column value", z.get(2), Matchers.equalTo(6L));
    }

    @Test
    public void testConcatColumns() {
        DataFrame first = frame("x", Arrays.asList(1, 2));
        DataFrame second = frame("x", Arrays.asList(3, 4), "y", Arrays.asList(5, 6));
        DataFrame result = Concat.concat(Arrays.asList(first, second), false, 1);
        assertThat("Repeated name gets a suffix", result.columns().values(), Matchers.equalTo(Arrays.<Object>asList("x", "x.x", "y")));
        assertThat("Suffixed column values", result.get("x.x").values(), Matchers.equalTo(Arrays.<Object>asList(3L, 4L)));
        assertThat("Suffixed series is renamed", result.get("x.x").name(), Matchers.equalTo("x.x"));

        DataFrame longer = frame("w", Arrays.asList(1, 2, 3));
        Assertions.assertThrows(IndexMismatchException.class, () -> Concat.concat(Arrays.asList(first, longer), false, 1));
    }

    @Test
    public void testSingleAndInvalid() {
        DataFrame only = frame("x", Arrays.asList(1));
        DataFrame result = Concat.concat(Collections.singletonList(only));
        assertThat("Single frame is copied", result, Matchers.not(Matchers.sameInstance(only)));
        assertThat("Copy keeps the values", result.values(), Matchers.equalTo(only.values()));
        result.get("x").setName("renamed");
        assertThat("Input column is untouched", only.get("x").name(), Matchers.equalTo("x"));
        Assertions.assertThrows(InvalidTypeException.class, () -> Concat.concat(Arrays.asList(only, Series.of(1))));
        Assertions.assertThrows(InvalidTypeException.class, () -> Concat.concat(Collections.emptyList()));
        Assertions.assertThrows(InvalidTypeException.class, () -> Concat.concat(Arrays.asList("a", "b")));
    }
}
