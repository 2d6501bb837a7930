/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.reshape;

import io.tabula.TabulaPropertyNames;
import io.tabula.config.SimpleProps;
import io.tabula.config.TabulaConfig;
import io.tabula.core.DataFrame;
import io.tabula.errors.KeyException;
import io.tabula.errors.MergeException;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;

class MergeTest {

    private static Map<Object, Object> record(Object... keyValues) {
        Map<Object, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put(keyValues[i], keyValues[i + 1]);
        }
        return record;
    }

    private static DataFrame left() {
        return DataFrame.fromRecords(Arrays.asList(
            record("x", 1, "y", 2),
            record("x", 2, "y", 3),
            record("x", 3, "y", 4),
            record("x", 4, "y", 10)));
    }

    private static List<Map<Object, Object>> rightRecords() {
        return new ArrayList<>(Arrays.asList(
            record("x", 2, "z", 6),
            record("x", 1, "z", 1),
            record("x", 3, "z", 100)));
    }

    @Test
    public void testInnerMerge() {
        DataFrame merged = Merge.mergeDataFrame(left(), DataFrame.fromRecords(rightRecords()), Arrays.asList("x"), "inner");
        assertThat("Wrong columns", merged.columns().values(), Matchers.equalTo(Arrays.<Object>asList("x", "y", "z")));
        assertThat("Wrong keys", merged.get("x").values(), Matchers.equalTo(Arrays.<Object>asList(1L, 2L, 3L)));
        assertThat("Wrong left values", merged.get("y").values(), Matchers.equalTo(Arrays.<Object>asList(2L, 3L, 4L)));
        assertThat("Wrong right values", merged.get("z").values(), Matchers.equalTo(Arrays.<Object>asList(1L, 6L, 100L)));
    }

    @Test
    public void testOuterMerge() {
        List<Map<Object, Object>> records = rightRecords();
        records.add(record("x", 5, "z", 200));
        DataFrame merged = left().merge(DataFrame.fromRecords(records), Arrays.asList("x"), MergeHow.OUTER);
        assertThat("Wrong length", merged.length(), Matchers.equalTo(5));
        assertThat("Wrong keys", merged.get("x").values(), Matchers.equalTo(Arrays.<Object>asList(1L, 2L, 3L, 4L, 5L)));
        assertThat("Wrong left values", merged.get("y").values(), Matchers.equalTo(Arrays.<Object>asList(2L, 3L, 4L, 10L, null)));
        assertThat("Wrong right values", merged.get("z").values(), Matchers.equalTo(Arrays.<Object>asList(1L, 6L, 100L, null, 200L)));
    }

    @Test
    public void testDefaultKeysAndSuffixes() {
        DataFrame df1 = DataFrame.fromRecords(Arrays.asList(record("k", 1, "v", "a")));
        DataFrame df2 = DataFrame.fromRecords(Arrays.asList(record("k", 1, "v", "b")));
        DataFrame onKey = df1.merge(df2, Arrays.asList("k"));
        assertThat("Colliding columns get suffixes", onKey.columns().values(), Matchers.equalTo(Arrays.<Object>asList("k", "v_x", "v_y")));

        DataFrame onAll = df1.merge(df2);
        assertThat("Common columns are the keys", onAll.length(), Matchers.equalTo(0));

        Map<String, String> props = new HashMap<>();
        props.put(TabulaPropertyNames.TABULA__MERGE__LEFT_SUFFIX, "_left");
        props.put(TabulaPropertyNames.TABULA__MERGE__RIGHT_SUFFIX, "_right");
        DataFrame configured = new Merge(new TabulaConfig(new SimpleProps(props))).merge(df1, df2, Arrays.asList("k"), MergeHow.INNER);
        assertThat("Suffixes should be configurable", configured.columns().values(), Matchers.equalTo(Arrays.<Object>asList("k", "v_left", "v_right")));
    }

    @Test
    public void testErrors() {
        DataFrame df1 = left();
        DataFrame df2 = DataFrame.fromRecords(Arrays.asList(record("w", 1)));
        MergeException noKeys = Assertions.assertThrows(MergeException.class, () -> Merge.mergeDataFrame(df1, df2, null, MergeHow.INNER));
        assertThat("Wrong message", noKeys.getMessage(), Matchers.equalTo("No common keys"));
        Assertions.assertThrows(KeyException.class, () -> Merge.mergeDataFrame(df1, df2, Arrays.asList("x"), MergeHow.INNER));
        MergeException how = Assertions.assertThrows(MergeException.class, () -> Merge.mergeDataFrame(df1, df1, null, "left"));
        assertThat("Wrong message", how.getMessage(), Matchers.equalTo("MergeError: left not a supported merge type"));
    }
}
