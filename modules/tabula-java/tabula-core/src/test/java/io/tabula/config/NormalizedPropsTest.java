/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.config;

import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static io.tabula.TabulaPropertyNames.TABULA__DISPLAY__MAX_ROWS;
import static io.tabula.TabulaPropertyNames.TABULA__MERGE__LEFT_SUFFIX;
import static org.hamcrest.MatcherAssert.assertThat;

class NormalizedPropsTest {

    @Test
    public void testNormalization() {
        Map<String, String> props = new HashMap<>(3);
        props.put("TABULA__DISPLAY__MAX_ROWS", " 25 ");
        props.put("TABULA__MERGE__LEFT_SUFFIX", "_l");
        props.put("SOME_VAR", "FALSE");
        NormalizedProps normalized = new NormalizedProps(props);

        assertThat("Tabula property should be normalized", normalized.getValue(TABULA__DISPLAY__MAX_ROWS).isPresent(), Matchers.equalTo(true));
        assertThat("Tabula property should be normalized", normalized.getValue(TABULA__MERGE__LEFT_SUFFIX).isPresent(), Matchers.equalTo(true));
        assertThat("Non-Tabula property should not be normalized", normalized.getValue("SOME_VAR").isPresent(), Matchers.equalTo(true));

        assertThat("Tabula property value should be trimmed", normalized.getValue(TABULA__DISPLAY__MAX_ROWS).get(), Matchers.equalTo("25"));
        assertThat("Tabula property should be normalized", normalized.getValue(TABULA__MERGE__LEFT_SUFFIX).get(), Matchers.equalTo("_l"));
        assertThat("Non-Tabula property should not be normalized", normalized.getValue("SOME_VAR").get(), Matchers.equalTo("FALSE"));
    }
}
