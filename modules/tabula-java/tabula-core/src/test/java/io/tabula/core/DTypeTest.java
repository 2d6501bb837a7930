/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import io.tabula.errors.InvalidTypeException;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;

class DTypeTest {

    @Test
    public void testElementToDType() {
        assertThat("String should be object", DType.elementToDType("hi"), Matchers.equalTo(DType.OBJECT));
        assertThat("Long should be int", DType.elementToDType(1L), Matchers.equalTo(DType.INT));
        assertThat("Integer should be int", DType.elementToDType(1), Matchers.equalTo(DType.INT));
        assertThat("Double should be float", DType.elementToDType(1.5), Matchers.equalTo(DType.FLOAT));
        assertThat("Boolean should be bool", DType.elementToDType(true), Matchers.equalTo(DType.BOOL));
        assertThat("Date should be datetime", DType.elementToDType(LocalDate.of(2017, 1, 1)), Matchers.equalTo(DType.DATETIME));
        assertThat("List should be object", DType.elementToDType(Collections.emptyList()), Matchers.equalTo(DType.OBJECT));
        assertThat("null should be object", DType.elementToDType(null), Matchers.equalTo(DType.OBJECT));
    }

    @Test
    public void testArrayToDType() {
        assertThat("All ints", DType.arrayToDType(Arrays.asList(1, 2, 3)), Matchers.equalTo(DType.INT));
        assertThat("Float after ints", DType.arrayToDType(Arrays.asList(5, 3, 5, 1.5)), Matchers.equalTo(DType.FLOAT));
        assertThat("Ints after float", DType.arrayToDType(Arrays.asList(1.5, 2, 3)), Matchers.equalTo(DType.FLOAT));
        assertThat("String at the end", DType.arrayToDType(Arrays.asList(1, 2, "hi")), Matchers.equalTo(DType.OBJECT));
        assertThat("String at the start", DType.arrayToDType(Arrays.asList("hi", 1, 2)), Matchers.equalTo(DType.OBJECT));
        assertThat("Bool stops the scan", DType.arrayToDType(Arrays.asList(true, 1, 2)), Matchers.equalTo(DType.BOOL));
        assertThat("Empty is object", DType.arrayToDType(Collections.emptyList()), Matchers.equalTo(DType.OBJECT));
    }

    @Test
    public void testOf() {
        assertThat("Wrong dtype", DType.of("float"), Matchers.equalTo(DType.FLOAT));
        assertThat("Wrong dtype", DType.of("INT"), Matchers.equalTo(DType.INT));
        assertThat("Wrong rendering", DType.INT.toString(), Matchers.equalTo("dtype(int)"));
        Assertions.assertThrows(InvalidTypeException.class, () -> DType.of("complex"));
    }
}
