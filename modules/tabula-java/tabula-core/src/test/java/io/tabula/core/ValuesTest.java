/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

import io.tabula.errors.InvalidTypeException;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;

class ValuesTest {

    @Test
    public void testEquality() {
        assertThat("Boxed ints should be equal", Values.equal(1, 1L), Matchers.equalTo(true));
        assertThat("Int and double should compare by value", Values.equal(2L, 2.0), Matchers.equalTo(true));
        assertThat("NaN is never equal", Values.equal(Double.NaN, Double.NaN), Matchers.equalTo(false));
        assertThat("Strings", Values.equal("a", "a"), Matchers.equalTo(true));
    }

    @Test
    public void testComparisonsWithMissing() {
        assertThat("null is not less than anything", Values.lessThan(null, 1L), Matchers.equalTo(false));
        assertThat("null is not greater than anything", Values.greaterThan(null, 1L), Matchers.equalTo(false));
        assertThat("Mixed types do not compare", Values.greaterThan("a", 1L), Matchers.equalTo(false));
        assertThat("Missing values sort last", Values.compare(null, 1L), Matchers.greaterThan(0));
    }

    @Test
    public void testArithmetic() {
        assertThat("Long sum stays long", Values.add(1L, 2), Matchers.equalTo(3L));
        assertThat("Mixed sum is double", Values.add(1L, 0.5), Matchers.equalTo(1.5));
        assertThat("String concatenation", Values.add("a", 1L), Matchers.equalTo("a1"));
        assertThat("Division is double", Values.div(3L, 2L), Matchers.equalTo(1.5));
        assertThat("null propagates", Values.mul(null, 2L), Matchers.nullValue());
        Assertions.assertThrows(InvalidTypeException.class, () -> Values.sub("a", 1L));
    }

    @Test
    public void testRound() {
        assertThat("Wrong rounding", Values.round(1.14, 1), Matchers.equalTo(1.1));
        assertThat("Wrong rounding", Values.round(1.146, 2), Matchers.equalTo(1.15));
        assertThat("Wrong rounding", Values.round(1.005, 2), Matchers.equalTo(1.01));
        assertThat("Integers unchanged", Values.round(7L, 2), Matchers.equalTo(7L));
    }
}
