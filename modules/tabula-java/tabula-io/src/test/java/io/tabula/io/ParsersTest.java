/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.io;

import io.tabula.errors.NotImplementedException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ParsersTest {

    @Test
    public void testReadCsvNotImplemented() {
        Assertions.assertThrows(NotImplementedException.class, () -> Parsers.readCsv("data.csv"));
    }
}
