/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.io;

import io.tabula.core.DataFrame;
import io.tabula.errors.NotImplementedException;

public final class Parsers {

    private Parsers() {
    }

    public static DataFrame readCsv(String path) {
        throw new NotImplementedException(String.format("readCsv is not implemented, unable to read %s", path));
    }
}
