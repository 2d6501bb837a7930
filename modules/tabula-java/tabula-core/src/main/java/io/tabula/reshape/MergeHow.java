/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.reshape;

import io.tabula.errors.MergeException;

public enum MergeHow {
    INNER,
    OUTER;

    public static MergeHow of(String how) {
        for (MergeHow value : values()) {
            if (value.name().equalsIgnoreCase(how)) {
                return value;
            }
        }
        throw new MergeException(String.format("MergeError: %s not a supported merge type", how));
    }
}
