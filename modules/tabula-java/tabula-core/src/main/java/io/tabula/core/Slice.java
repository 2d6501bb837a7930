/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.core;

/**
 * Positional range [start, end) used by iloc.
 */
public final class Slice {

    private final int start;
    private final int end;

    private Slice(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public static Slice of(int start, int end) {
        return new Slice(start, end);
    }

    public int start() {
        return start;
    }

    public int end() {
        return end;
    }

    @Override
    public String toString() {
        return String.format("[%d, %d)", start, end);
    }
}
