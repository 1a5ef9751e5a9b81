// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

/**
 * Offsets of the one cell two slots share: character {@code first} of the first slot's word
 * must equal character {@code second} of the second slot's word.
 */
public final class Overlap {
    private final int first;
    private final int second;

    Overlap(int first, int second) {
        this.first = first;
        this.second = second;
    }

    public int first() { return first; }
    public int second() { return second; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Overlap)) return false;
        Overlap that = (Overlap) o;
        return first == that.first && second == that.second;
    }

    @Override
    public int hashCode() {
        return 31 * first + second;
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
