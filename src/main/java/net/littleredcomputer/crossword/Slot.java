// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import java.util.Objects;

/**
 * A maximal run of open cells in one direction: the position one word occupies.
 */
public final class Slot {
    private final int row;
    private final int col;
    private final Direction direction;
    private final int length;

    public Slot(int row, int col, Direction direction, int length) {
        if (length < 1) throw new IllegalArgumentException("slot length must be positive: " + length);
        this.row = row;
        this.col = col;
        this.direction = Objects.requireNonNull(direction);
        this.length = length;
    }

    public int row() { return row; }
    public int col() { return col; }
    public Direction direction() { return direction; }
    public int length() { return length; }

    /** @return row of the k-th cell of this slot */
    int rowOf(int k) { return row + k * direction.dRow; }

    /** @return column of the k-th cell of this slot */
    int colOf(int k) { return col + k * direction.dCol; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot)) return false;
        Slot s = (Slot) o;
        return row == s.row && col == s.col && length == s.length && direction == s.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col, direction, length);
    }

    @Override
    public String toString() {
        return String.format("%d,%d %s %d", row, col, direction, length);
    }
}
