// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

public enum Direction {
    ACROSS(0, 1),
    DOWN(1, 0);

    final int dRow;
    final int dCol;

    Direction(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }
}
