// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import gnu.trove.list.array.TIntArrayList;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Scanner;

/**
 * The structure of a crossword puzzle: which cells are open, the slots (maximal runs of
 * open cells) that words must fill, and where pairs of slots cross.
 * <p>
 * Slots are numbered by their position in {@link #slots()}; the overlap table and the
 * neighbor lists are indexed by those numbers, which is how the solver refers to them.
 */
public class Crossword {
    static final char BLOCKED = '#';

    private final int height;
    private final int width;
    private final boolean[][] structure;  // true == open
    private final ImmutableList<Slot> slots;
    private final ImmutableMap<Slot, Integer> slotIndex;  // inverse of above mapping
    private final int[][] offsets;  // offsets[x][y] = position in x of the cell shared with y, or -1
    private final TIntArrayList[] neighbors;

    Crossword(boolean[][] structure, List<Slot> slots) {
        if (structure.length == 0) throw new IllegalArgumentException("structure has no rows");
        height = structure.length;
        width = structure[0].length;
        if (width == 0) throw new IllegalArgumentException("structure has no columns");
        this.structure = new boolean[height][];
        for (int i = 0; i < height; ++i) {
            if (structure[i].length != width) {
                throw new IllegalArgumentException(String.format(
                        "row %d has %d cells; expected %d", i, structure[i].length, width));
            }
            this.structure[i] = Arrays.copyOf(structure[i], width);
        }
        this.slots = ImmutableList.copyOf(slots);
        ImmutableMap.Builder<Slot, Integer> mb = new ImmutableMap.Builder<>();
        for (int x = 0; x < this.slots.size(); ++x) {
            Slot s = this.slots.get(x);
            for (int k = 0; k < s.length(); ++k) {
                if (!isOpen(s.rowOf(k), s.colOf(k))) {
                    throw new MalformedLayoutException("slot " + s + " covers a blocked or missing cell");
                }
            }
            mb.put(s, x);
        }
        try {
            slotIndex = mb.build();
        } catch (IllegalArgumentException e) {
            throw new MalformedLayoutException("duplicate slot: " + e.getMessage());
        }
        offsets = computeOverlaps();
        neighbors = new TIntArrayList[this.slots.size()];
        for (int x = 0; x < neighbors.length; ++x) {
            neighbors[x] = new TIntArrayList();
            for (int y = 0; y < neighbors.length; ++y) {
                if (offsets[x][y] >= 0) neighbors[x].add(y);
            }
        }
    }

    /**
     * Derives the slots of a grid: rows are scanned left to right for ACROSS slots, then
     * columns top to bottom for DOWN slots. A single open cell is not a word, so runs of
     * length 1 produce no slot.
     * @param structure rectangular grid of cells; true marks an open cell
     * @return the crossword with its slots and overlap relation
     */
    public static Crossword fromStructure(boolean[][] structure) {
        if (structure.length == 0) throw new IllegalArgumentException("structure has no rows");
        List<Slot> slots = new ArrayList<>();
        final int h = structure.length;
        final int w = structure[0].length;
        for (int i = 0; i < h; ++i) {
            if (structure[i].length != w) {
                throw new IllegalArgumentException(String.format(
                        "row %d has %d cells; expected %d", i, structure[i].length, w));
            }
            for (int j = 0; j < w; ++j) {
                if (!structure[i][j] || (j > 0 && structure[i][j - 1])) continue;
                int k = j;
                while (k < w && structure[i][k]) ++k;
                if (k - j > 1) slots.add(new Slot(i, j, Direction.ACROSS, k - j));
            }
        }
        for (int j = 0; j < w; ++j) {
            for (int i = 0; i < h; ++i) {
                if (!structure[i][j] || (i > 0 && structure[i - 1][j])) continue;
                int k = i;
                while (k < h && structure[k][j]) ++k;
                if (k - i > 1) slots.add(new Slot(i, j, Direction.DOWN, k - i));
            }
        }
        return new Crossword(structure, slots);
    }

    private int[][] computeOverlaps() {
        final int n = slots.size();
        int[][] o = new int[n][n];
        for (int[] row : o) Arrays.fill(row, -1);
        // Cell number -> position in slot x, for the slot x currently being compared.
        int[] position = new int[height * width];
        Arrays.fill(position, -1);
        for (int x = 0; x < n; ++x) {
            Slot sx = slots.get(x);
            for (int k = 0; k < sx.length(); ++k) position[cell(sx, k)] = k;
            for (int y = x + 1; y < n; ++y) {
                Slot sy = slots.get(y);
                int shared = 0;
                for (int k = 0; k < sy.length(); ++k) {
                    int p = position[cell(sy, k)];
                    if (p < 0) continue;
                    if (++shared > 1) {
                        throw new MalformedLayoutException(String.format(
                                "slots %s and %s share more than one cell", sx, sy));
                    }
                    o[x][y] = p;
                    o[y][x] = k;
                }
            }
            for (int k = 0; k < sx.length(); ++k) position[cell(sx, k)] = -1;
        }
        return o;
    }

    private int cell(Slot s, int k) {
        return s.rowOf(k) * width + s.colOf(k);
    }

    public int height() { return height; }
    public int width() { return width; }

    public boolean isOpen(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width && structure[row][col];
    }

    public ImmutableList<Slot> slots() {
        return slots;
    }

    public int indexOf(Slot s) {
        Integer x = slotIndex.get(s);
        if (x == null) throw new IllegalArgumentException("not a slot of this crossword: " + s);
        return x;
    }

    /**
     * @return the offsets at which the two slots cross, or empty if they don't (a slot
     * does not overlap itself)
     */
    public Optional<Overlap> overlap(Slot a, Slot b) {
        int x = indexOf(a);
        int y = indexOf(b);
        return offsets[x][y] < 0 ? Optional.empty() : Optional.of(new Overlap(offsets[x][y], offsets[y][x]));
    }

    public ImmutableSet<Slot> neighbors(Slot s) {
        TIntArrayList ns = neighbors[indexOf(s)];
        ImmutableSet.Builder<Slot> b = ImmutableSet.builder();
        for (int k = 0; k < ns.size(); ++k) b.add(slots.get(ns.get(k)));
        return b.build();
    }

    /** @return position in slot x of the cell it shares with slot y, or -1 */
    int offset(int x, int y) {
        return offsets[x][y];
    }

    TIntArrayList neighbors(int x) {
        return neighbors[x];
    }

    public static Crossword parseFrom(String structure) {
        return parseFrom(new StringReader(structure));
    }

    /**
     * Parses a grid layout: one line per row, in which {@code #} marks a blocked cell
     * and any other character (space included) an open one. Trailing empty lines are
     * ignored; every other line must have the same length.
     * @param r source of the layout
     * @return the crossword with its derived slots
     */
    public static Crossword parseFrom(Reader r) {
        List<String> lines = new ArrayList<>();
        Scanner s = new Scanner(r);
        while (s.hasNextLine()) lines.add(s.nextLine());
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) lines.remove(lines.size() - 1);
        if (lines.isEmpty()) throw new IllegalArgumentException("empty structure");
        boolean[][] structure = new boolean[lines.size()][];
        for (int i = 0; i < structure.length; ++i) {
            String line = lines.get(i);
            structure[i] = new boolean[line.length()];
            for (int j = 0; j < line.length(); ++j) structure[i][j] = line.charAt(j) != BLOCKED;
        }
        return fromStructure(structure);
    }
}
