// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;

import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Words chosen for the slots of a crossword.
 */
public final class Assignment {
    private final ImmutableMap<Slot, String> words;

    Assignment(Map<Slot, String> words) {
        this.words = ImmutableMap.copyOf(words);
    }

    public String get(Slot s) {
        return words.get(s);
    }

    public int size() {
        return words.size();
    }

    public ImmutableMap<Slot, String> words() {
        return words;
    }

    public boolean isComplete(Crossword c) {
        return words.keySet().containsAll(c.slots());
    }

    /**
     * @return true if every word fits its slot, every pair of crossing slots agrees on the
     * shared letter, and no word is used twice
     */
    public boolean isConsistent(Crossword c) {
        Set<String> seen = new HashSet<>();
        for (Map.Entry<Slot, String> e : words.entrySet()) {
            if (e.getValue().length() != e.getKey().length()) return false;
            if (!seen.add(e.getValue())) return false;
            for (Slot t : c.neighbors(e.getKey())) {
                String u = words.get(t);
                if (u == null) continue;
                Optional<Overlap> o = c.overlap(e.getKey(), t);
                if (o.isPresent() && e.getValue().charAt(o.get().first()) != u.charAt(o.get().second())) return false;
            }
        }
        return true;
    }

    /**
     * @return the letters of the grid, row by row; cells no assigned slot covers hold 0
     */
    public char[][] letterGrid(Crossword c) {
        char[][] letters = new char[c.height()][c.width()];
        words.forEach((s, w) -> {
            for (int k = 0; k < s.length(); ++k) letters[s.rowOf(k)][s.colOf(k)] = w.charAt(k);
        });
        return letters;
    }

    /**
     * @return the filled grid as text: one line per row, with blocked cells shown as
     * {@code #} and open cells that no word covers as blanks
     */
    public String render(Crossword c) {
        char[][] letters = letterGrid(c);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < c.height(); ++i) {
            for (int j = 0; j < c.width(); ++j) {
                if (!c.isOpen(i, j)) sb.append(Crossword.BLOCKED);
                else sb.append(letters[i][j] == 0 ? ' ' : letters[i][j]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return words.toString();
    }
}
