// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.List;

/**
 * The candidate words of every slot, with undo.
 * <p>
 * Each slot's domain is a sparse set: {@code values[x][0..size[x])} holds the live word
 * numbers and {@code position[x]} locates each candidate within that array. Removing a
 * value swaps it just past the live prefix and shrinks the prefix, recording the slot on
 * the trail. Because removals are undone in reverse order, restoring a value is just a
 * matter of growing the prefix again.
 */
class Domains {
    private final List<String> words;
    private final int[][] values;
    private final int[][] position;  // position[x][rank[w]] = index of word w in values[x]
    private final int[] rank;        // rank[w] = index of word w among the words of its length
    private final int[] size;
    private final TIntArrayStack trail = new TIntArrayStack();

    /**
     * Seeds each slot's domain with the words of that slot's length.
     * @param slots the variables
     * @param words distinct dictionary words, numbered by their position in this list
     */
    Domains(List<Slot> slots, List<String> words) {
        this.words = words;
        rank = new int[words.size()];
        int maxLength = 0;
        for (String w : words) maxLength = Math.max(maxLength, w.length());
        int[] count = new int[maxLength + 1];
        for (int w = 0; w < words.size(); ++w) rank[w] = count[words.get(w).length()]++;

        values = new int[slots.size()][];
        position = new int[slots.size()][];
        size = new int[slots.size()];
        for (int x = 0; x < slots.size(); ++x) {
            final int length = slots.get(x).length();
            final int n = length <= maxLength ? count[length] : 0;
            values[x] = new int[n];
            position[x] = new int[n];
            for (int w = 0; w < words.size() && size[x] < n; ++w) {
                if (words.get(w).length() != length) continue;
                position[x][rank[w]] = size[x];
                values[x][size[x]++] = w;
            }
        }
    }

    int size(int x) {
        return size[x];
    }

    /** @return the word number at index k (0 &lt;= k &lt; size(x)) of slot x's domain */
    int get(int x, int k) {
        return values[x][k];
    }

    boolean contains(int x, int w) {
        if (w < 0 || w >= rank.length) return false;
        int r = rank[w];
        return r < position[x].length && position[x][r] < size[x] && values[x][position[x][r]] == w;
    }

    /**
     * Removes the value at index k of slot x's domain. The value formerly at the end of
     * the live prefix takes its place, so callers scanning a domain while removing from it
     * should scan from the end.
     */
    void removeAt(int x, int k) {
        final int last = size[x] - 1;
        if (k < 0 || k > last) throw new IndexOutOfBoundsException("index " + k + " of domain of size " + size[x]);
        int w = values[x][k];
        int v = values[x][last];
        values[x][k] = v;
        position[x][rank[v]] = k;
        values[x][last] = w;
        position[x][rank[w]] = last;
        size[x] = last;
        trail.push(x);
    }

    /** Narrows slot x's domain to the single word w, which must be in it. */
    void narrow(int x, int w) {
        if (!contains(x, w)) throw new IllegalArgumentException("word " + words.get(w) + " not in domain of slot " + x);
        for (int k = size[x] - 1; k >= 0; --k) {
            if (values[x][k] != w) removeAt(x, k);
        }
    }

    /** @return a token that {@link #undoTo} can restore the present state from */
    int mark() {
        return trail.size();
    }

    /** Restores every value removed since the given mark was taken. */
    void undoTo(int mark) {
        while (trail.size() > mark) ++size[trail.pop()];
    }

    ImmutableSet<String> wordsOf(int x) {
        ImmutableSet.Builder<String> b = ImmutableSet.builder();
        for (int k = 0; k < size[x]; ++k) b.add(words.get(values[x][k]));
        return b.build();
    }

    /** @return a copy of every domain, for comparing states */
    ImmutableList<ImmutableSet<String>> snapshot() {
        ImmutableList.Builder<ImmutableSet<String>> b = ImmutableList.builder();
        for (int x = 0; x < size.length; ++x) b.add(wordsOf(x));
        return b.build();
    }
}
