// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class DomainsTest {
    private static final ImmutableList<String> words = ImmutableList.of("ab", "abc", "cd", "bcd", "ef", "xyzw");
    private static final ImmutableList<Slot> slots = ImmutableList.of(
            new Slot(0, 0, Direction.ACROSS, 2),
            new Slot(0, 0, Direction.DOWN, 3),
            new Slot(0, 0, Direction.DOWN, 5));

    @Test
    public void seededByLength() {
        Domains d = new Domains(slots, words);
        assertThat(d.wordsOf(0), is(ImmutableSet.of("ab", "cd", "ef")));
        assertThat(d.wordsOf(1), is(ImmutableSet.of("abc", "bcd")));
        assertThat(d.size(2), is(0));
        assertThat(d.contains(0, 2), is(true));
        assertThat(d.contains(0, 1), is(false));
        assertThat(d.contains(1, 1), is(true));
    }

    @Test
    public void removeAndUndo() {
        Domains d = new Domains(slots, words);
        ImmutableList<ImmutableSet<String>> before = d.snapshot();
        int mark = d.mark();
        d.removeAt(0, 0);
        assertThat(d.size(0), is(2));
        assertThat(d.contains(0, 0), is(false));
        int inner = d.mark();
        d.removeAt(1, 1);
        d.removeAt(0, 1);
        assertThat(d.size(0), is(1));
        assertThat(d.size(1), is(1));
        d.undoTo(inner);
        assertThat(d.wordsOf(0), is(ImmutableSet.of("cd", "ef")));
        assertThat(d.wordsOf(1), is(ImmutableSet.of("abc", "bcd")));
        d.undoTo(mark);
        assertThat(d.snapshot(), is(before));
        for (int w = 0; w < words.size(); ++w) {
            assertThat(d.contains(0, w), is(words.get(w).length() == 2));
        }
    }

    @Test
    public void narrow() {
        Domains d = new Domains(slots, words);
        int mark = d.mark();
        d.narrow(0, 2);
        assertThat(d.wordsOf(0), is(ImmutableSet.of("cd")));
        assertThat(d.get(0, 0), is(2));
        d.undoTo(mark);
        assertThat(d.wordsOf(0), is(ImmutableSet.of("ab", "cd", "ef")));
        d.narrow(0, 4);
        assertThat(d.wordsOf(0), is(ImmutableSet.of("ef")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void narrowToAbsentWord() {
        new Domains(slots, words).narrow(0, 1);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void removeBeyondDomain() {
        Domains d = new Domains(slots, words);
        d.removeAt(1, 2);
    }
}
