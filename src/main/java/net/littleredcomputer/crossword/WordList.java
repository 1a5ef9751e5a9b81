// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.io.Reader;
import java.io.StringReader;
import java.util.Locale;
import java.util.Scanner;

/**
 * Reads dictionaries: one word per line.
 */
public class WordList {
    private WordList() {}

    public static ImmutableList<String> parseFrom(String words) {
        return parseFrom(new StringReader(words));
    }

    /**
     * Words are trimmed and upper-cased; blank lines are skipped, and repeated words are
     * kept only at their first occurrence.
     * @param r source of the word list
     * @return the distinct words in file order
     */
    public static ImmutableList<String> parseFrom(Reader r) {
        ImmutableSet.Builder<String> words = ImmutableSet.builder();
        Scanner s = new Scanner(r);
        while (s.hasNextLine()) {
            String w = s.nextLine().trim();
            if (!w.isEmpty()) words.add(w.toUpperCase(Locale.ROOT));
        }
        return words.build().asList();
    }
}
