// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.crossword;

/**
 * Thrown when a set of slots cannot be turned into a well-defined overlap relation, e.g.
 * because two slots share more than one cell.
 */
public class MalformedLayoutException extends IllegalArgumentException {
    MalformedLayoutException(String message) {
        super(message);
    }
}
