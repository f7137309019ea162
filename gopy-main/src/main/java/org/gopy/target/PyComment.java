package org.gopy.target;

/**
 * A {@code #} comment; {@code text} follows the hash verbatim.
 */
public record PyComment(String text) implements PyStmt {
}
