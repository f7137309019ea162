package org.gopy.source.ast;

/**
 * A single line or block comment; {@code text} includes the comment markers.
 */
public record Comment(Position position, String text) {
}
