package org.gopy.target;

/**
 * String literal in Python syntax, quotes included.
 */
public record PyStr(String s) implements PyExpr {
}
