package org.gopy.target;

/**
 * Numeric literal in Python syntax.
 */
public record PyNum(String n) implements PyExpr {
}
