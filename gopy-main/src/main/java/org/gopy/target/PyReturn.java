package org.gopy.target;

/**
 * {@code value} is null for a bare {@code return}.
 */
public record PyReturn(PyExpr value) implements PyStmt {
}
