package org.gopy.target;

/**
 * Slice bounds; absent bounds are null.
 */
public record PySlice(PyExpr lower, PyExpr upper, PyExpr step) implements PyExpr {
}
