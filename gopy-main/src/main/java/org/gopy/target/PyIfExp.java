package org.gopy.target;

public record PyIfExp(PyExpr test, PyExpr body, PyExpr orelse) implements PyExpr {
}
