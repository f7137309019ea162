package org.gopy.target;

public record PySubscript(PyExpr value, PyExpr slice) implements PyExpr {
}
