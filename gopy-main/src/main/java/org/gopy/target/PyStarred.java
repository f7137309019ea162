package org.gopy.target;

public record PyStarred(PyExpr value) implements PyExpr {
}
