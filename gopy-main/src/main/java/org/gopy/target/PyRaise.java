package org.gopy.target;

public record PyRaise(PyExpr exc) implements PyStmt {
}
