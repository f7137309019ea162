package org.gopy.target;

public record PyExprStmt(PyExpr value) implements PyStmt {
}
