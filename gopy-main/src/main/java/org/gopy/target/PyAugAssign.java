package org.gopy.target;

public record PyAugAssign(PyExpr target, BinaryOperator op, PyExpr value) implements PyStmt {
}
