package org.gopy.target;

public record PyBinOp(PyExpr left, BinaryOperator op, PyExpr right) implements PyExpr {
}
