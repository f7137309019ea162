package org.gopy.target;

public record PyUnaryOp(UnaryOperator op, PyExpr operand) implements PyExpr {
}
