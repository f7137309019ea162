package org.gopy.target;

public record PyComprehension(PyExpr target, PyExpr iter) implements PyNode {
}
