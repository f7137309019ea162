package org.gopy.target;

public record PyAttribute(PyExpr value, String attr) implements PyExpr {
}
