package org.gopy.target;

public record PyName(String id) implements PyExpr {
}
