package org.gopy.target;

public record PyKeyword(String arg, PyExpr value) implements PyNode {
}
