package org.gopy.target;

public record PyArg(String name) implements PyNode {
}
