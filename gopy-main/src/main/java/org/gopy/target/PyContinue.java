package org.gopy.target;

public record PyContinue() implements PyStmt {
}
