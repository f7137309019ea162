package org.gopy.target;

public record PyPass() implements PyStmt {
}
