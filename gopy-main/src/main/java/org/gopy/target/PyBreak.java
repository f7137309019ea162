package org.gopy.target;

public record PyBreak() implements PyStmt {
}
