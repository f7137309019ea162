package org.gopy.target;

import java.util.List;

public record PyDocString(List<String> lines) implements PyStmt {

    public PyDocString {
        lines = List.copyOf(lines);
    }
}
