package org.gopy.target;

import java.util.List;

public record PyGlobal(List<String> names) implements PyStmt {

    public PyGlobal {
        names = List.copyOf(names);
    }
}
