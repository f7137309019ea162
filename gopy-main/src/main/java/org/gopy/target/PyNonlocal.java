package org.gopy.target;

import java.util.List;

public record PyNonlocal(List<String> names) implements PyStmt {

    public PyNonlocal {
        names = List.copyOf(names);
    }
}
