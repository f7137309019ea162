package org.gopy.target;

import java.util.List;

public record PyModule(List<PyStmt> body) implements PyNode {

    public PyModule {
        body = List.copyOf(body);
    }
}
