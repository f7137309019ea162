package org.gopy.target;

import java.util.List;

public record PyExceptHandler(PyExpr type, List<PyStmt> body) implements PyNode {

    public PyExceptHandler {
        body = List.copyOf(body);
    }
}
