package org.gopy.target;

import java.util.List;

public record PyFor(PyExpr target, PyExpr iter, List<PyStmt> body) implements PyStmt {

    public PyFor {
        body = List.copyOf(body);
    }
}
