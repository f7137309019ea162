package org.gopy.target;

import java.util.List;

public record PyWhile(PyExpr test, List<PyStmt> body) implements PyStmt {

    public PyWhile {
        body = List.copyOf(body);
    }
}
