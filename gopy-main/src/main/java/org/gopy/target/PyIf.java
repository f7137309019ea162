package org.gopy.target;

import java.util.List;

public record PyIf(PyExpr test, List<PyStmt> body, List<PyStmt> orelse) implements PyStmt {

    public PyIf {
        body = List.copyOf(body);
        orelse = List.copyOf(orelse);
    }
}
