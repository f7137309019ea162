package org.gopy.target;

import java.util.List;

public record PyClassDef(String name, List<PyExpr> bases, List<PyStmt> body) implements PyStmt {

    public PyClassDef {
        bases = List.copyOf(bases);
        body = List.copyOf(body);
    }
}
