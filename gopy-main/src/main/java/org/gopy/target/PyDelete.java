package org.gopy.target;

import java.util.List;

public record PyDelete(List<PyExpr> targets) implements PyStmt {

    public PyDelete {
        targets = List.copyOf(targets);
    }
}
