package org.gopy.target;

import java.util.List;

/**
 * {@code t1, t2, ... = value}. Several targets form one tuple target, not a chain.
 */
public record PyAssign(List<PyExpr> targets, PyExpr value) implements PyStmt {

    public PyAssign {
        targets = List.copyOf(targets);
    }
}
