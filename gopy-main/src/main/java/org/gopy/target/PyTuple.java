package org.gopy.target;

import java.util.List;

public record PyTuple(List<PyExpr> elts) implements PyExpr {

    public PyTuple {
        elts = List.copyOf(elts);
    }
}
