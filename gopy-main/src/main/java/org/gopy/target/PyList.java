package org.gopy.target;

import java.util.List;

public record PyList(List<PyExpr> elts) implements PyExpr {

    public PyList {
        elts = List.copyOf(elts);
    }
}
