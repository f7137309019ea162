package org.gopy.target;

import java.util.List;

public record PyListComp(PyExpr elt, List<PyComprehension> generators) implements PyExpr {

    public PyListComp {
        generators = List.copyOf(generators);
    }
}
