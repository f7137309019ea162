package org.gopy.target;

import java.util.List;

public record PyCompare(PyExpr left, List<CmpOperator> ops, List<PyExpr> comparators) implements PyExpr {

    public PyCompare {
        ops = List.copyOf(ops);
        comparators = List.copyOf(comparators);
    }
}
