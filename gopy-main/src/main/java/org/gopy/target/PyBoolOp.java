package org.gopy.target;

import java.util.List;

public record PyBoolOp(BoolOperator op, List<PyExpr> values) implements PyExpr {

    public PyBoolOp {
        values = List.copyOf(values);
    }
}
