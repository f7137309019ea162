package org.gopy.target;

import java.util.List;

public record PyDict(List<PyExpr> keys, List<PyExpr> values) implements PyExpr {

    public PyDict {
        keys = List.copyOf(keys);
        values = List.copyOf(values);
    }
}
