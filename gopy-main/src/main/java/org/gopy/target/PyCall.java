package org.gopy.target;

import java.util.List;

public record PyCall(PyExpr func, List<PyExpr> args, List<PyKeyword> keywords) implements PyExpr {

    public PyCall {
        args = List.copyOf(args);
        keywords = List.copyOf(keywords);
    }
}
