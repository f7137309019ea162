package org.gopy.target;

import java.util.List;

public record PyTry(List<PyStmt> body, List<PyExceptHandler> handlers, List<PyStmt> finalbody) implements PyStmt {

    public PyTry {
        body = List.copyOf(body);
        handlers = List.copyOf(handlers);
        finalbody = List.copyOf(finalbody);
    }
}
