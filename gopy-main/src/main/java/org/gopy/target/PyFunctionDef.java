package org.gopy.target;

import java.util.List;

public record PyFunctionDef(String name, PyArguments args, List<PyStmt> body) implements PyStmt {

    public PyFunctionDef {
        body = List.copyOf(body);
    }
}
