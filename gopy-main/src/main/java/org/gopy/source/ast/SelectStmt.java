package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

public record SelectStmt(Position position, List<Stmt> body) implements Stmt {

    public SelectStmt {
        body = List.copyOf(body);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
