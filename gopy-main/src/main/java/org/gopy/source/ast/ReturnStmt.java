package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

public record ReturnStmt(Position position, List<Expr> results) implements Stmt {

    public ReturnStmt {
        results = List.copyOf(results);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
