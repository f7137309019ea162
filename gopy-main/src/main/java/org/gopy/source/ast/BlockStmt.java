package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

public record BlockStmt(Position position, List<Stmt> list) implements Stmt {

    public BlockStmt {
        list = List.copyOf(list);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
