package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

public record SendStmt(Position position, Expr chan, Expr value) implements Stmt {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
