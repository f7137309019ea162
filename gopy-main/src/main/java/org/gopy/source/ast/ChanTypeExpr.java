package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

public record ChanTypeExpr(Position position, Expr value) implements Expr {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
