package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

public record BinaryExpr(Position position, Expr x, Token op, Expr y) implements Expr {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
