package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * {@code [N]T}, or {@code []T} when {@code length} is null.
 */
public record ArrayTypeExpr(Position position, Expr length, Expr elem) implements Expr {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
