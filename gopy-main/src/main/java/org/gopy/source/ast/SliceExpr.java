package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * {@code x[low:high:max]}; absent bounds are null.
 */
public record SliceExpr(Position position, Expr x, Expr low, Expr high, Expr max) implements Expr {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
