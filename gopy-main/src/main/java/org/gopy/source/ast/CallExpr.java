package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

/**
 * {@code ellipsis} is set when the last argument is spread with {@code ...}.
 */
public record CallExpr(Position position, Expr fun, List<Expr> args, boolean ellipsis) implements Expr {

    public CallExpr {
        args = List.copyOf(args);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
