package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * The {@code ...T} type of a variadic parameter.
 */
public record Ellipsis(Position position, Expr elem) implements Expr {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
