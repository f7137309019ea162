package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * {@code x.(T)}; {@code type} is null for the {@code x.(type)} form of a type switch.
 */
public record TypeAssertExpr(Position position, Expr x, Expr type) implements Expr {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
