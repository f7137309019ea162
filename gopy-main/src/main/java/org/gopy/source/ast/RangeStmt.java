package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * {@code for key, value := range x}; {@code key} and {@code value} may be null.
 */
public record RangeStmt(Position position, Expr key, Expr value, Token tok, Expr x, BlockStmt body) implements Stmt {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
