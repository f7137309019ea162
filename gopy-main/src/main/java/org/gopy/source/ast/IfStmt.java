package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * {@code init} and {@code elseStmt} may be null; {@code elseStmt} is a block or another if.
 */
public record IfStmt(Position position, Stmt init, Expr cond, BlockStmt body, Stmt elseStmt) implements Stmt {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
