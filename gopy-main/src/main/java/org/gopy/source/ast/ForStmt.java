package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

public record ForStmt(Position position, Stmt init, Expr cond, Stmt post, BlockStmt body) implements Stmt {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
