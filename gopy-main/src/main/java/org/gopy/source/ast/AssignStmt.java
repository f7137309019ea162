package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

/**
 * Assignment, short variable declaration ({@link Token#DEFINE}) or compound assignment.
 */
public record AssignStmt(Position position, List<Expr> lhs, Token tok, List<Expr> rhs) implements Stmt {

    public AssignStmt {
        lhs = List.copyOf(lhs);
        rhs = List.copyOf(rhs);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
