package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

public record SwitchStmt(Position position, Stmt init, Expr tag, List<CaseClause> clauses) implements Stmt {

    public SwitchStmt {
        clauses = List.copyOf(clauses);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
