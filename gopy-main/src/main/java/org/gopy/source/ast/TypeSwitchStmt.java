package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

/**
 * {@code assign} is either {@code x := y.(type)} as an assignment or {@code y.(type)} as an expression statement.
 */
public record TypeSwitchStmt(Position position, Stmt init, Stmt assign, List<CaseClause> clauses) implements Stmt {

    public TypeSwitchStmt {
        clauses = List.copyOf(clauses);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
