package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

/**
 * A case of a value or type switch. An empty {@code list} marks the default clause.
 */
public record CaseClause(Position position, List<Expr> list, List<Stmt> body) implements Stmt {

    public CaseClause {
        list = List.copyOf(list);
        body = List.copyOf(body);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
