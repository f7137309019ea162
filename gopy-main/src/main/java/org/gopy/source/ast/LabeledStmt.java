package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

public record LabeledStmt(Position position, Ident label, Stmt stmt) implements Stmt {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
