package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

public record StructTypeExpr(Position position, FieldList fields) implements Expr {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
