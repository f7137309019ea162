package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

public record ImportSpec(Position position, Ident name, BasicLit path) implements Spec {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
