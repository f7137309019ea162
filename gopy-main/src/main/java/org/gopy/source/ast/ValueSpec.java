package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

public record ValueSpec(Position position, CommentGroup doc, List<Ident> names, Expr type, List<Expr> values) implements Spec {

    public ValueSpec {
        names = List.copyOf(names);
        values = List.copyOf(values);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
