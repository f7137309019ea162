package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

/**
 * Composite literal. {@code type} is null when elided inside an enclosing literal.
 */
public record CompositeLit(Position position, Expr type, List<Expr> elements) implements Expr {

    public CompositeLit {
        elements = List.copyOf(elements);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
