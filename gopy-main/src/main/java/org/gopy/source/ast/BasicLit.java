package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * A literal of basic type; {@code value} is the literal exactly as written in the source.
 */
public record BasicLit(Position position, LitKind kind, String value) implements Expr {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
