package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * {@code alias} is set for {@code type A = B}.
 */
public record TypeSpec(Position position, CommentGroup doc, Ident name, boolean alias, Expr type) implements Spec {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
