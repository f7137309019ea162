package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

import java.util.List;

/**
 * An import, const, type or var declaration, possibly parenthesized.
 */
public record GenDecl(Position position, CommentGroup doc, Token tok, List<Spec> specs) implements Decl {

    public GenDecl {
        specs = List.copyOf(specs);
    }

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
