package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * Function or method declaration; {@code recv} is null for plain functions.
 */
public record FuncDecl(Position position, CommentGroup doc, FieldList recv, Ident name, FuncTypeExpr type, BlockStmt body) implements Decl {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
