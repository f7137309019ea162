package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * {@code break}, {@code continue}, {@code goto} or {@code fallthrough}; {@code label} may be null.
 */
public record BranchStmt(Position position, Token tok, Ident label) implements Stmt {

    @Override
    public <R, A> R accept(GoGenericVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }
}
