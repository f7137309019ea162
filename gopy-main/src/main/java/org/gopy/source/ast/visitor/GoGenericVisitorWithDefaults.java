package org.gopy.source.ast.visitor;

import org.gopy.source.ast.*;

/**
 * Routes every node to {@link #defaultAction(Node, Object)} unless a subclass overrides its visit method.
 */
public abstract class GoGenericVisitorWithDefaults<R, A> implements GoGenericVisitor<R, A> {

    public abstract R defaultAction(Node n, A arg);

    @Override
    public R visit(Ident n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BasicLit n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CompositeLit n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(KeyValueExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FuncLit n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ParenExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(SelectorExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IndexExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(SliceExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(TypeAssertExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CallExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(StarExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(UnaryExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BinaryExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ArrayTypeExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(MapTypeExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(StructTypeExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FuncTypeExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(InterfaceTypeExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ChanTypeExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(Ellipsis n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BadExpr n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BadStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(DeclStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(EmptyStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(LabeledStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ExprStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(SendStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IncDecStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(AssignStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(GoStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(DeferStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ReturnStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BranchStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BlockStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(IfStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(CaseClause n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(SwitchStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(TypeSwitchStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(SelectStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ForStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(RangeStmt n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(BadDecl n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(GenDecl n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(FuncDecl n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ImportSpec n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(ValueSpec n, A arg) {
        return defaultAction(n, arg);
    }

    @Override
    public R visit(TypeSpec n, A arg) {
        return defaultAction(n, arg);
    }
}
