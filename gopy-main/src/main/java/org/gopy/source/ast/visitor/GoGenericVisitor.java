package org.gopy.source.ast.visitor;

import org.gopy.source.ast.*;

/**
 * A visitor over the resolved source tree that returns a value and threads an argument.
 */
public interface GoGenericVisitor<R, A> {

    R visit(Ident n, A arg);

    R visit(BasicLit n, A arg);

    R visit(CompositeLit n, A arg);

    R visit(KeyValueExpr n, A arg);

    R visit(FuncLit n, A arg);

    R visit(ParenExpr n, A arg);

    R visit(SelectorExpr n, A arg);

    R visit(IndexExpr n, A arg);

    R visit(SliceExpr n, A arg);

    R visit(TypeAssertExpr n, A arg);

    R visit(CallExpr n, A arg);

    R visit(StarExpr n, A arg);

    R visit(UnaryExpr n, A arg);

    R visit(BinaryExpr n, A arg);

    R visit(ArrayTypeExpr n, A arg);

    R visit(MapTypeExpr n, A arg);

    R visit(StructTypeExpr n, A arg);

    R visit(FuncTypeExpr n, A arg);

    R visit(InterfaceTypeExpr n, A arg);

    R visit(ChanTypeExpr n, A arg);

    R visit(Ellipsis n, A arg);

    R visit(BadExpr n, A arg);

    R visit(BadStmt n, A arg);

    R visit(DeclStmt n, A arg);

    R visit(EmptyStmt n, A arg);

    R visit(LabeledStmt n, A arg);

    R visit(ExprStmt n, A arg);

    R visit(SendStmt n, A arg);

    R visit(IncDecStmt n, A arg);

    R visit(AssignStmt n, A arg);

    R visit(GoStmt n, A arg);

    R visit(DeferStmt n, A arg);

    R visit(ReturnStmt n, A arg);

    R visit(BranchStmt n, A arg);

    R visit(BlockStmt n, A arg);

    R visit(IfStmt n, A arg);

    R visit(CaseClause n, A arg);

    R visit(SwitchStmt n, A arg);

    R visit(TypeSwitchStmt n, A arg);

    R visit(SelectStmt n, A arg);

    R visit(ForStmt n, A arg);

    R visit(RangeStmt n, A arg);

    R visit(BadDecl n, A arg);

    R visit(GenDecl n, A arg);

    R visit(FuncDecl n, A arg);

    R visit(ImportSpec n, A arg);

    R visit(ValueSpec n, A arg);

    R visit(TypeSpec n, A arg);
}
