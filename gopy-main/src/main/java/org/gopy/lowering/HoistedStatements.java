package org.gopy.lowering;

import java.util.ArrayList;
import java.util.List;

import org.gopy.target.PyExpr;
import org.gopy.target.PyStmt;

/**
 * Collects hoisted statements while the parts of one source statement are lowered, in source
 * order, and emits them ahead of the statement they belong to.
 */
public final class HoistedStatements {

    private final List<PyStmt> statements = new ArrayList<>();

    public PyExpr add(LoweredExpr lowered) {
        statements.addAll(lowered.hoisted());
        return lowered.expr();
    }

    public List<PyExpr> addAll(List<LoweredExpr> lowered) {
        List<PyExpr> exprs = new ArrayList<>(lowered.size());
        for (LoweredExpr each : lowered) {
            exprs.add(add(each));
        }
        return exprs;
    }

    public void addStatement(PyStmt stmt) {
        statements.add(stmt);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /**
     * The hoisted statements followed by {@code stmts}.
     */
    public List<PyStmt> emit(PyStmt... stmts) {
        List<PyStmt> result = new ArrayList<>(statements);
        result.addAll(List.of(stmts));
        return result;
    }
}
