package org.gopy.lowering;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.gopy.source.ast.CaseClause;
import org.gopy.source.ast.Expr;
import org.gopy.source.types.GoType;
import org.gopy.target.Py;
import org.gopy.target.PyExpr;
import org.gopy.target.PyStmt;

/**
 * Lowers expressions. Statement and declaration lowering only reach expressions through this
 * interface, so the expression engine can be swapped independently.
 */
public interface ExpressionLowering {

    /**
     * Lowers an expression read as a value.
     */
    LoweredExpr lower(Expr expr, LoweringContext ctx);

    /**
     * Lowers an expression written to: an assignment target, an increment or a loop variable.
     */
    LoweredExpr lowerTarget(Expr expr, LoweringContext ctx);

    /**
     * The test of a switch case: {@code tag == v} for each listed value joined with {@code or},
     * or the values themselves for a tagless switch. Empty for the default clause.
     */
    Optional<LoweredExpr> caseClauseTest(CaseClause clause, PyExpr tag, LoweringContext ctx);

    /**
     * An expression evaluating to the runtime class standing for {@code type}.
     */
    PyExpr typeExpr(GoType type, LoweringContext ctx);

    default List<LoweredExpr> lowerAll(List<? extends Expr> exprs, LoweringContext ctx) {
        List<LoweredExpr> lowered = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            lowered.add(lower(expr, ctx));
        }
        return lowered;
    }

    default List<LoweredExpr> lowerTargets(List<? extends Expr> exprs, LoweringContext ctx) {
        List<LoweredExpr> lowered = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            lowered.add(lowerTarget(expr, ctx));
        }
        return lowered;
    }

    /**
     * One value as itself, several as a tuple, none as null. Hoisted statements keep source
     * order.
     */
    default LoweredExpr lowerTuple(List<? extends Expr> exprs, LoweringContext ctx) {
        HoistedStatements hoisted = new HoistedStatements();
        List<PyExpr> values = hoisted.addAll(lowerAll(exprs, ctx));
        List<PyStmt> stmts = hoisted.emit();
        return new LoweredExpr(Py.tupleOrSingle(values), stmts);
    }
}
