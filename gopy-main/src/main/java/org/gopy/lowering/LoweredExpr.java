package org.gopy.lowering;

import java.util.List;

import org.gopy.target.PyExpr;
import org.gopy.target.PyStmt;

/**
 * A lowered expression plus the statements that must run before it, in order.
 */
public record LoweredExpr(PyExpr expr, List<PyStmt> hoisted) {

    public LoweredExpr {
        hoisted = List.copyOf(hoisted);
    }

    public static LoweredExpr of(PyExpr expr) {
        return new LoweredExpr(expr, List.of());
    }
}
