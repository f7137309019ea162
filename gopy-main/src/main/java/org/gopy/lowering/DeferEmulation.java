package org.gopy.lowering;

import java.util.List;

import org.gopy.source.ast.BlockStmt;
import org.gopy.source.ast.CaseClause;
import org.gopy.source.ast.DeferStmt;
import org.gopy.source.ast.ForStmt;
import org.gopy.source.ast.IfStmt;
import org.gopy.source.ast.LabeledStmt;
import org.gopy.source.ast.Node;
import org.gopy.source.ast.RangeStmt;
import org.gopy.source.ast.SelectStmt;
import org.gopy.source.ast.Stmt;
import org.gopy.source.ast.SwitchStmt;
import org.gopy.source.ast.TypeSwitchStmt;
import org.gopy.source.ast.visitor.GoGenericVisitorWithDefaults;
import org.gopy.target.Py;
import org.gopy.target.PyAssign;
import org.gopy.target.PyCall;
import org.gopy.target.PyFor;
import org.gopy.target.PyList;
import org.gopy.target.PyName;
import org.gopy.target.PyStarred;
import org.gopy.target.PyStmt;
import org.gopy.target.PyTry;

/**
 * Emulates {@code defer}: each deferred call is appended to a per-function capture list and the
 * body runs under {@code try/finally}, which replays the list in reverse.
 */
final class DeferEmulation {

    private static final DeferScanner SCANNER = new DeferScanner();

    private DeferEmulation() {
    }

    /**
     * True when a {@code defer} occurs in the body outside nested function literals.
     */
    static boolean containsDefer(BlockStmt body) {
        return body != null && body.accept(SCANNER, null);
    }

    static PyAssign initCaptureList(PyName captureList) {
        return Py.assign(captureList, new PyList(List.of()));
    }

    /**
     * <pre>
     * try:
     *     body
     * finally:
     *     for fun_N, args_N in reversed(defers_N):
     *         fun_N(*args_N)
     * </pre>
     */
    static PyTry wrap(PyName captureList, List<PyStmt> body, NamingScope scope) {
        PyName fun = Py.name(scope.temp("fun"));
        PyName args = Py.name(scope.temp("args"));
        PyCall replay = new PyCall(fun, List.of(new PyStarred(args)), List.of());
        PyFor unwind = new PyFor(Py.tuple(fun, args), Py.call(Py.REVERSED, captureList), List.of(Py.expr(replay)));
        return new PyTry(Py.orPass(body), List.of(), List.of(unwind));
    }

    /**
     * Walks statements only; expressions, and the function literals inside them, are not
     * entered.
     */
    static final class DeferScanner extends GoGenericVisitorWithDefaults<Boolean, Void> {

        @Override
        public Boolean defaultAction(Node n, Void arg) {
            return false;
        }

        @Override
        public Boolean visit(DeferStmt n, Void arg) {
            return true;
        }

        @Override
        public Boolean visit(BlockStmt n, Void arg) {
            return any(n.list());
        }

        @Override
        public Boolean visit(IfStmt n, Void arg) {
            return scan(n.init()) || scan(n.body()) || scan(n.elseStmt());
        }

        @Override
        public Boolean visit(ForStmt n, Void arg) {
            return scan(n.init()) || scan(n.post()) || scan(n.body());
        }

        @Override
        public Boolean visit(RangeStmt n, Void arg) {
            return scan(n.body());
        }

        @Override
        public Boolean visit(SwitchStmt n, Void arg) {
            return scan(n.init()) || any(n.clauses());
        }

        @Override
        public Boolean visit(TypeSwitchStmt n, Void arg) {
            return scan(n.init()) || any(n.clauses());
        }

        @Override
        public Boolean visit(CaseClause n, Void arg) {
            return any(n.body());
        }

        @Override
        public Boolean visit(SelectStmt n, Void arg) {
            return any(n.body());
        }

        @Override
        public Boolean visit(LabeledStmt n, Void arg) {
            return scan(n.stmt());
        }

        private boolean scan(Stmt stmt) {
            return stmt != null && stmt.accept(this, null);
        }

        private boolean any(List<? extends Stmt> stmts) {
            for (Stmt stmt : stmts) {
                if (scan(stmt)) {
                    return true;
                }
            }
            return false;
        }
    }
}
