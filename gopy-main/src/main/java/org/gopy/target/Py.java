package org.gopy.target;

import java.util.ArrayList;
import java.util.List;

/**
 * Factory helpers for building Python trees.
 */
public final class Py {

    public static final PyName RANGE = name("range");
    public static final PyName LEN = name("len");
    public static final PyName ENUMERATE = name("enumerate");
    public static final PyName REVERSED = name("reversed");
    public static final PyName ORD = name("ord");
    public static final PyName MAP = name("map");
    public static final PyName TYPE = name("type");
    public static final PyName ISINSTANCE = name("isinstance");
    public static final PyName HASATTR = name("hasattr");
    public static final PyName KEY_ERROR = name("KeyError");
    public static final PyName EXCEPTION = name("Exception");
    public static final PyName PRINT = name("print");
    public static final PyName DISCARD = name("_");

    public static final PyPass PASS = new PyPass();

    private Py() {
    }

    public static PyName name(String id) {
        return new PyName(id);
    }

    public static PyNum num(long n) {
        return new PyNum(Long.toString(n));
    }

    public static PyNum num(String n) {
        return new PyNum(n);
    }

    public static PyStr str(String literal) {
        return new PyStr(literal);
    }

    public static PyCall call(PyExpr func, PyExpr... args) {
        return new PyCall(func, List.of(args), List.of());
    }

    public static PyCall call(PyExpr func, List<PyExpr> args) {
        return new PyCall(func, args, List.of());
    }

    public static PyAttribute attr(PyExpr value, String attr) {
        return new PyAttribute(value, attr);
    }

    public static PyExprStmt expr(PyExpr value) {
        return new PyExprStmt(value);
    }

    public static PyAssign assign(PyExpr target, PyExpr value) {
        return new PyAssign(List.of(target), value);
    }

    public static PyTuple tuple(PyExpr... elts) {
        return new PyTuple(List.of(elts));
    }

    public static PyCompare compare(PyExpr left, CmpOperator op, PyExpr right) {
        return new PyCompare(left, List.of(op), List.of(right));
    }

    /**
     * A single value as itself, several values as a tuple, no values as null.
     */
    public static PyExpr tupleOrSingle(List<PyExpr> values) {
        if (values.isEmpty()) {
            return null;
        }
        if (values.size() == 1) {
            return values.get(0);
        }
        return new PyTuple(values);
    }

    /**
     * The body itself, or a lone {@code pass} if it is empty, since Python blocks cannot be.
     */
    public static List<PyStmt> orPass(List<PyStmt> body) {
        return body.isEmpty() ? List.of(PASS) : body;
    }

    public static List<PyStmt> concat(List<? extends PyStmt> first, List<? extends PyStmt> second) {
        List<PyStmt> result = new ArrayList<>(first.size() + second.size());
        result.addAll(first);
        result.addAll(second);
        return result;
    }
}
