package org.gopy.target;

/**
 * {@code True}, {@code False} or {@code None}.
 */
public record PyConstant(Value value) implements PyExpr {

    public enum Value {
        TRUE,
        FALSE,
        NONE
    }

    public static final PyConstant TRUE = new PyConstant(Value.TRUE);
    public static final PyConstant FALSE = new PyConstant(Value.FALSE);
    public static final PyConstant NONE = new PyConstant(Value.NONE);
}
