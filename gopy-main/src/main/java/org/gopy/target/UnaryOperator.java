package org.gopy.target;

public enum UnaryOperator {
    INVERT,
    NOT,
    UADD,
    USUB
}
