package org.gopy.source.ast;

public enum LitKind {
    INT,
    FLOAT,
    IMAG,
    CHAR,
    STRING
}
