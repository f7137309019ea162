package org.gopy.source.types;

public enum ObjectKind {
    VAR,
    FIELD,
    CONST,
    TYPE_NAME,
    FUNC,
    METHOD,
    PACKAGE,
    BUILTIN,
    NIL,
    LABEL
}
