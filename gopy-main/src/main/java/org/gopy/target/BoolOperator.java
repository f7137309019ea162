package org.gopy.target;

public enum BoolOperator {
    AND,
    OR
}
