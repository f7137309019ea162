package org.gopy.target;

public interface PyExpr extends PyNode {
}
