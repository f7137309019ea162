package org.gopy.target;

public interface PyStmt extends PyNode {
}
