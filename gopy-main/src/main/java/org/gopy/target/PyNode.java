package org.gopy.target;

/**
 * A node of the generated Python syntax tree. Nodes are immutable records and compare
 * structurally.
 */
public interface PyNode {
}
