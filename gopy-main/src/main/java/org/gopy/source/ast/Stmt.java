package org.gopy.source.ast;

public interface Stmt extends Node {
}
