package org.gopy.source.ast;

public interface Expr extends Node {
}
