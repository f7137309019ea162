package org.gopy.source.ast;

public interface Decl extends Node {
}
