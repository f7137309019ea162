package org.gopy.source.ast;

public interface Spec extends Node {
}
