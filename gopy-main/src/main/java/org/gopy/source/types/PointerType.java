package org.gopy.source.types;

public record PointerType(GoType elem) implements GoType {

    @Override
    public String toString() {
        return "*" + elem;
    }
}
