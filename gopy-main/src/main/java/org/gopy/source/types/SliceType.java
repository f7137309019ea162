package org.gopy.source.types;

public record SliceType(GoType elem) implements GoType {

    @Override
    public String toString() {
        return "[]" + elem;
    }
}
