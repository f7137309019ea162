package org.gopy.source.types;

public record ArrayType(GoType elem, long length) implements GoType {

    public ArrayType {
        if (length < 0) {
            throw new IllegalArgumentException("negative array length " + length);
        }
    }

    @Override
    public String toString() {
        return "[" + length + "]" + elem;
    }
}
