package org.gopy.source.types;

public record MapType(GoType key, GoType value) implements GoType {

    @Override
    public String toString() {
        return "map[" + key + "]" + value;
    }
}
