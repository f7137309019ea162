package org.gopy.source.types;

import java.util.List;

public record InterfaceType(List<GoObject> methods) implements GoType {

    public static final InterfaceType EMPTY = new InterfaceType(List.of());

    public InterfaceType {
        methods = List.copyOf(methods);
    }

    @Override
    public String toString() {
        return "interface{" + methods.stream().map(GoObject::name).toList() + "}";
    }
}
