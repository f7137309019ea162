package org.gopy.source.types;

public record ChanType(GoType elem) implements GoType {

    @Override
    public String toString() {
        return "chan " + elem;
    }
}
