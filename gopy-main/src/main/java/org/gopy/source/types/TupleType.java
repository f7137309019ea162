package org.gopy.source.types;

import java.util.List;

/**
 * The type of a multi-valued expression: a call with several results, or a comma-ok form.
 */
public record TupleType(List<GoType> types) implements GoType {

    public TupleType {
        types = List.copyOf(types);
    }

    public int size() {
        return types.size();
    }

    @Override
    public String toString() {
        return types.toString();
    }
}
