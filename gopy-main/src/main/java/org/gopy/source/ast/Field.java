package org.gopy.source.ast;

import java.util.List;

/**
 * A parameter, result, receiver or struct field group: {@code a, b int}. Anonymous
 * parameters have no names.
 */
public record Field(Position position, List<Ident> names, Expr type) {

    public Field {
        names = List.copyOf(names);
    }
}
