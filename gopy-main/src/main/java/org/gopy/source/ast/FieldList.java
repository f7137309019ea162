package org.gopy.source.ast;

import java.util.List;

public record FieldList(List<Field> list) {

    public static final FieldList EMPTY = new FieldList(List.of());

    public FieldList {
        list = List.copyOf(list);
    }

    public static FieldList of(Field... fields) {
        return new FieldList(List.of(fields));
    }

    /**
     * Number of declared entries, counting each name of a group and each anonymous field once.
     */
    public int numFields() {
        int n = 0;
        for (Field field : list) {
            n += Math.max(1, field.names().size());
        }
        return n;
    }
}
