package org.gopy.source.types;

import java.util.List;

public record StructType(List<GoObject> fields) implements GoType {

    public StructType {
        fields = List.copyOf(fields);
        for (GoObject field : fields) {
            if (field.kind() != ObjectKind.FIELD) {
                throw new IllegalArgumentException("not a field: " + field);
            }
        }
    }

    public int numFields() {
        return fields.size();
    }

    public GoObject field(int i) {
        return fields.get(i);
    }

    @Override
    public String toString() {
        return "struct{" + fields.stream().map(f -> f.name() + " " + f.type()).toList() + "}";
    }
}
