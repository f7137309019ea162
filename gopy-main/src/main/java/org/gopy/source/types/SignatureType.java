package org.gopy.source.types;

import java.util.List;

/**
 * Function signature. Parameters and results are variable objects so named results keep their
 * identity.
 */
public record SignatureType(List<GoObject> params, List<GoObject> results, boolean variadic) implements GoType {

    public SignatureType {
        params = List.copyOf(params);
        results = List.copyOf(results);
    }

    public boolean hasNamedResults() {
        return !results.isEmpty() && !results.get(0).name().isEmpty();
    }

    @Override
    public String toString() {
        return "func" + params.stream().map(p -> p.type().toString()).toList() + results.stream().map(r -> r.type().toString()).toList();
    }
}
